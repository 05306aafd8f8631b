package me.christianrobert.cdsresolver.diagnostics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.christianrobert.cdsresolver.model.Location;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticJsonSerializerTest {

    private DiagnosticJsonSerializer serializer;

    @BeforeEach
    void setUp() {
        serializer = new DiagnosticJsonSerializer();
    }

    @Test
    void diagnosticIsRenderedWithLocationAndValidNames() {
        // Given
        Diagnostic diagnostic = new Diagnostic("ref-undefined-art", Severity.ERROR,
                new Location("books.cds", 3, 12), "entity:“Books”",
                "No artifact has been found with name “Author”", null);
        diagnostic.setValidNames(List.of("Authors", "Books"));

        // When
        ObjectNode node = serializer.toJsonNode(diagnostic);

        // Then
        assertEquals("ref-undefined-art", node.get("id").asText());
        assertEquals("Error", node.get("severity").asText());
        assertEquals("books.cds", node.get("location").get("file").asText());
        assertEquals(3, node.get("location").get("line").asInt());
        assertEquals(12, node.get("location").get("col").asInt());
        assertEquals("entity:“Books”", node.get("home").asText());
        assertEquals(2, node.get("validNames").size());
    }

    @Test
    void optionalFieldsAreOmitted() {
        Diagnostic diagnostic = new Diagnostic(null, Severity.INFO, null, null, "Note", null);

        ObjectNode node = serializer.toJsonNode(diagnostic);

        assertTrue(node.get("id").isNull());
        assertFalse(node.has("location"));
        assertFalse(node.has("home"));
        assertFalse(node.has("validNames"));
    }

    @Test
    void jsonStringParsesBackToArray() throws Exception {
        Diagnostic first = new Diagnostic("a", Severity.WARNING, null, null, "First", null);
        Diagnostic second = new Diagnostic("b", Severity.ERROR, null, null, "Second", null);

        String json = serializer.toJson(List.of(first, second));

        JsonNode parsed = new ObjectMapper().readTree(json);
        assertTrue(parsed.isArray());
        assertEquals(2, parsed.size());
        assertEquals("Second", parsed.get(1).get("message").asText());
    }

    @Test
    void summaryCountsPerSeverity() {
        Diagnostics diagnostics = new Diagnostics();
        diagnostics.error("duplicate-definition", new Location("a.cds", 1, 1), null, MessageArgs.of("name", "E"));
        diagnostics.warning("unexpected-key", new Location("a.cds", 2, 1), null, MessageArgs.none());

        ObjectNode summary = serializer.summary(diagnostics);

        assertEquals(1, summary.get("error").asInt());
        assertEquals(1, summary.get("warning").asInt());
        assertEquals(0, summary.get("info").asInt());
        assertEquals(2, summary.get("total").asInt());
    }

    @Test
    void emptyListGivesEmptyArray() {
        ArrayNode array = serializer.toJsonNode(List.of());

        assertEquals(0, array.size());
    }

    @Test
    void failedSerializationStillGivesValidJson() throws Exception {
        // Given: a diagnostic without severity cannot be rendered
        Diagnostic broken = new Diagnostic("a", null, null, null, "Broken", null);

        // When
        String json = serializer.toJson(List.of(broken));

        // Then
        JsonNode parsed = new ObjectMapper().readTree(json);
        assertEquals(1, parsed.size());
        assertEquals("Error", parsed.get(0).get("severity").asText());
        assertTrue(parsed.get(0).get("message").asText().startsWith("Serialization failed: "));
    }

    @Test
    void fallbackEscapesQuotesInReason() throws Exception {
        String json = serializer.fallbackJson("Cannot invoke \"Severity.getLabel()\" because it is null");

        JsonNode parsed = new ObjectMapper().readTree(json);
        assertEquals("Serialization failed: Cannot invoke \"Severity.getLabel()\" because it is null",
                parsed.get(0).get("message").asText());
    }
}
