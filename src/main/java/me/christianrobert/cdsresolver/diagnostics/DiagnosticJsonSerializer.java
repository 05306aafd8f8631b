package me.christianrobert.cdsresolver.diagnostics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.cdsresolver.model.Location;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Renders diagnostics as JSON for tooling.
 *
 * Format of one entry:
 * {
 *   "id": "ref-undefined-art",
 *   "severity": "Error",
 *   "message": "No artifact has been found with name “X”",
 *   "location": { "file": "a.cds", "line": 3, "col": 12 },
 *   "home": "entity:“E”/element:“x”",
 *   "validNames": [ ... ]
 * }
 */
@ApplicationScoped
public class DiagnosticJsonSerializer {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticJsonSerializer.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    public ArrayNode toJsonNode(List<Diagnostic> diagnostics) {
        ArrayNode array = objectMapper.createArrayNode();
        for (Diagnostic diagnostic : diagnostics) {
            array.add(toJsonNode(diagnostic));
        }
        return array;
    }

    public ObjectNode toJsonNode(Diagnostic diagnostic) {
        ObjectNode node = objectMapper.createObjectNode();
        if (diagnostic.getId() != null) {
            node.put("id", diagnostic.getId());
        } else {
            node.putNull("id");
        }
        node.put("severity", diagnostic.getSeverity().getLabel());
        node.put("message", diagnostic.getMessage());
        Location location = diagnostic.getLocation();
        if (location != null) {
            ObjectNode loc = node.putObject("location");
            loc.put("file", location.getFile());
            loc.put("line", location.getLine());
            loc.put("col", location.getCol());
        }
        if (diagnostic.getHome() != null) {
            node.put("home", diagnostic.getHome());
        }
        if (!diagnostic.getValidNames().isEmpty()) {
            ArrayNode names = node.putArray("validNames");
            diagnostic.getValidNames().forEach(names::add);
        }
        return node;
    }

    /**
     * Serializes the diagnostics to a JSON array string.
     */
    public String toJson(List<Diagnostic> diagnostics) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJsonNode(diagnostics));
        } catch (Exception e) {
            log.error("Failed to serialize {} diagnostics: {}", diagnostics.size(), e.getMessage());
            return fallbackJson(e.getMessage());
        }
    }

    // Quotes in the reason must stay escaped
    String fallbackJson(String reason) {
        ArrayNode array = objectMapper.createArrayNode();
        ObjectNode node = array.addObject();
        node.put("severity", Severity.ERROR.getLabel());
        node.put("message", "Serialization failed: " + reason);
        return array.toString();
    }

    /**
     * Summary counts per severity, e.g. for logging.
     */
    public ObjectNode summary(Diagnostics diagnostics) {
        ObjectNode node = objectMapper.createObjectNode();
        for (Severity severity : Severity.values()) {
            node.put(severity.getLabel().toLowerCase(), diagnostics.count(severity));
        }
        node.put("total", diagnostics.size());
        return node;
    }
}
