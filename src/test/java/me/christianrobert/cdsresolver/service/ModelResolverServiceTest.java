package me.christianrobert.cdsresolver.service;

import me.christianrobert.cdsresolver.config.ResolverConfig;
import me.christianrobert.cdsresolver.diagnostics.Severity;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.Model;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static me.christianrobert.cdsresolver.TestModels.definition;
import static me.christianrobert.cdsresolver.TestModels.element;
import static me.christianrobert.cdsresolver.TestModels.entity;
import static me.christianrobert.cdsresolver.TestModels.key;
import static me.christianrobert.cdsresolver.TestModels.model;
import static me.christianrobert.cdsresolver.TestModels.source;
import static me.christianrobert.cdsresolver.TestModels.type;
import static me.christianrobert.cdsresolver.TestModels.view;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * End-to-end tests of the resolve phases on small models.
 */
class ModelResolverServiceTest {

    private ModelResolverService service;

    @BeforeEach
    void setUp() {
        service = new ModelResolverService(new ResolverConfig());
    }

    @Test
    void nullModelFails() {
        ResolveResult result = service.resolve(null);

        assertTrue(result.isFailure());
        assertEquals("Model cannot be null", result.getErrorMessage());
        assertTrue(result.getMessages().isEmpty());
    }

    @Test
    void simpleEntityResolvesWithoutMessages() {
        // Given: entity Books { key ID: Integer; title: String; }
        Model model = model(source("books.cds",
                entity("Books", key("ID", "Integer"), element("title", "String"))));

        // When
        ResolveResult result = service.resolve(model);

        // Then
        assertTrue(result.isSuccess(), result.toString());
        assertTrue(result.getResolvedCount() > 0);
        assertFalse(result.getDiagnostics().hasErrors());
    }

    @Test
    void undefinedTypeIsReported() {
        Model model = model(source("books.cds",
                entity("Books", key("ID", "Integer"), element("author", "Author"))));

        ResolveResult result = service.resolve(model);

        assertTrue(result.isFailure());
        assertEquals(1, result.getDiagnostics().byId("ref-undefined-art").size());
        assertTrue(result.getErrorMessage().endsWith("error(s) reported"));
    }

    @Test
    void cyclicTypesAreReported() {
        // Given: type A : B; type B : A;
        Model model = model(source("types.cds", type("A", "B"), type("B", "A")));

        ResolveResult result = service.resolve(model);

        assertTrue(result.isFailure());
        assertFalse(result.getDiagnostics().byId("ref-cyclic").isEmpty());
    }

    @Test
    void viewGetsElementsAndKeysOfItsSource() {
        // Given: entity V as select from E;
        Artifact e = entity("E", key("id", "Integer"), element("name", "String"));
        Artifact v = view("V", "E");
        Model model = model(source("views.cds", e, v));

        // When
        ResolveResult result = service.resolve(model);

        // Then
        assertTrue(result.isSuccess(), result.toString());
        assertEquals(List.of("id", "name"), List.copyOf(v.getElements().keySet()));
        assertTrue(v.getElements().get("id").isKey());
        assertFalse(v.getElements().get("name").isKey());
        assertTrue(model.getEntities().contains(v));
    }

    @Test
    void duplicateDefinitionFails() {
        Model model = model(source("a.cds", entity("Books")), source("b.cds", entity("Books")));

        ResolveResult result = service.resolve(model);

        assertTrue(result.isFailure());
        assertEquals(1, result.getDiagnostics().byId("duplicate-definition").size());
    }

    @Test
    void keyOutsideEntityIsAWarning() {
        // Given: type T { key id: Integer; }
        Model model = model(source("types.cds", definition(Kind.TYPE, "T", key("id", "Integer"))));

        ResolveResult result = service.resolve(model);

        assertTrue(result.isSuccess(), result.toString());
        assertEquals(1, result.getDiagnostics().byId("unexpected-key").size());
        assertEquals(Severity.WARNING, result.getDiagnostics().byId("unexpected-key").get(0).getSeverity());
    }

    @Test
    void severityOverridesComeFromConfiguration() {
        // Given
        ResolverConfig config = mock(ResolverConfig.class);
        when(config.isEnabled(anyString(), anyBoolean())).thenAnswer(inv -> inv.getArgument(1));
        when(config.getSeverityOverrides()).thenReturn(Map.of("unexpected-key", Severity.INFO));
        Model model = model(source("types.cds", definition(Kind.TYPE, "T", key("id", "Integer"))));

        // When
        ResolveResult result = new ModelResolverService(config).resolve(model);

        // Then
        assertTrue(result.isSuccess(), result.toString());
        assertEquals(Severity.INFO, result.getDiagnostics().byId("unexpected-key").get(0).getSeverity());
    }

    @Test
    void resolvingTheSameModelTwiceFails() {
        // Given
        Model model = model(source("books.cds", entity("Books", key("ID", "Integer"))));
        assertTrue(service.resolve(model).isSuccess());

        // When
        ResolveResult second = service.resolve(model);

        // Then
        assertTrue(second.isFailure());
        assertTrue(second.getErrorMessage().startsWith("Model has already been linked"), second.getErrorMessage());
        assertTrue(second.getErrorMessage().contains("Phase: link"), second.getErrorMessage());
        assertTrue(second.getDiagnostics().byId("duplicate-definition").isEmpty());
        assertNotNull(model.getDefinition("Books"));
    }
}
