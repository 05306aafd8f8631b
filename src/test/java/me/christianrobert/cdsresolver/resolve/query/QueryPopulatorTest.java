package me.christianrobert.cdsresolver.resolve.query;

import me.christianrobert.cdsresolver.config.ResolverConfig;
import me.christianrobert.cdsresolver.diagnostics.Severity;
import me.christianrobert.cdsresolver.model.AnnotationAssignment;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.expr.Literal;
import me.christianrobert.cdsresolver.service.ModelResolverService;
import me.christianrobert.cdsresolver.service.ResolveResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.cdsresolver.TestModels.element;
import static me.christianrobert.cdsresolver.TestModels.entity;
import static me.christianrobert.cdsresolver.TestModels.key;
import static me.christianrobert.cdsresolver.TestModels.loc;
import static me.christianrobert.cdsresolver.TestModels.model;
import static me.christianrobert.cdsresolver.TestModels.source;
import static me.christianrobert.cdsresolver.TestModels.view;
import static org.junit.jupiter.api.Assertions.*;

class QueryPopulatorTest {

    @Test
    void specifiedElementsAnnotateInferredElements() {
        // Given: entity V { a @title: 'A'; c: String; } as select from E;
        //        with entity E { key a: Integer; b: String; }
        Artifact e = entity("E", key("a", "Integer"), element("b", "String"));
        Artifact a = element("a", "Integer");
        a.addAnnotationAssignment(new AnnotationAssignment("@title", Literal.string("A", loc()), loc()));
        Artifact v = view("V", "E");
        v.ensureElements().put("a", a);
        v.ensureElements().put("c", element("c", "String"));

        // When
        ResolveResult result = new ModelResolverService(new ResolverConfig()).resolve(model(source("views.cds", e, v)));

        // Then
        assertEquals(List.of("a", "b"), List.copyOf(v.getElements().keySet()));
        assertNotSame(a, v.getElements().get("a"));
        assertTrue(v.getElements().get("a").getAnnotationAssignments().containsKey("@title"));

        assertEquals(1, result.getDiagnostics().byId("query-missing-element").size());
        assertEquals("b", result.getDiagnostics().byId("query-missing-element").get(0).getArgs().get("id"));
        assertEquals(Severity.INFO, result.getDiagnostics().byId("query-missing-element").get(0).getSeverity());

        assertEquals(1, result.getDiagnostics().byId("query-unspecified-element").size());
        assertEquals("c", result.getDiagnostics().byId("query-unspecified-element").get(0).getArgs().get("id"));
        assertTrue(result.isFailure());
    }
}
