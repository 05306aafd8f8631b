package me.christianrobert.cdsresolver.resolve.query;

import me.christianrobert.cdsresolver.config.ResolverConfig;
import me.christianrobert.cdsresolver.diagnostics.Diagnostic;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Inferred;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.model.expr.OperatorExpression;
import me.christianrobert.cdsresolver.model.expr.PathExpression;
import me.christianrobert.cdsresolver.model.query.JoinItem;
import me.christianrobert.cdsresolver.service.ModelResolverService;
import me.christianrobert.cdsresolver.service.ResolveResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.cdsresolver.TestModels.column;
import static me.christianrobert.cdsresolver.TestModels.element;
import static me.christianrobert.cdsresolver.TestModels.entity;
import static me.christianrobert.cdsresolver.TestModels.from;
import static me.christianrobert.cdsresolver.TestModels.key;
import static me.christianrobert.cdsresolver.TestModels.loc;
import static me.christianrobert.cdsresolver.TestModels.model;
import static me.christianrobert.cdsresolver.TestModels.select;
import static me.christianrobert.cdsresolver.TestModels.source;
import static me.christianrobert.cdsresolver.TestModels.wildcard;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Elements of views created from explicit columns and wildcards.
 */
class ColumnInitializerTest {

    private ModelResolverService service;

    @BeforeEach
    void setUp() {
        service = new ModelResolverService(new ResolverConfig());
    }

    private static PathExpression path(String dotted) {
        return new PathExpression(Reference.of(dotted, loc()), loc());
    }

    @Test
    void explicitColumnAfterWildcardKeepsSourcePosition() {
        // Given: entity E { key a: Integer; b: String; c: String; }
        //        entity V as select from E { *, b };
        Artifact e = entity("E", key("a", "Integer"), element("b", "String"), element("c", "String"));
        Artifact b = column("b");
        Artifact v = select("V", from("E"), wildcard(), b);

        // When
        ResolveResult result = service.resolve(model(source("views.cds", e, v)));

        // Then
        assertTrue(result.isSuccess(), result.toString());
        assertEquals(List.of("a", "b", "c"), List.copyOf(v.getElements().keySet()));
        assertSame(b, v.getElements().get("b"));
        assertEquals(Inferred.WILDCARD, v.getElements().get("a").getInferred());
        assertNull(b.getInferred());
    }

    @Test
    void explicitColumnsOnlyGiveTheirElements() {
        Artifact e = entity("E", key("a", "Integer"), element("b", "String"), element("c", "String"));
        Artifact v = select("V", from("E"), column("c"), column("a"));

        ResolveResult result = service.resolve(model(source("views.cds", e, v)));

        assertTrue(result.isSuccess(), result.toString());
        assertEquals(List.of("c", "a"), List.copyOf(v.getElements().keySet()));
    }

    @Test
    void wildcardOverJoinReportsAmbiguousNames() {
        // Given: entity A { x: Integer; p: Integer; }  entity B { x: Integer; q: Integer; }
        //        entity V as select from A join B on A.p = B.q { * };
        Artifact a = entity("A", element("x", "Integer"), element("p", "Integer"));
        Artifact b = entity("B", element("x", "Integer"), element("q", "Integer"));
        OperatorExpression on = new OperatorExpression("=", List.of(path("A.p"), path("B.q")), loc());
        JoinItem join = new JoinItem("inner", List.of(from("A"), from("B")), on, loc());
        Artifact v = select("V", join, wildcard());

        // When
        ResolveResult result = service.resolve(model(source("views.cds", a, b, v)));

        // Then
        List<Diagnostic> ambiguous = result.getDiagnostics().byId("wildcard-ambiguous");
        assertEquals(1, ambiguous.size());
        assertEquals("x", ambiguous.get(0).getArgs().get("id"));
        assertEquals(List.of("A.x", "B.x"), ambiguous.get(0).getArgs().get("names"));
        assertEquals(List.of("p", "q"), List.copyOf(v.getElements().keySet()));
    }
}
