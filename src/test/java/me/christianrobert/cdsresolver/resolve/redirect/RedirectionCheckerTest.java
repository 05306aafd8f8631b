package me.christianrobert.cdsresolver.resolve.redirect;

import me.christianrobert.cdsresolver.config.ResolverConfig;
import me.christianrobert.cdsresolver.diagnostics.Diagnostic;
import me.christianrobert.cdsresolver.diagnostics.Severity;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.service.ModelResolverService;
import me.christianrobert.cdsresolver.service.ResolveResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.cdsresolver.TestModels.association;
import static me.christianrobert.cdsresolver.TestModels.column;
import static me.christianrobert.cdsresolver.TestModels.element;
import static me.christianrobert.cdsresolver.TestModels.entity;
import static me.christianrobert.cdsresolver.TestModels.from;
import static me.christianrobert.cdsresolver.TestModels.key;
import static me.christianrobert.cdsresolver.TestModels.loc;
import static me.christianrobert.cdsresolver.TestModels.model;
import static me.christianrobert.cdsresolver.TestModels.select;
import static me.christianrobert.cdsresolver.TestModels.source;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Explicit {@code redirected to} on view columns.
 *
 * <pre>
 * entity B { key bId: Integer; name: String; }
 * entity A { key id: Integer; b: Association to B; }
 * </pre>
 */
class RedirectionCheckerTest {

    private Artifact a;
    private Artifact b;

    @BeforeEach
    void setUp() {
        b = entity("B", key("bId", "Integer"), element("name", "String"));
        a = entity("A", key("id", "Integer"), association("b", "B"));
    }

    private static Artifact redirected(String path, String target) {
        Artifact col = column(path);
        col.setTarget(Reference.of(target, loc()));
        return col;
    }

    @Test
    void redirectionToOriginalTargetIsOnlyInfo() {
        // Given: entity V as select from A { id, b : redirected to B };
        Artifact col = redirected("b", "B");
        Artifact v = select("V", from("A"), column("id"), col);

        // When
        ResolveResult result = new ModelResolverService(new ResolverConfig()).resolve(model(source("views.cds", a, b, v)));

        // Then
        assertTrue(result.isSuccess(), result.toString());
        List<Diagnostic> same = result.getDiagnostics().byId("redirected-to-same");
        assertEquals(1, same.size());
        assertEquals(Severity.INFO, same.get(0).getSeverity());
        assertSame(b, col.getTarget().getArtifact());
        assertEquals(List.of("bId"), List.copyOf(a.getElements().get("b").getForeignKeys().keySet()));
        assertEquals(List.of("bId"), List.copyOf(col.getForeignKeys().keySet()));
        assertTrue(result.getDiagnostics().byId("rewrite-key-not-covered-implicit").isEmpty());
    }

    @Test
    void redirectionToProjectionOfTargetMapsForeignKeys() {
        // Given: entity BV as select from B;
        //        entity V as select from A { id, b : redirected to BV };
        Artifact bv = select("BV", from("B"), column("bId"), column("name"));
        Artifact col = redirected("b", "BV");
        Artifact v = select("V", from("A"), column("id"), col);

        // When
        ResolveResult result = new ModelResolverService(new ResolverConfig()).resolve(model(source("views.cds", a, b, bv, v)));

        // Then
        assertTrue(result.isSuccess(), result.toString());
        assertTrue(result.getDiagnostics().byId("redirected-to-same").isEmpty());
        assertSame(bv, col.getTarget().getArtifact());
        Artifact fk = col.getForeignKeys().get("bId");
        assertNotNull(fk);
        assertSame(bv.getElements().get("bId"), fk.getTargetElement().getArtifact());
    }

    @Test
    void redirectionOfNonAssociationIsAnError() {
        // Given: entity V as select from A { id : redirected to B };
        Artifact v = select("V", from("A"), redirected("id", "B"));

        // When
        ResolveResult result = new ModelResolverService(new ResolverConfig()).resolve(model(source("views.cds", a, b, v)));

        // Then
        assertEquals(1, result.getDiagnostics().byId("redirected-no-assoc").size());
        assertTrue(result.isFailure());
    }
}
