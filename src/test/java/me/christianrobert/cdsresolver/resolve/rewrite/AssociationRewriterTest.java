package me.christianrobert.cdsresolver.resolve.rewrite;

import me.christianrobert.cdsresolver.config.ResolverConfig;
import me.christianrobert.cdsresolver.diagnostics.Diagnostic;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Inferred;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.Name;
import me.christianrobert.cdsresolver.service.ModelResolverService;
import me.christianrobert.cdsresolver.service.ResolveResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.cdsresolver.TestModels.association;
import static me.christianrobert.cdsresolver.TestModels.column;
import static me.christianrobert.cdsresolver.TestModels.definition;
import static me.christianrobert.cdsresolver.TestModels.element;
import static me.christianrobert.cdsresolver.TestModels.entity;
import static me.christianrobert.cdsresolver.TestModels.from;
import static me.christianrobert.cdsresolver.TestModels.key;
import static me.christianrobert.cdsresolver.TestModels.model;
import static me.christianrobert.cdsresolver.TestModels.select;
import static me.christianrobert.cdsresolver.TestModels.source;
import static me.christianrobert.cdsresolver.TestModels.view;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Foreign keys of associations implicitly redirected into a service.
 *
 * <pre>
 * entity my.B { key bId: Integer; name: String; }
 * entity my.A { key id: Integer; b: Association to my.B; }
 * service S { entity A as projection on my.A; entity B as select from my.B { ... }; }
 * </pre>
 */
class AssociationRewriterTest {

    private Artifact a;
    private Artifact b;
    private Artifact serviceA;

    @BeforeEach
    void setUp() {
        b = entity("my.B", key("bId", "Integer"), element("name", "String"));
        a = entity("my.A", key("id", "Integer"), association("b", "my.B"));
        serviceA = view("S.A", "my.A");
    }

    private ResolveResult resolve(Artifact serviceB) {
        return new ModelResolverService(new ResolverConfig()).resolve(model(
                source("service.cds", b, a, definition(Kind.SERVICE, "S"), serviceA, serviceB)));
    }

    @Test
    void foreignKeyIsMappedToElementOfNewTarget() {
        // Given: entity S.B as select from my.B { bId, name };
        Artifact serviceB = select("S.B", from("my.B"), column("bId"), column("name"));

        // When
        ResolveResult result = resolve(serviceB);

        // Then
        assertTrue(result.isSuccess(), result.toString());
        Artifact assoc = serviceA.getElements().get("b");
        assertSame(serviceB, assoc.getTarget().getArtifact());
        Artifact fk = assoc.getForeignKeys().get("bId");
        assertNotNull(fk);
        assertEquals(Inferred.REWRITE, fk.getInferred());
        assertSame(serviceB.getElements().get("bId"), fk.getTargetElement().getArtifact());
    }

    @Test
    void foreignKeyMissingInNewTargetIsReported() {
        // Given: entity S.B as select from my.B { name };
        Artifact serviceB = select("S.B", from("my.B"), column("name"));

        // When
        ResolveResult result = resolve(serviceB);

        // Then
        assertSame(serviceB, serviceA.getElements().get("b").getTarget().getArtifact());
        List<Diagnostic> uncovered = result.getDiagnostics().byId("rewrite-key-not-covered-implicit");
        assertEquals(1, uncovered.size());
        assertEquals(List.of("bId"), uncovered.get(0).getArgs().get("names"));
        assertTrue(result.getDiagnostics().byId("rewrite-key-not-covered-explicit").isEmpty());
        assertTrue(result.isFailure());
    }

    @Test
    void renamedForeignKeyFollowsTheAlias() {
        // Given: entity S.B as select from my.B { bId as key_, name };
        Artifact renamed = column("bId");
        renamed.setName(new Name("key_", renamed.getLocation()));
        Artifact serviceB = select("S.B", from("my.B"), renamed, column("name"));

        // When
        ResolveResult result = resolve(serviceB);

        // Then
        assertTrue(result.getDiagnostics().byId("rewrite-key-not-covered-implicit").isEmpty());
        Artifact fk = serviceA.getElements().get("b").getForeignKeys().get("bId");
        assertSame(renamed, fk.getTargetElement().getArtifact());
        assertEquals("key_", fk.getTargetElement().head().getId());
    }
}
