package me.christianrobert.cdsresolver.resolve.query;

import me.christianrobert.cdsresolver.config.ResolverConfig;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.model.query.TableRef;
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
import static me.christianrobert.cdsresolver.TestModels.toMany;
import static me.christianrobert.cdsresolver.TestModels.view;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Key properties of view elements.
 *
 * <pre>
 * entity A { key id: Integer; name: String; bs: Association to many B; }
 * entity B { key id: Integer; x: String; }
 * </pre>
 */
class KeyPropagatorTest {

    private ModelResolverService service;
    private Artifact a;
    private Artifact b;

    @BeforeEach
    void setUp() {
        service = new ModelResolverService(new ResolverConfig());
        a = entity("A", key("id", "Integer"), element("name", "String"), toMany("bs", "B"));
        b = entity("B", key("id", "Integer"), element("x", "String"));
    }

    private ResolveResult resolve(Artifact v) {
        return service.resolve(model(source("views.cds", a, b, v)));
    }

    @Test
    void keyIsPropagatedFromSimpleProjection() {
        // Given: entity V as select from A;
        Artifact v = view("V", "A");

        // When
        ResolveResult result = resolve(v);

        // Then
        assertTrue(v.getElements().get("id").isKey());
        assertTrue(v.getElements().get("id").isKeyInferred());
        assertFalse(v.getElements().get("name").isKey());
        assertTrue(result.getDiagnostics().byId("query-missing-keys").isEmpty());
    }

    @Test
    void noKeyWhenSelectingFromToManyAssociation() {
        // Given: entity V as select from A:bs;
        Reference path = Reference.of("A.bs", loc());
        path.setArtifactSteps(1);
        Artifact v = select("V", new TableRef(path, null, loc()), column("id"), column("x"));

        // When
        ResolveResult result = resolve(v);

        // Then
        assertNotNull(v.getElements().get("id"));
        assertFalse(v.getElements().get("id").isKey());
        assertEquals(1, result.getDiagnostics().byId("query-from-many").size());
    }

    @Test
    void noKeyWhenNavigatingToManyAssociation() {
        // Given: entity V as select from A { id, bs.x };
        Artifact v = select("V", from("A"), column("id"), column("bs.x"));

        // When
        ResolveResult result = resolve(v);

        // Then
        assertEquals(2, v.getElements().size());
        assertFalse(v.getElements().get("id").isKey());
        assertEquals(1, result.getDiagnostics().byId("query-navigate-many").size());
    }

    @Test
    void noKeyWhenPartOfACompoundKeyIsMissing() {
        // Given: entity C { key k1: Integer; key k2: Integer; v: String; }
        //        entity V as select from C { k1, v };
        Artifact c = entity("C", key("k1", "Integer"), key("k2", "Integer"), element("v", "String"));
        Artifact v = select("V", from("C"), column("k1"), column("v"));

        // When
        ResolveResult result = service.resolve(model(source("views.cds", c, v)));

        // Then
        assertFalse(v.getElements().get("k1").isKey());
        assertEquals(1, result.getDiagnostics().byId("query-missing-keys").size());
        assertEquals(List.of("k2"), result.getDiagnostics().byId("query-missing-keys").get(0).getArgs().get("names"));
    }
}
