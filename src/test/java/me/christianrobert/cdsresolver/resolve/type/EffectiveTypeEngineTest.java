package me.christianrobert.cdsresolver.resolve.type;

import me.christianrobert.cdsresolver.config.ResolverConfig;
import me.christianrobert.cdsresolver.diagnostics.Diagnostics;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Inferred;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.Model;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import me.christianrobert.cdsresolver.service.ModelResolverService;
import me.christianrobert.cdsresolver.service.ResolveResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.cdsresolver.TestModels.definition;
import static me.christianrobert.cdsresolver.TestModels.element;
import static me.christianrobert.cdsresolver.TestModels.entity;
import static me.christianrobert.cdsresolver.TestModels.key;
import static me.christianrobert.cdsresolver.TestModels.model;
import static me.christianrobert.cdsresolver.TestModels.source;
import static me.christianrobert.cdsresolver.TestModels.type;
import static org.junit.jupiter.api.Assertions.*;

/**
 * <pre>
 * type Base { a: Integer; b: String; }
 * type T : Base;
 * entity E { key id: Integer; t: T; }
 * </pre>
 */
class EffectiveTypeEngineTest {

    private Artifact base;
    private Artifact t;
    private Artifact e;

    @BeforeEach
    void setUp() {
        base = definition(Kind.TYPE, "Base", element("a", "Integer"), element("b", "String"));
        t = type("T", "Base");
        e = entity("E", key("id", "Integer"), element("t", "T"));
    }

    @Test
    void typeAliasOfStructureGetsElementCopies() {
        // When
        Model model = model(source("types.cds", base, t, e));
        ResolveResult result = new ModelResolverService(new ResolverConfig()).resolve(model);

        // Then
        assertTrue(result.isSuccess(), result.toString());
        assertEquals(List.of("a", "b"), List.copyOf(t.getElements().keySet()));
        Artifact a = t.getElements().get("a");
        assertNotSame(base.getElements().get("a"), a);
        assertEquals(Inferred.EXPAND_ELEMENT, a.getInferred());
        assertSame(base.getElements().get("a"), model.getLinks().origin(a));
        assertEquals(List.of("a", "b"), List.copyOf(e.getElements().get("t").getElements().keySet()));
    }

    @Test
    void effectiveTypeIsStableAcrossCalls() {
        // Given
        Model model = model(source("types.cds", base, t, e));
        ResolveContext ctx = new ResolveContext(model, new ResolverConfig(), new Diagnostics());
        ctx.linker().link();

        // When
        Artifact first = ctx.types().effectiveType(e.getElements().get("t"));
        Artifact second = ctx.types().effectiveType(e.getElements().get("t"));

        // Then
        assertNotNull(first);
        assertSame(first, second);
        assertSame(t, ctx.types().effectiveType(t));
        assertSame(base, ctx.types().effectiveType(base));
    }

    @Test
    void disabledExpansionKeepsAliasWithoutElements() {
        // Given
        ResolverConfig config = new ResolverConfig();
        config.setConfigValue(ResolverConfig.EXPAND_ELEMENTS, false);
        Model model = model(source("types.cds", base, t, e));

        // When
        ResolveResult result = new ModelResolverService(config).resolve(model);

        // Then
        assertTrue(result.isSuccess(), result.toString());
        assertNull(t.getElements());
        assertNull(e.getElements().get("t").getElements());
    }
}
