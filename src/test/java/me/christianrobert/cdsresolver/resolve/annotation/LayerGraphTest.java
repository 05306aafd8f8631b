package me.christianrobert.cdsresolver.resolve.annotation;

import me.christianrobert.cdsresolver.model.Source;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LayerGraphTest {

    @Test
    void dependentSourceExtendsItsDependenciesTransitively() {
        Source a = new Source("a.cds");
        Source b = new Source("b.cds");
        Source c = new Source("c.cds");
        b.addDependency(a);
        c.addDependency(b);

        LayerGraph layers = new LayerGraph(List.of(a, b, c));

        assertTrue(layers.isExtending(c, a));
        assertTrue(layers.isExtending(c, b));
        assertTrue(layers.isExtending(b, a));
        assertFalse(layers.isExtending(a, c));
        assertTrue(layers.layerNumber(a) < layers.layerNumber(c));
    }

    @Test
    void cyclicSourcesFormOneLayer() {
        Source a = new Source("a.cds");
        Source b = new Source("b.cds");
        a.addDependency(b);
        b.addDependency(a);

        LayerGraph layers = new LayerGraph(List.of(a, b));

        assertSame(layers.layer(a), layers.layer(b));
        assertFalse(layers.isExtending(a, b));
        assertTrue(layers.extendedLayers(a).isEmpty());
    }

    @Test
    void unrelatedSourcesDoNotExtendEachOther() {
        Source a = new Source("a.cds");
        Source b = new Source("b.cds");

        LayerGraph layers = new LayerGraph(List.of(a, b));

        assertNotSame(layers.layer(a), layers.layer(b));
        assertFalse(layers.isExtending(a, b));
        assertFalse(layers.isExtending(b, a));
        assertNull(layers.layer(null));
    }
}
