package me.christianrobert.cdsresolver.resolve.cycle;

import me.christianrobert.cdsresolver.diagnostics.Diagnostic;
import me.christianrobert.cdsresolver.diagnostics.Diagnostics;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.LinkTable;
import me.christianrobert.cdsresolver.model.Location;
import me.christianrobert.cdsresolver.model.Model;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.cdsresolver.TestModels.loc;
import static org.junit.jupiter.api.Assertions.*;

class CycleDetectorTest {

    private Model model;
    private LinkTable links;
    private Diagnostics diagnostics;
    private CycleDetector detector;

    @BeforeEach
    void setUp() {
        model = new Model();
        links = model.getLinks();
        diagnostics = new Diagnostics();
        detector = new CycleDetector(links, diagnostics);
    }

    private Artifact type(String name) {
        Artifact art = Artifact.definition(Kind.TYPE, name, loc());
        model.addDefinition(art);
        return art;
    }

    @Test
    void reportsEveryLocatedEdgeOfACycle() {
        // Given: A -> B -> A
        Artifact a = type("A");
        Artifact b = type("B");
        Location ab = loc();
        Location ba = loc();
        links.dependsOn(a, b, ab);
        links.dependsOn(b, a, ba);

        // When
        int reported = detector.detectCycles(model.getNodes());

        // Then
        assertEquals(2, reported);
        List<Diagnostic> cyclic = diagnostics.byId("ref-cyclic");
        assertEquals(2, cyclic.size());
        assertSame(ab, cyclic.get(0).getLocation());
        assertSame(ba, cyclic.get(1).getLocation());
        assertTrue(diagnostics.hasErrors());
    }

    @Test
    void silentEdgesConnectButAreNotReported() {
        // Given: A -> B located, B -> A silent
        Artifact a = type("A");
        Artifact b = type("B");
        links.dependsOn(a, b, loc());
        links.dependsOnSilent(b, a);

        int reported = detector.detectCycles(model.getNodes());

        assertEquals(1, reported);
        assertEquals(1, diagnostics.byId("ref-cyclic").size());
    }

    @Test
    void silentCycleIsNotReported() {
        Artifact a = type("A");
        Artifact b = type("B");
        links.dependsOnSilent(a, b);
        links.dependsOnSilent(b, a);

        assertEquals(0, detector.detectCycles(model.getNodes()));
        assertEquals(0, diagnostics.size());
    }

    @Test
    void selfReferenceIsACycle() {
        Artifact a = type("A");
        links.dependsOn(a, a, loc());

        assertEquals(1, detector.detectCycles(model.getNodes()));
        assertEquals(1, diagnostics.byId("ref-cyclic").size());
    }

    @Test
    void acyclicDependenciesAreAccepted() {
        Artifact a = type("A");
        Artifact b = type("B");
        Artifact c = type("C");
        links.dependsOn(a, b, loc());
        links.dependsOn(b, c, loc());
        links.dependsOn(a, c, loc());

        assertEquals(0, detector.detectCycles(model.getNodes()));
        assertFalse(diagnostics.hasErrors());
    }
}
