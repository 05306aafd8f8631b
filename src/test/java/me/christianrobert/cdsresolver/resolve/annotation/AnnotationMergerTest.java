package me.christianrobert.cdsresolver.resolve.annotation;

import me.christianrobert.cdsresolver.config.ResolverConfig;
import me.christianrobert.cdsresolver.diagnostics.Diagnostics;
import me.christianrobert.cdsresolver.model.AnnotationAssignment;
import me.christianrobert.cdsresolver.model.AnnotationPriority;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Model;
import me.christianrobert.cdsresolver.model.Source;
import me.christianrobert.cdsresolver.model.expr.Expression;
import me.christianrobert.cdsresolver.model.expr.Literal;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static me.christianrobert.cdsresolver.TestModels.anno;
import static me.christianrobert.cdsresolver.TestModels.entity;
import static me.christianrobert.cdsresolver.TestModels.loc;
import static me.christianrobert.cdsresolver.TestModels.model;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for choosing annotation values across layers.
 */
class AnnotationMergerTest {

    private Source base;
    private Source extension;
    private Source unrelated;
    private Diagnostics diagnostics;
    private AnnotationMerger merger;
    private Artifact books;

    @BeforeEach
    void setUp() {
        base = new Source("base.cds");
        extension = new Source("extension.cds");
        extension.addDependency(base);
        unrelated = new Source("unrelated.cds");
        unrelated.addDependency(base);
        Model model = model(base, extension, unrelated);
        diagnostics = new Diagnostics();
        ResolveContext ctx = new ResolveContext(model, new ResolverConfig(), diagnostics);
        merger = new AnnotationMerger(ctx);
        books = entity("Books");
    }

    private static Literal str(String value) {
        return Literal.string(value, loc());
    }

    private static Literal array(Expression... items) {
        return Literal.array(List.of(items), loc());
    }

    private static List<Object> values(AnnotationAssignment assignment) {
        return ((Literal) assignment.getValue()).getItems().stream()
                .map(item -> ((Literal) item).getValue())
                .collect(Collectors.toList());
    }

    @Test
    void singleAssignmentIsChosen() {
        books.addAnnotationAssignment(anno("@title", str("Books"), base, AnnotationPriority.DEFINE));

        merger.chooseAnnotations(books);

        assertEquals("Books", ((Literal) books.getAnnotation("@title").getValue()).getValue());
        assertEquals(0, diagnostics.size());
    }

    @Test
    void extendingLayerWins() {
        // Given: defined in base, annotated in a source depending on base
        books.addAnnotationAssignment(anno("@title", str("Books"), base, AnnotationPriority.DEFINE));
        books.addAnnotationAssignment(anno("@title", str("Bücher"), extension, AnnotationPriority.ANNOTATE));

        // When
        merger.chooseAnnotations(books);

        // Then
        assertEquals("Bücher", ((Literal) books.getAnnotation("@title").getValue()).getValue());
        assertFalse(diagnostics.hasErrors());
    }

    @Test
    void higherPriorityWinsWithinLayer() {
        books.addAnnotationAssignment(anno("@title", str("Books"), base, AnnotationPriority.DEFINE));
        books.addAnnotationAssignment(anno("@title", str("Annotated"), base, AnnotationPriority.ANNOTATE));

        merger.chooseAnnotations(books);

        assertEquals("Annotated", ((Literal) books.getAnnotation("@title").getValue()).getValue());
        assertEquals(0, diagnostics.size());
    }

    @Test
    void unrelatedLayersAreReported() {
        // Given: two sources both depending on base, neither on the other
        books.addAnnotationAssignment(anno("@title", str("A"), extension, AnnotationPriority.ANNOTATE));
        books.addAnnotationAssignment(anno("@title", str("B"), unrelated, AnnotationPriority.ANNOTATE));

        merger.chooseAnnotations(books);

        assertEquals(2, diagnostics.byId("anno-duplicate-unrelated-layer").size());
        assertNotNull(books.getAnnotation("@title"));
    }

    @Test
    void duplicatesInOneLayerAreReported() {
        books.addAnnotationAssignment(anno("@title", str("A"), extension, AnnotationPriority.ANNOTATE));
        books.addAnnotationAssignment(anno("@title", str("B"), extension, AnnotationPriority.ANNOTATE));

        merger.chooseAnnotations(books);

        assertEquals(2, diagnostics.byId("anno-duplicate").size());
        assertTrue(diagnostics.byId("anno-duplicate-unrelated-layer").isEmpty());
    }

    @Test
    void ellipsisSplicesLowerLayerArray() {
        // Given: base [1, 2], extension ['0', ...]
        books.addAnnotationAssignment(anno("@values",
                array(str("1"), str("2")), base, AnnotationPriority.DEFINE));
        books.addAnnotationAssignment(anno("@values",
                array(str("0"), Literal.ellipsis(loc())), extension, AnnotationPriority.ANNOTATE));

        merger.chooseAnnotations(books);

        assertEquals(List.of("0", "1", "2"), values(books.getAnnotation("@values")));
        assertEquals(0, diagnostics.size());
    }

    @Test
    void ellipsisWithinLayerUsesDefiningValue() {
        books.addAnnotationAssignment(anno("@values",
                array(str("a")), base, AnnotationPriority.DEFINE));
        books.addAnnotationAssignment(anno("@values",
                array(Literal.ellipsis(loc()), str("b")), base, AnnotationPriority.ANNOTATE));

        merger.chooseAnnotations(books);

        assertEquals(List.of("a", "b"), values(books.getAnnotation("@values")));
        assertEquals(0, diagnostics.size());
    }

    @Test
    void ellipsisInSingleAssignmentIsUnexpected() {
        books.addAnnotationAssignment(anno("@values",
                array(str("a"), Literal.ellipsis(loc())), base, AnnotationPriority.DEFINE));

        merger.chooseAnnotations(books);

        assertEquals(1, diagnostics.byId("anno-unexpected-ellipsis").size());
        assertEquals(List.of("a"), values(books.getAnnotation("@values")));
    }

    @Test
    void ellipsisOverNonArrayIsMismatched() {
        books.addAnnotationAssignment(anno("@values", str("scalar"), base, AnnotationPriority.DEFINE));
        books.addAnnotationAssignment(anno("@values",
                array(Literal.ellipsis(loc()), str("b")), extension, AnnotationPriority.ANNOTATE));

        merger.chooseAnnotations(books);

        assertEquals(1, diagnostics.byId("anno-mismatched-ellipsis").size());
    }

    @Test
    void excessEllipsisWithoutLowerLayerIsRemoved() {
        books.addAnnotationAssignment(anno("@values",
                array(str("x")), base, AnnotationPriority.DEFINE));
        books.addAnnotationAssignment(anno("@values",
                array(Literal.ellipsis(loc()), str("y"), Literal.ellipsis(loc())), extension,
                AnnotationPriority.ANNOTATE));

        merger.chooseAnnotations(books);

        assertEquals(List.of("x", "y"), values(books.getAnnotation("@values")));
        assertEquals(0, diagnostics.size());
    }
}
