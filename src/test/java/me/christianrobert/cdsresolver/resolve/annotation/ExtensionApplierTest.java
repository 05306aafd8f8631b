package me.christianrobert.cdsresolver.resolve.annotation;

import me.christianrobert.cdsresolver.config.ResolverConfig;
import me.christianrobert.cdsresolver.diagnostics.Severity;
import me.christianrobert.cdsresolver.model.AnnotationAssignment;
import me.christianrobert.cdsresolver.model.AnnotationPriority;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Extension;
import me.christianrobert.cdsresolver.model.Extension.ExtensionKind;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.model.Source;
import me.christianrobert.cdsresolver.model.expr.Literal;
import me.christianrobert.cdsresolver.service.ModelResolverService;
import me.christianrobert.cdsresolver.service.ResolveResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static me.christianrobert.cdsresolver.TestModels.element;
import static me.christianrobert.cdsresolver.TestModels.entity;
import static me.christianrobert.cdsresolver.TestModels.key;
import static me.christianrobert.cdsresolver.TestModels.loc;
import static me.christianrobert.cdsresolver.TestModels.model;
import static me.christianrobert.cdsresolver.TestModels.source;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Annotate statements applied through a full resolve run.
 */
class ExtensionApplierTest {

    private Artifact books;
    private Source base;
    private Source annotations;

    @BeforeEach
    void setUp() {
        books = entity("Books", key("ID", "Integer"), element("title", "String"));
        base = source("base.cds", books);
        annotations = source("annotations.cds");
        annotations.addDependency(base);
    }

    private static Extension annotate(String name, String anno, String value) {
        Extension ext = new Extension(ExtensionKind.ANNOTATE, Reference.of(name, loc()), loc());
        if (anno != null) {
            ext.getAnnotations().add(new AnnotationAssignment(anno, Literal.string(value, loc()), loc()));
        }
        return ext;
    }

    private ResolveResult resolve() {
        return new ModelResolverService(new ResolverConfig()).resolve(model(base, annotations));
    }

    @Test
    void annotateAddsAnnotationsToDefinitionAndElements() {
        // Given: annotate Books with @title: 'Books' { title @label: 'Title'; }
        Extension ext = annotate("Books", "@title", "Books");
        ext.getElements().put("title", annotate("title", "@label", "Title"));
        annotations.getExtensions().add(ext);

        // When
        ResolveResult result = resolve();

        // Then
        assertTrue(result.isSuccess(), result.toString());
        AnnotationAssignment title = books.getAnnotation("@title");
        assertNotNull(title);
        assertSame(annotations, title.getSource());
        assertEquals(AnnotationPriority.ANNOTATE, title.getPriority());
        AnnotationAssignment label = books.getElements().get("title").getAnnotation("@label");
        assertNotNull(label);
        assertEquals("Title", ((Literal) label.getValue()).getValue());
        assertTrue(ext.isApplied());
    }

    @Test
    void annotatingUnknownArtifactIsReportedAsInfo() {
        annotations.getExtensions().add(annotate("Unknown", "@title", "Nothing"));

        ResolveResult result = resolve();

        assertTrue(result.isSuccess(), result.toString());
        assertEquals(1, result.getDiagnostics().byId("anno-undefined-art").size());
        assertEquals(Severity.INFO, result.getDiagnostics().byId("anno-undefined-art").get(0).getSeverity());
    }

    @Test
    void annotatingUnknownElementIsReported() {
        Extension ext = annotate("Books", null, null);
        ext.getElements().put("subtitle", annotate("subtitle", "@label", "Subtitle"));
        annotations.getExtensions().add(ext);

        ResolveResult result = resolve();

        assertTrue(result.isSuccess(), result.toString());
        assertEquals(1, result.getDiagnostics().byId("anno-undefined-element").size());
    }
}
