package me.christianrobert.cdsresolver.resolve.redirect;

import me.christianrobert.cdsresolver.config.ResolverConfig;
import me.christianrobert.cdsresolver.model.AnnotationAssignment;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Inferred;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.Model;
import me.christianrobert.cdsresolver.model.expr.Literal;
import me.christianrobert.cdsresolver.service.ModelResolverService;
import me.christianrobert.cdsresolver.service.ResolveResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.cdsresolver.TestModels.association;
import static me.christianrobert.cdsresolver.TestModels.definition;
import static me.christianrobert.cdsresolver.TestModels.element;
import static me.christianrobert.cdsresolver.TestModels.entity;
import static me.christianrobert.cdsresolver.TestModels.key;
import static me.christianrobert.cdsresolver.TestModels.loc;
import static me.christianrobert.cdsresolver.TestModels.model;
import static me.christianrobert.cdsresolver.TestModels.source;
import static me.christianrobert.cdsresolver.TestModels.view;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Targets outside the service which are exposed automatically.
 *
 * <pre>
 * entity my.Authors { key ID: Integer; name: String; }
 * entity my.Books { key ID: Integer; author: Association to my.Authors; }
 * service S { entity Books as projection on my.Books; }
 * </pre>
 */
class AutoExposerTest {

    private Artifact authors;
    private Artifact books;
    private Artifact serviceBooks;

    @BeforeEach
    void setUp() {
        authors = entity("my.Authors", key("ID", "Integer"), element("name", "String"));
        books = entity("my.Books", key("ID", "Integer"), association("author", "my.Authors"));
        serviceBooks = view("S.Books", "my.Books");
    }

    private Model serviceModel() {
        return model(source("service.cds", authors, books, definition(Kind.SERVICE, "S"), serviceBooks));
    }

    @Test
    void annotatedTargetIsExposedInService() {
        // Given: annotate my.Authors with @cds.autoexpose
        authors.addAnnotationAssignment(new AnnotationAssignment(AutoExposer.AUTOEXPOSE,
                Literal.bool(true, loc()), loc()));
        Model model = serviceModel();

        // When
        ResolveResult result = new ModelResolverService(new ResolverConfig()).resolve(model);

        // Then
        assertTrue(result.isSuccess(), result.toString());
        Artifact exposed = model.getDefinition("S.Authors");
        assertNotNull(exposed);
        assertEquals(Inferred.AUTOEXPOSED, exposed.getInferred());
        assertEquals(List.of("ID", "name"), List.copyOf(exposed.getElements().keySet()));
        assertTrue(exposed.getElements().get("ID").isKey());
        assertSame(exposed, serviceBooks.getElements().get("author").getTarget().getArtifact());
        assertTrue(model.getEntities().contains(exposed));
    }

    @Test
    void targetWithoutAnnotationStaysOutsideService() {
        Model model = serviceModel();

        ResolveResult result = new ModelResolverService(new ResolverConfig()).resolve(model);

        assertNull(model.getDefinition("S.Authors"));
        assertSame(authors, serviceBooks.getElements().get("author").getTarget().getArtifact());
        assertEquals(1, result.getDiagnostics().byId("assoc-outside-service").size());
    }

    @Test
    void autoexposeFalseIsRespected() {
        authors.addAnnotationAssignment(new AnnotationAssignment(AutoExposer.AUTOEXPOSE,
                Literal.bool(false, loc()), loc()));
        Model model = serviceModel();

        new ModelResolverService(new ResolverConfig()).resolve(model);

        assertNull(model.getDefinition("S.Authors"));
    }
}
