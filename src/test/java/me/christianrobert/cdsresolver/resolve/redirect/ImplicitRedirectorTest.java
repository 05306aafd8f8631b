package me.christianrobert.cdsresolver.resolve.redirect;

import me.christianrobert.cdsresolver.config.ResolverConfig;
import me.christianrobert.cdsresolver.diagnostics.Diagnostic;
import me.christianrobert.cdsresolver.diagnostics.Severity;
import me.christianrobert.cdsresolver.model.AnnotationAssignment;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Inferred;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.expr.Literal;
import me.christianrobert.cdsresolver.service.ModelResolverService;
import me.christianrobert.cdsresolver.service.ResolveResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static me.christianrobert.cdsresolver.TestModels.association;
import static me.christianrobert.cdsresolver.TestModels.definition;
import static me.christianrobert.cdsresolver.TestModels.entity;
import static me.christianrobert.cdsresolver.TestModels.key;
import static me.christianrobert.cdsresolver.TestModels.loc;
import static me.christianrobert.cdsresolver.TestModels.model;
import static me.christianrobert.cdsresolver.TestModels.source;
import static me.christianrobert.cdsresolver.TestModels.view;
import static org.junit.jupiter.api.Assertions.*;

class ImplicitRedirectorTest {

    private Artifact author;
    private Artifact authors;
    private Artifact books;
    private Artifact service;

    @BeforeEach
    void setUp() {
        author = association("author", "my.Authors");
        authors = entity("my.Authors", key("ID", "Integer"));
        books = entity("my.Books", key("ID", "Integer"), author);
        service = definition(Kind.SERVICE, "S");
    }

    private ResolveResult resolve(Artifact... views) {
        List<Artifact> definitions = new ArrayList<>(List.of(authors, books, service));
        definitions.addAll(List.of(views));
        return new ModelResolverService(new ResolverConfig()).resolve(model(
                source("service.cds", definitions.toArray(new Artifact[0]))));
    }

    @Test
    void associationInServiceIsRedirectedToExposedTarget() {
        // Given:
        //   entity my.Authors { key ID: Integer; }
        //   entity my.Books { key ID: Integer; author: Association to my.Authors; }
        //   service S { entity Books as projection on my.Books; entity Authors as projection on my.Authors; }
        Artifact serviceBooks = view("S.Books", "my.Books");
        Artifact serviceAuthors = view("S.Authors", "my.Authors");

        // When
        resolve(serviceBooks, serviceAuthors);

        // Then
        assertSame(authors, author.getTarget().getArtifact());
        Artifact projected = serviceBooks.getElements().get("author");
        assertNotNull(projected);
        assertSame(serviceAuthors, projected.getTarget().getArtifact());
        assertEquals(Inferred.IMPLICIT, projected.getTarget().getInferred());
    }

    @Test
    void twoExposuresOfTheTargetAreAmbiguous() {
        // Given: service S { entity Books as projection on my.Books;
        //                    entity Authors as projection on my.Authors;
        //                    entity Writers as projection on my.Authors; }
        Artifact serviceBooks = view("S.Books", "my.Books");

        // When
        ResolveResult result = resolve(serviceBooks, view("S.Authors", "my.Authors"), view("S.Writers", "my.Authors"));

        // Then
        List<Diagnostic> ambiguous = result.getDiagnostics().byId("redirected-implicitly-ambiguous");
        assertEquals(1, ambiguous.size());
        assertEquals(Severity.ERROR, ambiguous.get(0).getSeverity());
        assertEquals(List.of("S.Authors", "S.Writers"), ambiguous.get(0).getArgs().get("sorted_arts"));
        assertSame(authors, serviceBooks.getElements().get("author").getTarget().getArtifact());
    }

    @Test
    void redirectionTargetAnnotationResolvesAmbiguity() {
        // Given: as above, with @cds.redirection.target on S.Writers
        Artifact serviceBooks = view("S.Books", "my.Books");
        Artifact writers = view("S.Writers", "my.Authors");
        writers.addAnnotationAssignment(new AnnotationAssignment("@cds.redirection.target",
                Literal.bool(true, loc()), loc()));

        // When
        ResolveResult result = resolve(serviceBooks, view("S.Authors", "my.Authors"), writers);

        // Then
        assertTrue(result.getDiagnostics().byId("redirected-implicitly-ambiguous").isEmpty());
        assertSame(writers, serviceBooks.getElements().get("author").getTarget().getArtifact());
    }

    @Test
    void associationOutsideServiceKeepsItsTarget() {
        // Given: entity my.BookView as select from my.Books;
        Artifact bookView = view("my.BookView", "my.Books");

        // When
        ResolveResult result = resolve(bookView);

        // Then
        assertTrue(result.isSuccess(), result.toString());
        Artifact projected = bookView.getElements().get("author");
        assertSame(authors, projected.getTarget().getArtifact());
        assertEquals(Inferred.REWRITE, projected.getTarget().getInferred());
    }
}
