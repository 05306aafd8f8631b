package me.christianrobert.cdsresolver.resolve.path;

import me.christianrobert.cdsresolver.config.ResolverConfig;
import me.christianrobert.cdsresolver.diagnostics.Diagnostics;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.model.ResolutionState;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static me.christianrobert.cdsresolver.TestModels.element;
import static me.christianrobert.cdsresolver.TestModels.entity;
import static me.christianrobert.cdsresolver.TestModels.key;
import static me.christianrobert.cdsresolver.TestModels.model;
import static me.christianrobert.cdsresolver.TestModels.source;
import static org.junit.jupiter.api.Assertions.*;

/**
 * <pre>
 * entity Authors { key ID: Integer; }
 * entity Books { key ID: Integer; author: Authors; title: String; }
 * </pre>
 */
class PathResolverTest {

    private Diagnostics diagnostics;
    private ResolveContext ctx;
    private Artifact authors;
    private Artifact books;

    @BeforeEach
    void setUp() {
        authors = entity("Authors", key("ID", "Integer"));
        books = entity("Books", key("ID", "Integer"), element("author", "Author"), element("title", "String"));
        diagnostics = new Diagnostics();
        ctx = new ResolveContext(model(source("books.cds", authors, books)), new ResolverConfig(), diagnostics);
        ctx.linker().link();
    }

    @Test
    void resolvingTheSameReferenceTwiceGivesTheSameArtifact() {
        // Given
        Artifact title = books.getElements().get("title");
        Reference ref = title.getType();

        // When
        Artifact first = ctx.paths().resolve(ref, ResolutionPolicy.TYPE, title);
        Artifact second = ctx.paths().resolve(ref, ResolutionPolicy.TYPE, title);

        // Then
        assertNotNull(first);
        assertSame(first, second);
        assertSame(first, ref.getArtifact());
        assertEquals(ResolutionState.BOUND, ref.getCell().getState());
        assertEquals(0, diagnostics.size());
    }

    @Test
    void unresolvedReferenceIsReportedOnce() {
        // Given: author: Author (misspelled)
        Artifact author = books.getElements().get("author");
        Reference ref = author.getType();

        // When
        Artifact first = ctx.paths().resolve(ref, ResolutionPolicy.TYPE, author);
        Artifact second = ctx.paths().resolve(ref, ResolutionPolicy.TYPE, author);

        // Then
        assertNull(first);
        assertNull(second);
        assertTrue(ref.getCell().isSettled());
        assertEquals(1, diagnostics.byId("ref-undefined-art").size());
        assertEquals(1, diagnostics.size());
    }

    @Test
    void definitionIsFoundByName() {
        Reference ref = Reference.of("Authors", books.getLocation());

        assertSame(authors, ctx.paths().resolve(ref, ResolutionPolicy.TARGET, books));
        assertSame(authors, ctx.paths().resolve(ref, ResolutionPolicy.TARGET, books));
    }
}
