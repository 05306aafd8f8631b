package me.christianrobert.cdsresolver.resolve.rewrite;

import me.christianrobert.cdsresolver.config.ResolverConfig;
import me.christianrobert.cdsresolver.diagnostics.Diagnostics;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Model;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.model.expr.Expression;
import me.christianrobert.cdsresolver.model.expr.OperatorExpression;
import me.christianrobert.cdsresolver.model.expr.PathExpression;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.cdsresolver.TestModels.entity;
import static me.christianrobert.cdsresolver.TestModels.loc;
import static org.junit.jupiter.api.Assertions.*;

class BacklinkCheckerTest {

    private Diagnostics diagnostics;
    private BacklinkChecker checker;

    @BeforeEach
    void setUp() {
        diagnostics = new Diagnostics();
        checker = new BacklinkChecker(new ResolveContext(new Model(), new ResolverConfig(), diagnostics));
    }

    private static PathExpression path(String dotted) {
        return new PathExpression(Reference.of(dotted, loc()), loc());
    }

    private static Expression eq(Expression left, Expression right) {
        return new OperatorExpression("=", List.of(left, right), loc());
    }

    @Test
    void selfComparisonsAreFoundOnEitherSide() {
        // Given: author.books = $self and $self = reviews.book and a = b
        Expression cond = new OperatorExpression("and", List.of(
                eq(path("author.books"), path("$self")),
                eq(path("$self"), path("reviews.book")),
                eq(path("a"), path("b"))), loc());

        // When
        List<BacklinkChecker.Backlink> found = BacklinkChecker.backlinks(cond);

        // Then
        assertEquals(2, found.size());
        assertEquals(2, found.get(0).path.getReference().getPath().size());
        assertEquals("reviews", found.get(1).path.getReference().head().getId());
    }

    @Test
    void selfComparedWithSelfIsNoBacklink() {
        assertTrue(BacklinkChecker.backlinks(eq(path("$self"), path("$self"))).isEmpty());
    }

    @Test
    void backlinkOverMoreThanOneAssociationIsNotSupported() {
        // Given: $self = a.b.c
        Artifact books = entity("Books");

        // When
        checker.checkBacklinks(books, eq(path("$self"), path("a.b.c")));

        // Then
        assertEquals(1, diagnostics.byId("rewrite-not-supported").size());
    }

    @Test
    void unresolvedOneStepBacklinkIsAccepted() {
        checker.checkBacklinks(entity("Books"), eq(path("$self"), path("author.books")));

        assertEquals(0, diagnostics.size());
    }
}
