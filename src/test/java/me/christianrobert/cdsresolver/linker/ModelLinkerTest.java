package me.christianrobert.cdsresolver.linker;

import me.christianrobert.cdsresolver.config.ResolverConfig;
import me.christianrobert.cdsresolver.diagnostics.Diagnostics;
import me.christianrobert.cdsresolver.model.AnnotationAssignment;
import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.Model;
import me.christianrobert.cdsresolver.model.Reference;
import me.christianrobert.cdsresolver.model.Source;
import me.christianrobert.cdsresolver.model.Using;
import me.christianrobert.cdsresolver.model.expr.Literal;
import me.christianrobert.cdsresolver.model.query.SelectQuery;
import me.christianrobert.cdsresolver.model.query.TableRef;
import me.christianrobert.cdsresolver.resolve.context.ResolveContext;
import me.christianrobert.cdsresolver.resolve.context.ResolveException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.cdsresolver.TestModels.entity;
import static me.christianrobert.cdsresolver.TestModels.key;
import static me.christianrobert.cdsresolver.TestModels.loc;
import static me.christianrobert.cdsresolver.TestModels.model;
import static me.christianrobert.cdsresolver.TestModels.source;
import static me.christianrobert.cdsresolver.TestModels.view;
import static org.junit.jupiter.api.Assertions.*;

class ModelLinkerTest {

    private Diagnostics diagnostics;

    private ResolveContext link(Source... sources) {
        Model model = model(sources);
        diagnostics = new Diagnostics();
        ResolveContext ctx = new ResolveContext(model, new ResolverConfig(), diagnostics);
        ctx.linker().link();
        return ctx;
    }

    @Test
    void missingNamePrefixesBecomeNamespaces() {
        // Given
        Artifact books = entity("S.Books", key("ID", "Integer"));

        // When
        ResolveContext ctx = link(source("books.cds", books));

        // Then
        Artifact namespace = ctx.model().getDefinition("S");
        assertNotNull(namespace);
        assertEquals(Kind.NAMESPACE, namespace.getKind());
        assertSame(namespace, books.getParent());
        assertSame(books, namespace.getArtifacts().get("Books"));
        assertTrue(ctx.linker().isLinked());
    }

    @Test
    void membersGetParentAndSelfAlias() {
        Artifact id = key("ID", "Integer");
        Artifact books = entity("Books", id);

        link(source("books.cds", books));

        assertSame(books, id.getParent());
        assertSame(books, id.getMain());
        Artifact self = books.getTableAliases().get("$self");
        assertNotNull(self);
        assertEquals(Kind.SELF, self.getKind());
    }

    @Test
    void duplicateDefinitionKeepsTheFirst() {
        Artifact first = entity("Books");
        Artifact second = entity("Books");

        ResolveContext ctx = link(source("a.cds", first), source("b.cds", second));

        assertSame(first, ctx.model().getDefinition("Books"));
        assertEquals(1, diagnostics.byId("duplicate-definition").size());
    }

    @Test
    void viewQueryIsLinked() {
        // Given: entity V as select from E
        Artifact e = entity("E", key("id", "Integer"));
        Artifact v = view("V", "E");

        // When
        ResolveContext ctx = link(source("views.cds", e, v));

        // Then
        SelectQuery leading = v.getLeadingQuery();
        assertNotNull(leading);
        assertEquals(1, leading.getNumber());
        assertEquals(Kind.QUERY, leading.getResult().getKind());
        assertEquals(Kind.TABLE_ALIAS, leading.getTableAliases().get("E").getKind());
        assertTrue(leading.getTableAliases().containsKey("$self"));
        assertEquals(1, v.getFromRefs().size());
        assertEquals(List.of(e), ctx.links().ancestors(v));
        assertFalse(diagnostics.hasErrors());
    }

    @Test
    void subQueryInFromRequiresAlias() {
        SelectQuery inner = new SelectQuery(new TableRef(Reference.of("E", loc()), null, loc()), null, loc());
        Artifact v = Artifact.definition(Kind.ENTITY, "V", loc());
        v.setQuery(new SelectQuery(new TableRef(inner, null, loc()), null, loc()));

        link(source("views.cds", entity("E"), v));

        assertEquals(1, diagnostics.byId("query-req-alias").size());
    }

    @Test
    void duplicateUsingAliasIsReported() {
        Source source = source("usings.cds");
        source.getUsings().add(new Using(Reference.of("lib.Books", loc()), "Books", loc()));
        source.getUsings().add(new Using(Reference.of("other.Books", loc()), null, loc()));

        link(source);

        assertEquals(1, diagnostics.byId("duplicate-using").size());
    }

    @Test
    void annotationsWithDefinitionBelongToItsSource() {
        Artifact books = entity("Books");
        AnnotationAssignment title = new AnnotationAssignment("@title", Literal.string("Books", loc()), loc());
        books.addAnnotationAssignment(title);
        Source source = source("books.cds", books);

        link(source);

        assertSame(source, title.getSource());
    }

    @Test
    void linkingTwiceFails() {
        ResolveContext ctx = link(source("books.cds", entity("Books")));

        assertThrows(ResolveException.class, () -> ctx.linker().link());
    }

    @Test
    void modelLinkedByAnotherContextIsRejected() {
        // Given
        ResolveContext first = link(source("books.cds", entity("Books")));
        ResolveContext second = new ResolveContext(first.model(), new ResolverConfig(), new Diagnostics());

        // When
        ResolveException e = assertThrows(ResolveException.class, () -> second.linker().link());

        // Then
        assertEquals("Model has already been linked", e.getMessage());
        assertTrue(second.linker().isLinked());
        assertTrue(second.diagnostics().byId("duplicate-definition").isEmpty());
    }
}
