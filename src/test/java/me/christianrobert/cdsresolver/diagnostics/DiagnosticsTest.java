package me.christianrobert.cdsresolver.diagnostics;

import me.christianrobert.cdsresolver.model.Artifact;
import me.christianrobert.cdsresolver.model.Kind;
import me.christianrobert.cdsresolver.model.Location;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static me.christianrobert.cdsresolver.TestModels.loc;
import static org.junit.jupiter.api.Assertions.*;

class DiagnosticsTest {

    private final Artifact home = Artifact.definition(Kind.ENTITY, "S.Books", loc());

    @Test
    void notFoundIsReportedOncePerLocation() {
        Diagnostics diagnostics = new Diagnostics();
        Location location = loc();

        Diagnostic first = diagnostics.signalNotFound("ref-undefined-art", location, home,
                MessageArgs.of("name", "Author"), List.of("Books"));
        Diagnostic second = diagnostics.signalNotFound("ref-undefined-art", location, home,
                MessageArgs.of("name", "Author"), List.of("Books"));

        assertNotNull(first);
        assertNull(second);
        assertEquals(1, diagnostics.size());
        assertTrue(diagnostics.isNotFoundMarked(location));
    }

    @Test
    void markedLocationSuppressesLaterReports() {
        Diagnostics diagnostics = new Diagnostics();
        Location location = loc();

        diagnostics.markNotFound(location);

        assertNull(diagnostics.signalNotFound("ref-undefined-art", location, home, MessageArgs.none(), null));
        assertEquals(0, diagnostics.size());
    }

    @Test
    void registeredSeverityWinsOverCallSite() {
        Diagnostics diagnostics = new Diagnostics();

        Diagnostic diagnostic = diagnostics.warning("ref-undefined-art", loc(), home, MessageArgs.of("name", "X"));

        assertEquals(Severity.ERROR, diagnostic.getSeverity());
        assertTrue(diagnostics.hasErrors());
    }

    @Test
    void overridesChangeNonErrorSeverities() {
        Diagnostics diagnostics = new Diagnostics(Map.of(
                "anno-undefined-art", Severity.WARNING,
                "ref-undefined-art", Severity.INFO), false);

        Diagnostic info = diagnostics.message("anno-undefined-art", loc(), home, MessageArgs.of("name", "X"));
        Diagnostic error = diagnostics.message("ref-undefined-art", loc(), home, MessageArgs.of("name", "X"));

        assertEquals(Severity.WARNING, info.getSeverity());
        assertEquals(Severity.ERROR, error.getSeverity());
        assertEquals(1, diagnostics.count(Severity.ERROR));
        assertEquals(1, diagnostics.count(Severity.WARNING));
    }

    @Test
    void validNamesAreAttachedSortedWhenEnabled() {
        Diagnostics diagnostics = new Diagnostics(Map.of(), true);

        Diagnostic diagnostic = diagnostics.signalNotFound("ref-undefined-art", loc(), home,
                MessageArgs.of("name", "Autor"), List.of("Books", "Author"));

        assertEquals(List.of("Author", "Books"), diagnostic.getValidNames());
    }

    @Test
    void messagesAreFilteredById() {
        Diagnostics diagnostics = new Diagnostics();
        diagnostics.error("duplicate-definition", loc(), home, MessageArgs.of("name", "S.Books"));
        diagnostics.info("query-missing-keys", loc(), home, MessageArgs.of("names", List.of("ID")).variant("one"));

        assertEquals(1, diagnostics.byId("duplicate-definition").size());
        assertEquals(1, diagnostics.byId("query-missing-keys").size());
        assertEquals(Severity.INFO, diagnostics.byId("query-missing-keys").get(0).getSeverity());
        assertEquals(2, diagnostics.getMessages().size());
    }
}
