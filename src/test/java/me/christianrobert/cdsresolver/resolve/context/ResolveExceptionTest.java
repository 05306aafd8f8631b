package me.christianrobert.cdsresolver.resolve.context;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResolveExceptionTest {

    @Test
    void detailedMessageNamesPhaseArtifactAndContext() {
        // Given
        ResolveException e = new ResolveException("Definition without absolute name", "books.cds", "ModelLinker.addSource");

        // When
        e.inPhase("link");

        // Then
        assertEquals("link", e.getPhase());
        assertEquals("Definition without absolute name\nPhase: link\nArtifact: books.cds\nContext: ModelLinker.addSource",
                e.getDetailedMessage());
    }

    @Test
    void firstRecordedPhaseIsKept() {
        ResolveException e = new ResolveException("Cannot start elements computation in status DONE");

        e.inPhase("populate").inPhase("resolve");

        assertEquals("populate", e.getPhase());
    }

    @Test
    void plainMessageWithoutDetails() {
        ResolveException e = new ResolveException("Broken", new IllegalStateException("cause"));

        assertNull(e.getPhase());
        assertEquals("Broken", e.getDetailedMessage());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }
}
