package me.christianrobert.cdsresolver.model;

import java.util.Map;

/**
 * A scope of the lexical search chain: sources, contexts and services for
 * artifact references; queries, main artifacts and the magic variables for
 * value references.
 */
public interface LexicalBlock {

    /** Names visible in this scope; never {@code null}. */
    Map<String, Artifact> getLexicalNames();

    /** The enclosing block for artifact references, {@code null} at the top. */
    LexicalBlock getOuterBlock();
}
