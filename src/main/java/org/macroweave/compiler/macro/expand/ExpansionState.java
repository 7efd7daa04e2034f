package org.macroweave.compiler.macro.expand;

/**
 * The states the driver moves through for each subtree it expands.
 */
public enum ExpansionState {
    /** Walking the tree looking for call nodes. */
    SCANNING,
    /** A call node matched a registered macro. */
    MATCHED,
    /** The matched macro's implementation is running. */
    INVOKING,
    /** The result replaces (or removes) the call node. */
    SUBSTITUTING,
    /** The newly introduced subtree is scanned for further macro calls. */
    RESCANNING,
    /** No further matches in the subtree; scanning resumes at its siblings. */
    DONE,
    /** Expansion failed; the compilation unit is aborted. */
    ERROR
}
