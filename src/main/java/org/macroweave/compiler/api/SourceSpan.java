package org.macroweave.compiler.api;

/**
 * A region of source code, from the first character of a construct to its last.
 * It is part of the public compiler API and free of implementation details.
 * Lines and columns are 1-based and inclusive.
 *
 * @param file The file where the code is located.
 * @param startLine The line of the first character.
 * @param startColumn The column of the first character.
 * @param endLine The line of the last character.
 * @param endColumn The column of the last character.
 */
public record SourceSpan(String file, int startLine, int startColumn, int endLine, int endColumn) {

    /** The span of a node a macro deliberately built without a source location. */
    public static final SourceSpan SYNTHETIC = new SourceSpan("<synthetic>", 0, 0, 0, 0);

    /** The span of a template-born node that has not been located yet. */
    public static final SourceSpan UNASSIGNED = new SourceSpan("<unassigned>", 0, 0, 0, 0);

    /**
     * Creates a span covering everything from the start of {@code first} to the end of {@code last}.
     * @param first The span where the region begins.
     * @param last The span where the region ends.
     * @return The covering span.
     */
    public static SourceSpan covering(SourceSpan first, SourceSpan last) {
        return new SourceSpan(first.file(), first.startLine(), first.startColumn(), last.endLine(), last.endColumn());
    }

    /**
     * @return {@code true} if this span points into real source text.
     */
    public boolean isLocated() {
        return !SYNTHETIC.equals(this) && !UNASSIGNED.equals(this);
    }

    @Override
    public String toString() {
        return file + ":" + startLine + ":" + startColumn;
    }
}
