package io.kcl.tools.ls.ast;

import java.util.Objects;

/**
 * Source extent of a syntax node. Start and end are both inclusive.
 */
public class Span {

    private final String filename;
    private final int line;
    private final int column;
    private final int endLine;
    private final int endColumn;

    public Span(String filename, int line, int column, int endLine, int endColumn) {
        this.filename = filename == null ? "" : filename;
        this.line = line;
        this.column = column;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    public String getFilename() {
        return filename;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getEndColumn() {
        return endColumn;
    }

    public Pos getStart() {
        return Pos.of(filename, line, column);
    }

    public Pos getEnd() {
        return Pos.of(filename, endLine, endColumn);
    }

    /**
     * The containment predicate used for every descent through the tree.
     * A position without a column is only checked against the line bounds.
     */
    public boolean contains(Pos pos) {
        if (pos == null) {
            return false;
        }
        return getStart().lessEqual(pos) && pos.lessEqual(getEnd());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Span)) return false;
        Span span = (Span) o;
        return line == span.line && column == span.column && endLine == span.endLine
                && endColumn == span.endColumn && filename.equals(span.filename);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filename, line, column, endLine, endColumn);
    }

    @Override
    public String toString() {
        return filename + ":" + line + ":" + column + "-" + endLine + ":" + endColumn;
    }
}
