package io.kcl.tools.ls.ast;

import java.util.Objects;

/**
 * A position in a KCL source file.
 * Lines count from 1 and columns from 0. A position without a column stands for
 * the whole line and matches any column on it.
 */
public class Pos {

    private final String filename;
    private final int line;
    private final Integer column;

    public Pos(String filename, int line, Integer column) {
        this.filename = filename == null ? "" : filename;
        this.line = line;
        this.column = column;
    }

    public static Pos of(String filename, int line, int column) {
        return new Pos(filename, line, column);
    }

    /**
     * Position covering the entire line, e.g. the first line of an imported file.
     */
    public static Pos wholeLine(String filename, int line) {
        return new Pos(filename, line, null);
    }

    public String getFilename() {
        return filename;
    }

    public int getLine() {
        return line;
    }

    /**
     * @return the column or null for a whole-line position
     */
    public Integer getColumn() {
        return column;
    }

    public boolean hasColumn() {
        return column != null;
    }

    /**
     * True when this position is before or at {@code other}. Columns are only compared
     * on the same line and only when both positions carry one.
     */
    public boolean lessEqual(Pos other) {
        if (line < other.line) {
            return true;
        }
        if (line == other.line) {
            if (column == null || other.column == null) {
                return true;
            }
            return column <= other.column;
        }
        return false;
    }

    /**
     * Strict variant of {@link #lessEqual(Pos)}; a missing column is never "before".
     */
    public boolean less(Pos other) {
        if (line < other.line) {
            return true;
        }
        if (line == other.line && column != null && other.column != null) {
            return column < other.column;
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pos)) return false;
        Pos pos = (Pos) o;
        return line == pos.line && filename.equals(pos.filename) && Objects.equals(column, pos.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filename, line, column);
    }

    @Override
    public String toString() {
        return filename + ":" + line + (column == null ? "" : ":" + column);
    }
}
