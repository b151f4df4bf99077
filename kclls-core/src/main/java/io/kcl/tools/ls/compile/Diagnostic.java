package io.kcl.tools.ls.compile;

import io.kcl.tools.ls.ast.Pos;

/**
 * A compiler message attached to a source range.
 */
public class Diagnostic {

    public enum Level {
        ERROR,
        WARNING,
        SUGGESTIONS
    }

    private final Level level;
    private final String message;
    private final Pos start;
    private final Pos end;
    private final String code;

    public Diagnostic(Level level, String message, Pos start, Pos end, String code) {
        this.level = level;
        this.message = message;
        this.start = start;
        this.end = end == null ? start : end;
        this.code = code;
    }

    public Diagnostic(Level level, String message, Pos pos) {
        this(level, message, pos, pos, null);
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public Pos getStart() {
        return start;
    }

    public Pos getEnd() {
        return end;
    }

    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return level + " " + start + ": " + message;
    }
}
