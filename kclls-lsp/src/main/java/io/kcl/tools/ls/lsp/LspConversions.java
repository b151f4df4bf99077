package io.kcl.tools.ls.lsp;

import io.kcl.tools.ls.ast.Pos;
import io.kcl.tools.ls.ast.Span;
import io.kcl.tools.ls.compile.PathConversionException;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

import java.net.URI;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Conversions between LSP coordinates and KCL positions. LSP lines count from 0 and KCL
 * lines from 1; columns count from 0 on both sides.
 */
public final class LspConversions {

    private LspConversions() {
    }

    public static Path absPath(String uri) {
        try {
            return Paths.get(URI.create(uri)).toAbsolutePath().normalize();
        } catch (IllegalArgumentException | FileSystemNotFoundException e) {
            throw new PathConversionException("can't convert url to path: " + uri, e);
        }
    }

    public static String fileUri(String filename) {
        try {
            return Paths.get(filename).toUri().toString();
        } catch (RuntimeException e) {
            throw new PathConversionException("can't convert file to url: " + filename, e);
        }
    }

    public static Pos kclPos(Path file, Position position) {
        return Pos.of(file.toString(), position.getLine() + 1, position.getCharacter());
    }

    /**
     * A whole-line position maps to the start of the line.
     */
    public static Position lspPos(Pos pos) {
        return new Position(Math.max(pos.getLine() - 1, 0), pos.hasColumn() ? pos.getColumn() : 0);
    }

    public static Range lspRange(Pos start, Pos end) {
        return new Range(lspPos(start), lspPos(end));
    }

    public static Range lspRange(Span span) {
        return lspRange(span.getStart(), span.getEnd());
    }

    public static Location lspLocation(Pos pos) {
        return new Location(fileUri(pos.getFilename()), lspRange(pos, pos));
    }

    public static Location lspLocation(Span span) {
        return new Location(fileUri(span.getFilename()), lspRange(span));
    }

    /**
     * Character offset of an LSP position in {@code text}. Lines past the end map to the
     * end of the text and characters past a line's end map to the end of that line.
     */
    public static int offset(String text, Position position) {
        int lineStart = 0;
        for (int line = 0; line < position.getLine(); line++) {
            int newline = text.indexOf('\n', lineStart);
            if (newline < 0) {
                return text.length();
            }
            lineStart = newline + 1;
        }
        int lineEnd = text.indexOf('\n', lineStart);
        if (lineEnd < 0) {
            lineEnd = text.length();
        }
        return Math.min(lineStart + Math.max(position.getCharacter(), 0), lineEnd);
    }

    /**
     * @return start and end offsets of the range, end never before start
     */
    public static int[] textRange(String text, Range range) {
        int start = offset(text, range.getStart());
        int end = offset(text, range.getEnd());
        return new int[]{start, Math.max(start, end)};
    }
}
