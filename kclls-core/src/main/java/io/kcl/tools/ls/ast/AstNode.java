package io.kcl.tools.ls.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base of every node of the syntax tree. Each node owns its span and its children.
 */
public abstract class AstNode {

    private final Span span;

    protected AstNode(Span span) {
        this.span = span;
    }

    public Span getSpan() {
        return span;
    }

    public boolean contains(Pos pos) {
        return span != null && span.contains(pos);
    }

    protected static <T> List<T> children(List<T> list) {
        if (list == null || list.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(list));
    }
}
