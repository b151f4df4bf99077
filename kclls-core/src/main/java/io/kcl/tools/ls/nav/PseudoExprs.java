package io.kcl.tools.ls.nav;

import io.kcl.tools.ls.ast.NameToken;
import io.kcl.tools.ls.ast.Pos;
import io.kcl.tools.ls.ast.Span;
import io.kcl.tools.ls.ast.expr.IdentifierExpr;
import io.kcl.tools.ls.ast.expr.SyntheticIdentifier;
import io.kcl.tools.ls.ast.types.DictType;
import io.kcl.tools.ls.ast.types.ListType;
import io.kcl.tools.ls.ast.types.NamedType;
import io.kcl.tools.ls.ast.types.TypeNode;
import io.kcl.tools.ls.ast.types.UnionType;

import java.util.List;

/**
 * Builds identifier expressions for tree fragments that are not expressions, so that
 * position queries always answer with an expression.
 */
public final class PseudoExprs {

    private PseudoExprs() {
    }

    public static IdentifierExpr identifierFrom(String name, Span span) {
        return new SyntheticIdentifier(span, List.of(name), "");
    }

    public static IdentifierExpr identifierFrom(NameToken token) {
        return identifierFrom(token.getValue(), token.getSpan());
    }

    /**
     * Descends a type annotation to the named type under {@code pos}.
     *
     * @return an identifier spanning the named type, or null when the position is outside the
     * type or lands on a part that names no schema (any, basic or literal types)
     */
    public static IdentifierExpr identifierFromType(TypeNode ty, Pos pos) {
        if (ty == null || !ty.contains(pos)) {
            return null;
        }
        return switch (ty.getKind()) {
            case ANY, BASIC, LITERAL -> null;
            case NAMED -> {
                NamedType named = (NamedType) ty;
                yield new SyntheticIdentifier(named.getSpan(), named.getNames(), named.getPkgpath());
            }
            case LIST -> identifierFromType(((ListType) ty).getInnerType(), pos);
            case DICT -> {
                DictType dict = (DictType) ty;
                if (dict.getKeyType() != null && dict.getKeyType().contains(pos)) {
                    yield identifierFromType(dict.getKeyType(), pos);
                }
                yield identifierFromType(dict.getValueType(), pos);
            }
            case UNION -> {
                IdentifierExpr found = null;
                for (TypeNode element : ((UnionType) ty).getElements()) {
                    if (element.contains(pos)) {
                        found = identifierFromType(element, pos);
                        break;
                    }
                }
                yield found;
            }
        };
    }
}
