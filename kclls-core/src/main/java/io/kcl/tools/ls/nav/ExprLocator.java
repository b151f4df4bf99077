package io.kcl.tools.ls.nav;

import io.kcl.tools.ls.ast.ConfigEntry;
import io.kcl.tools.ls.ast.NameToken;
import io.kcl.tools.ls.ast.Pos;
import io.kcl.tools.ls.ast.Program;
import io.kcl.tools.ls.ast.expr.ArgumentsExpr;
import io.kcl.tools.ls.ast.expr.BinaryExpr;
import io.kcl.tools.ls.ast.expr.CallExpr;
import io.kcl.tools.ls.ast.expr.CheckExpr;
import io.kcl.tools.ls.ast.expr.CompClauseExpr;
import io.kcl.tools.ls.ast.expr.CompareExpr;
import io.kcl.tools.ls.ast.expr.ConfigExpr;
import io.kcl.tools.ls.ast.expr.ConfigIfEntryExpr;
import io.kcl.tools.ls.ast.expr.Expr;
import io.kcl.tools.ls.ast.expr.FormattedValueExpr;
import io.kcl.tools.ls.ast.expr.IfExpr;
import io.kcl.tools.ls.ast.expr.JoinedStringExpr;
import io.kcl.tools.ls.ast.expr.KeywordExpr;
import io.kcl.tools.ls.ast.expr.LambdaExpr;
import io.kcl.tools.ls.ast.expr.ListCompExpr;
import io.kcl.tools.ls.ast.expr.ListExpr;
import io.kcl.tools.ls.ast.expr.ListIfItemExpr;
import io.kcl.tools.ls.ast.expr.ParenExpr;
import io.kcl.tools.ls.ast.expr.QuantExpr;
import io.kcl.tools.ls.ast.expr.SchemaExpr;
import io.kcl.tools.ls.ast.expr.SelectorExpr;
import io.kcl.tools.ls.ast.expr.StarredExpr;
import io.kcl.tools.ls.ast.expr.SubscriptExpr;
import io.kcl.tools.ls.ast.expr.UnaryExpr;
import io.kcl.tools.ls.ast.stmt.AssertStmt;
import io.kcl.tools.ls.ast.stmt.AssignStmt;
import io.kcl.tools.ls.ast.stmt.AugAssignStmt;
import io.kcl.tools.ls.ast.stmt.ExprStmt;
import io.kcl.tools.ls.ast.stmt.IfStmt;
import io.kcl.tools.ls.ast.stmt.RuleStmt;
import io.kcl.tools.ls.ast.stmt.SchemaAttrStmt;
import io.kcl.tools.ls.ast.stmt.SchemaStmt;
import io.kcl.tools.ls.ast.stmt.Stmt;
import io.kcl.tools.ls.ast.stmt.TypeAliasStmt;
import io.kcl.tools.ls.ast.stmt.UnificationStmt;
import org.jboss.logging.Logger;

import java.lang.invoke.MethodHandles;
import java.util.List;

/**
 * Finds the innermost expression at a position together with the schema instantiation
 * whose config body governs it.
 * <p>
 * At every composite node the children are tested in source order and the first one
 * containing the position is descended into. When no child matches the node itself is the
 * answer. The schema context becomes a {@link SchemaExpr} when descending into its config
 * and is cleared when descending into the value of a config entry.
 */
public final class ExprLocator {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    private ExprLocator() {
    }

    /**
     * Looks up the top-level statement of the position's file and descends it.
     */
    public static NavResult locate(Program program, Pos pos) {
        Stmt stmt = program.posToStmt(pos);
        if (stmt == null) {
            logger.debugf("no statement at %s", pos);
            return NavResult.NONE;
        }
        return locateInStmt(stmt, pos, null);
    }

    public static NavResult locate(Expr expr, Pos pos) {
        return locate(expr, pos, null);
    }

    public static NavResult locate(Expr expr, Pos pos, SchemaExpr ctx) {
        if (expr == null || !expr.contains(pos)) {
            return NavResult.NONE;
        }
        return switch (expr.getKind()) {
            case IDENTIFIER, NUMBER_LIT, STRING_LIT, NAME_CONSTANT_LIT, MISSING -> NavResult.of(expr, ctx);
            // comprehension bodies are not descended into
            case DICT_COMP -> NavResult.of(expr, ctx);
            case SELECTOR -> selector((SelectorExpr) expr, pos, ctx);
            case SCHEMA -> schema((SchemaExpr) expr, pos, ctx);
            case CONFIG -> config((ConfigExpr) expr, pos, ctx);
            case UNARY -> orSelf(descend(((UnaryExpr) expr).getOperand(), pos, ctx), expr, ctx);
            case BINARY -> binary((BinaryExpr) expr, pos, ctx);
            case IF -> ifExpr((IfExpr) expr, pos, ctx);
            case CALL -> call((CallExpr) expr, pos, ctx);
            case PAREN -> orSelf(descend(((ParenExpr) expr).getExpr(), pos, ctx), expr, ctx);
            case QUANT -> quant((QuantExpr) expr, pos, ctx);
            case LIST -> orSelf(descendFirst(((ListExpr) expr).getElts(), pos, ctx), expr, ctx);
            case LIST_IF_ITEM -> listIfItem((ListIfItemExpr) expr, pos, ctx);
            case LIST_COMP -> listComp((ListCompExpr) expr, pos, ctx);
            case STARRED -> orSelf(descend(((StarredExpr) expr).getValue(), pos, ctx), expr, ctx);
            case CONFIG_IF_ENTRY -> configIfEntry((ConfigIfEntryExpr) expr, pos, ctx);
            case COMP_CLAUSE -> compClause((CompClauseExpr) expr, pos, ctx);
            case CHECK -> check((CheckExpr) expr, pos, ctx);
            case LAMBDA -> lambda((LambdaExpr) expr, pos, ctx);
            case SUBSCRIPT -> subscript((SubscriptExpr) expr, pos, ctx);
            case KEYWORD -> keyword((KeywordExpr) expr, pos, ctx);
            case ARGUMENTS -> arguments((ArgumentsExpr) expr, pos, ctx);
            case COMPARE -> compare((CompareExpr) expr, pos, ctx);
            case JOINED_STRING -> orSelf(descendFirst(((JoinedStringExpr) expr).getValues(), pos, ctx), expr, ctx);
            case FORMATTED_VALUE -> orSelf(descend(((FormattedValueExpr) expr).getValue(), pos, ctx), expr, ctx);
        };
    }

    /**
     * Statement counterpart of {@link #locate(Expr, Pos, SchemaExpr)}. Returns the current
     * context with no expression when the statement contains the position but none of its
     * parts do.
     */
    public static NavResult locateInStmt(Stmt stmt, Pos pos, SchemaExpr ctx) {
        if (stmt == null || !stmt.contains(pos)) {
            return NavResult.NONE;
        }
        NavResult found = switch (stmt.getKind()) {
            case ASSIGN -> assign((AssignStmt) stmt, pos, ctx);
            case TYPE_ALIAS -> descend(((TypeAliasStmt) stmt).getTypeName(), pos, ctx);
            case EXPR -> descendFirst(((ExprStmt) stmt).getExprs(), pos, ctx);
            case UNIFICATION -> unification((UnificationStmt) stmt, pos, ctx);
            case AUG_ASSIGN -> augAssign((AugAssignStmt) stmt, pos, ctx);
            case ASSERT -> assertStmt((AssertStmt) stmt, pos, ctx);
            case IF -> ifStmt((IfStmt) stmt, pos, ctx);
            case SCHEMA -> schemaStmt((SchemaStmt) stmt, pos, ctx);
            case SCHEMA_ATTR -> schemaAttr((SchemaAttrStmt) stmt, pos, ctx);
            case RULE -> rule((RuleStmt) stmt, pos, ctx);
            case IMPORT -> null;
        };
        return found != null ? found : NavResult.of(null, ctx);
    }

    private static NavResult locateInConfigEntry(ConfigEntry entry, Pos pos, SchemaExpr ctx) {
        Expr key = entry.getKey();
        if (key != null && key.contains(pos)) {
            return locate(key, pos, ctx);
        }
        Expr value = entry.getValue();
        if (value != null && value.contains(pos)) {
            return locate(value, pos, null);
        }
        return NavResult.NONE;
    }

    private static NavResult descend(Expr child, Pos pos, SchemaExpr ctx) {
        if (child != null && child.contains(pos)) {
            return locate(child, pos, ctx);
        }
        return null;
    }

    private static NavResult descendFirst(List<? extends Expr> children, Pos pos, SchemaExpr ctx) {
        for (Expr child : children) {
            if (child != null && child.contains(pos)) {
                return locate(child, pos, ctx);
            }
        }
        return null;
    }

    private static NavResult descendStmts(List<Stmt> stmts, Pos pos, SchemaExpr ctx) {
        for (Stmt stmt : stmts) {
            if (stmt.contains(pos)) {
                return locateInStmt(stmt, pos, ctx);
            }
        }
        return null;
    }

    private static NavResult entries(List<ConfigEntry> items, Pos pos, SchemaExpr ctx) {
        for (ConfigEntry item : items) {
            if (item.contains(pos)) {
                return locateInConfigEntry(item, pos, ctx);
            }
        }
        return null;
    }

    private static NavResult orSelf(NavResult found, Expr self, SchemaExpr ctx) {
        return found != null ? found : NavResult.of(self, ctx);
    }

    private static NavResult selector(SelectorExpr expr, Pos pos, SchemaExpr ctx) {
        NavResult found = descend(expr.getAttr(), pos, ctx);
        if (found == null) {
            found = descend(expr.getValue(), pos, ctx);
        }
        return orSelf(found, expr, ctx);
    }

    private static NavResult schema(SchemaExpr expr, Pos pos, SchemaExpr ctx) {
        NavResult found = descend(expr.getName(), pos, ctx);
        if (found == null) {
            found = descendFirst(expr.getArgs(), pos, ctx);
        }
        if (found == null) {
            found = descendFirst(expr.getKwargs(), pos, ctx);
        }
        if (found == null) {
            // the config body is governed by this instantiation
            found = descend(expr.getConfig(), pos, expr);
        }
        return orSelf(found, expr, ctx);
    }

    private static NavResult config(ConfigExpr expr, Pos pos, SchemaExpr ctx) {
        return orSelf(entries(expr.getItems(), pos, ctx), expr, ctx);
    }

    private static NavResult binary(BinaryExpr expr, Pos pos, SchemaExpr ctx) {
        NavResult found = descend(expr.getLeft(), pos, ctx);
        if (found == null) {
            found = descend(expr.getRight(), pos, ctx);
        }
        return orSelf(found, expr, ctx);
    }

    private static NavResult ifExpr(IfExpr expr, Pos pos, SchemaExpr ctx) {
        NavResult found = descend(expr.getBody(), pos, ctx);
        if (found == null) {
            found = descend(expr.getCond(), pos, ctx);
        }
        if (found == null) {
            found = descend(expr.getOrelse(), pos, ctx);
        }
        return orSelf(found, expr, ctx);
    }

    private static NavResult call(CallExpr expr, Pos pos, SchemaExpr ctx) {
        NavResult found = descendFirst(expr.getArgs(), pos, ctx);
        if (found == null) {
            found = descendFirst(expr.getKeywords(), pos, ctx);
        }
        if (found == null) {
            found = descend(expr.getFunc(), pos, ctx);
        }
        return orSelf(found, expr, ctx);
    }

    private static NavResult quant(QuantExpr expr, Pos pos, SchemaExpr ctx) {
        NavResult found = descend(expr.getTarget(), pos, ctx);
        if (found == null) {
            found = descendFirst(expr.getVariables(), pos, ctx);
        }
        if (found == null) {
            found = descend(expr.getTest(), pos, ctx);
        }
        if (found == null) {
            found = descend(expr.getIfCond(), pos, ctx);
        }
        return orSelf(found, expr, ctx);
    }

    private static NavResult listIfItem(ListIfItemExpr expr, Pos pos, SchemaExpr ctx) {
        NavResult found = descend(expr.getIfCond(), pos, ctx);
        if (found == null) {
            found = descendFirst(expr.getExprs(), pos, ctx);
        }
        if (found == null) {
            found = descend(expr.getOrelse(), pos, ctx);
        }
        return orSelf(found, expr, ctx);
    }

    private static NavResult listComp(ListCompExpr expr, Pos pos, SchemaExpr ctx) {
        NavResult found = descend(expr.getElt(), pos, ctx);
        if (found == null) {
            found = descendFirst(expr.getGenerators(), pos, ctx);
        }
        return orSelf(found, expr, ctx);
    }

    private static NavResult configIfEntry(ConfigIfEntryExpr expr, Pos pos, SchemaExpr ctx) {
        NavResult found = descend(expr.getIfCond(), pos, ctx);
        if (found == null) {
            found = entries(expr.getItems(), pos, ctx);
        }
        if (found == null) {
            found = descend(expr.getOrelse(), pos, ctx);
        }
        return orSelf(found, expr, ctx);
    }

    private static NavResult compClause(CompClauseExpr expr, Pos pos, SchemaExpr ctx) {
        NavResult found = descendFirst(expr.getTargets(), pos, ctx);
        if (found == null) {
            found = descend(expr.getIter(), pos, ctx);
        }
        if (found == null) {
            found = descendFirst(expr.getIfs(), pos, ctx);
        }
        return orSelf(found, expr, ctx);
    }

    private static NavResult check(CheckExpr expr, Pos pos, SchemaExpr ctx) {
        NavResult found = descend(expr.getTest(), pos, ctx);
        if (found == null) {
            found = descend(expr.getIfCond(), pos, ctx);
        }
        if (found == null) {
            found = descend(expr.getMsg(), pos, ctx);
        }
        return orSelf(found, expr, ctx);
    }

    private static NavResult lambda(LambdaExpr expr, Pos pos, SchemaExpr ctx) {
        NavResult found = descend(expr.getArgs(), pos, ctx);
        if (found == null) {
            found = descendStmts(expr.getBody(), pos, ctx);
        }
        return orSelf(found, expr, ctx);
    }

    private static NavResult subscript(SubscriptExpr expr, Pos pos, SchemaExpr ctx) {
        NavResult found = descend(expr.getValue(), pos, ctx);
        if (found == null) {
            found = descend(expr.getIndex(), pos, ctx);
        }
        if (found == null) {
            found = descend(expr.getLower(), pos, ctx);
        }
        if (found == null) {
            found = descend(expr.getUpper(), pos, ctx);
        }
        if (found == null) {
            found = descend(expr.getStep(), pos, ctx);
        }
        return orSelf(found, expr, ctx);
    }

    private static NavResult keyword(KeywordExpr expr, Pos pos, SchemaExpr ctx) {
        NavResult found = descend(expr.getArg(), pos, ctx);
        if (found == null) {
            found = descend(expr.getValue(), pos, ctx);
        }
        return orSelf(found, expr, ctx);
    }

    private static NavResult arguments(ArgumentsExpr expr, Pos pos, SchemaExpr ctx) {
        NavResult found = descendFirst(expr.getArgs(), pos, ctx);
        if (found == null) {
            found = descendFirst(expr.getDefaults(), pos, ctx);
        }
        if (found == null) {
            for (NameToken annotation : expr.getTypeAnnotations()) {
                if (annotation != null && annotation.contains(pos)) {
                    return NavResult.of(PseudoExprs.identifierFrom(annotation), ctx);
                }
            }
        }
        return orSelf(found, expr, ctx);
    }

    private static NavResult compare(CompareExpr expr, Pos pos, SchemaExpr ctx) {
        NavResult found = descend(expr.getLeft(), pos, ctx);
        if (found == null) {
            found = descendFirst(expr.getComparators(), pos, ctx);
        }
        return orSelf(found, expr, ctx);
    }

    private static NavResult assign(AssignStmt stmt, Pos pos, SchemaExpr ctx) {
        if (stmt.getTypeAnnotation() != null) {
            // the annotation answers for the whole statement
            return NavResult.of(PseudoExprs.identifierFrom(stmt.getTypeAnnotation()), ctx);
        }
        NavResult found = descend(stmt.getValue(), pos, ctx);
        if (found == null) {
            found = descendFirst(stmt.getTargets(), pos, ctx);
        }
        return found;
    }

    private static NavResult unification(UnificationStmt stmt, Pos pos, SchemaExpr ctx) {
        NavResult found = descend(stmt.getTarget(), pos, ctx);
        if (found == null) {
            found = descend(stmt.getValue(), pos, ctx);
        }
        return found;
    }

    private static NavResult augAssign(AugAssignStmt stmt, Pos pos, SchemaExpr ctx) {
        NavResult found = descend(stmt.getValue(), pos, ctx);
        if (found == null) {
            found = descend(stmt.getTarget(), pos, ctx);
        }
        return found;
    }

    private static NavResult assertStmt(AssertStmt stmt, Pos pos, SchemaExpr ctx) {
        NavResult found = descend(stmt.getTest(), pos, ctx);
        if (found == null) {
            found = descend(stmt.getIfCond(), pos, ctx);
        }
        if (found == null) {
            found = descend(stmt.getMsg(), pos, ctx);
        }
        return found;
    }

    private static NavResult ifStmt(IfStmt stmt, Pos pos, SchemaExpr ctx) {
        NavResult found = descend(stmt.getCond(), pos, ctx);
        if (found == null) {
            found = descendStmts(stmt.getBody(), pos, ctx);
        }
        if (found == null) {
            found = descendStmts(stmt.getOrelse(), pos, ctx);
        }
        return found;
    }

    private static NavResult schemaStmt(SchemaStmt stmt, Pos pos, SchemaExpr ctx) {
        NavResult found = null;
        if (stmt.getName() != null && stmt.getName().contains(pos)) {
            found = NavResult.of(PseudoExprs.identifierFrom(stmt.getName()), ctx);
        }
        if (found == null) {
            found = descend(stmt.getParentName(), pos, ctx);
        }
        if (found == null) {
            found = descend(stmt.getForHostName(), pos, ctx);
        }
        if (found == null) {
            found = descendFirst(stmt.getMixins(), pos, ctx);
        }
        if (found == null) {
            found = descendStmts(stmt.getBody(), pos, ctx);
        }
        if (found == null) {
            found = descendFirst(stmt.getDecorators(), pos, ctx);
        }
        if (found == null) {
            found = descendFirst(stmt.getChecks(), pos, ctx);
        }
        return found;
    }

    private static NavResult schemaAttr(SchemaAttrStmt stmt, Pos pos, SchemaExpr ctx) {
        if (stmt.getTy() != null && stmt.getTy().contains(pos)) {
            return NavResult.of(PseudoExprs.identifierFromType(stmt.getTy(), pos), ctx);
        }
        NavResult found = descend(stmt.getValue(), pos, ctx);
        if (found == null) {
            found = descendFirst(stmt.getDecorators(), pos, ctx);
        }
        return found;
    }

    private static NavResult rule(RuleStmt stmt, Pos pos, SchemaExpr ctx) {
        NavResult found = descendFirst(stmt.getParentRules(), pos, ctx);
        if (found == null) {
            found = descendFirst(stmt.getDecorators(), pos, ctx);
        }
        if (found == null) {
            found = descendFirst(stmt.getChecks(), pos, ctx);
        }
        return found;
    }
}
