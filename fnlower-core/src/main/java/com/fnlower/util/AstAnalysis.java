package com.fnlower.util;

import com.fnlower.ir.*;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Read-only queries over core expressions. Result sets keep first-seen order.
 */
public final class AstAnalysis {

    private AstAnalysis() {}

    /**
     * Variables referenced in {@code expr} but not bound inside it.
     */
    public static Set<String> freeVars(CoreExpr expr) {
        Set<String> result = new LinkedHashSet<>();
        collectFree(expr, result);
        return result;
    }

    private static void collectFree(CoreExpr expr, Set<String> out) {
        if (expr instanceof CoreVar v) {
            out.add(v.name());
        } else if (expr instanceof CoreLet let) {
            Set<String> bound = patternBoundVars(let.pattern());
            Set<String> fromValue = freeVars(let.value());
            if (let.recursive()) {
                fromValue.removeAll(bound);
            }
            out.addAll(fromValue);
            Set<String> fromBody = freeVars(let.body());
            fromBody.removeAll(bound);
            out.addAll(fromBody);
        } else if (expr instanceof CoreLetRecExpr letRec) {
            Set<String> bound = new LinkedHashSet<>();
            for (CoreRecBinding b : letRec.bindings()) {
                bound.addAll(patternBoundVars(b.pattern()));
            }
            Set<String> inner = new LinkedHashSet<>();
            for (CoreRecBinding b : letRec.bindings()) {
                collectFree(b.value(), inner);
            }
            collectFree(letRec.body(), inner);
            inner.removeAll(bound);
            out.addAll(inner);
        } else if (expr instanceof CoreLambda lambda) {
            Set<String> fromBody = freeVars(lambda.body());
            fromBody.removeAll(patternBoundVars(lambda.param()));
            out.addAll(fromBody);
        } else if (expr instanceof CoreMatch match) {
            collectFree(match.expr(), out);
            for (CoreMatchCase c : match.cases()) {
                Set<String> inCase = new LinkedHashSet<>();
                if (c.guard() != null) {
                    collectFree(c.guard(), inCase);
                }
                collectFree(c.body(), inCase);
                inCase.removeAll(patternBoundVars(c.pattern()));
                out.addAll(inCase);
            }
        } else {
            for (CoreExpr child : AstTransform.children(expr)) {
                collectFree(child, out);
            }
        }
    }

    /**
     * Names a pattern binds when it matches.
     */
    public static Set<String> patternBoundVars(CorePattern pattern) {
        Set<String> result = new LinkedHashSet<>();
        collectBound(pattern, result);
        return result;
    }

    private static void collectBound(CorePattern pattern, Set<String> out) {
        if (pattern instanceof CoreVarPattern v) {
            out.add(v.name());
        } else if (pattern instanceof CoreVariantPattern variant) {
            for (CorePattern arg : variant.args()) {
                collectBound(arg, out);
            }
        } else if (pattern instanceof CoreRecordPattern record) {
            for (CoreRecordPatternField field : record.fields()) {
                collectBound(field.pattern(), out);
            }
        } else if (pattern instanceof CoreTuplePattern tuple) {
            for (CorePattern element : tuple.elements()) {
                collectBound(element, out);
            }
        }
    }

    /**
     * Number of expression nodes.
     */
    public static int astSize(CoreExpr expr) {
        return AstTransform.foldExpr(expr, (node, n) -> n + 1, 0);
    }

    /**
     * Weighted node count used as an inlining cost: leaves 1, operators and field access 2,
     * calls and constructors 3, binders and matches 5, anything else 2.
     */
    public static int complexity(CoreExpr expr) {
        return AstTransform.foldExpr(expr, (node, score) -> score + weight(node), 0);
    }

    private static int weight(CoreExpr node) {
        if (node instanceof CoreIntLit || node instanceof CoreFloatLit || node instanceof CoreStringLit
                || node instanceof CoreBoolLit || node instanceof CoreUnitLit || node instanceof CoreVar) {
            return 1;
        } else if (node instanceof CoreBinOp || node instanceof CoreUnaryOp || node instanceof CoreRecordAccess) {
            return 2;
        } else if (node instanceof CoreApp || node instanceof CoreVariant) {
            return 3;
        } else if (node instanceof CoreLambda || node instanceof CoreMatch
                || node instanceof CoreLet || node instanceof CoreLetRecExpr) {
            return 5;
        }
        return 2;
    }

    public static boolean containsUnsafe(CoreExpr expr) {
        return AstTransform.foldExpr(expr, (node, found) -> found || node instanceof CoreUnsafe, false);
    }

    /**
     * True if any node creates, reads or writes a mutable reference.
     */
    public static boolean containsRef(CoreExpr expr) {
        return AstTransform.foldExpr(expr, (node, found) -> found || isRefOperation(node), false);
    }

    /**
     * Checks the node itself only: {@code !r}, {@code r := v}, a {@code Ref} variant, or a call
     * to {@code ref}. Constructor and function names compare case-insensitively.
     */
    public static boolean isRefOperation(CoreExpr expr) {
        if (expr instanceof CoreUnaryOp unary) {
            return unary.op() == CoreUnary.DEREF;
        } else if (expr instanceof CoreBinOp binOp) {
            return binOp.op() == CoreBinaryOp.REF_ASSIGN;
        } else if (expr instanceof CoreVariant variant) {
            return variant.constructor().toLowerCase(Locale.ROOT).equals("ref");
        } else if (expr instanceof CoreApp app) {
            return app.func() instanceof CoreVar v && v.name().toLowerCase(Locale.ROOT).equals("ref");
        }
        return false;
    }

    public static boolean isMutuallyRecursive(CoreExpr expr) {
        return expr instanceof CoreLetRecExpr letRec && letRec.bindings().size() > 1;
    }

    /**
     * True if {@code varName} occurs free in {@code body}, i.e. a binding of that name with
     * this value would refer to itself.
     */
    public static boolean isRecursive(String varName, CoreExpr body) {
        return freeVars(body).contains(varName);
    }

    /**
     * Counts every {@link CoreVar} spelled {@code varName}, including occurrences under a
     * binder that shadows it.
     */
    public static int countVarUses(String varName, CoreExpr expr) {
        return AstTransform.foldExpr(expr,
            (node, n) -> node instanceof CoreVar v && v.name().equals(varName) ? n + 1 : n, 0);
    }
}
