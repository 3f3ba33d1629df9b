package com.fnlower.util;

import com.fnlower.ir.*;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Generic walks over core expressions, so passes don't each re-implement the recursion.
 *
 * <p>Child slots covered for every node: sub-expressions, let and let-rec binding values,
 * match scrutinee, guards and bodies, record field values and spreads, variant arguments
 * and tuple elements. Patterns and type expressions hold no expressions and are carried
 * over untouched.
 */
public final class AstTransform {

    private AstTransform() {}

    /**
     * Bottom-up rewrite: children are transformed first, then {@code fn} is applied to the
     * rebuilt node and its result is used in place of the node.
     */
    public static CoreExpr transformExpr(CoreExpr expr, UnaryOperator<CoreExpr> fn) {
        return fn.apply(transformChildren(expr, child -> transformExpr(child, fn)));
    }

    /**
     * Rebuilds {@code expr} with {@code fn} applied to each direct child expression.
     * Leaves are returned as is.
     */
    public static CoreExpr transformChildren(CoreExpr expr, UnaryOperator<CoreExpr> fn) {
        if (expr instanceof CoreIntLit || expr instanceof CoreFloatLit || expr instanceof CoreStringLit
                || expr instanceof CoreBoolLit || expr instanceof CoreUnitLit || expr instanceof CoreVar) {
            return expr;
        } else if (expr instanceof CoreLet let) {
            return new CoreLet(let.pattern(), fn.apply(let.value()), fn.apply(let.body()),
                let.mutable(), let.recursive(), let.loc());
        } else if (expr instanceof CoreLetRecExpr letRec) {
            List<CoreRecBinding> bindings = new ArrayList<>(letRec.bindings().size());
            for (CoreRecBinding b : letRec.bindings()) {
                bindings.add(new CoreRecBinding(b.pattern(), fn.apply(b.value()), b.mutable(), b.loc()));
            }
            return new CoreLetRecExpr(bindings, fn.apply(letRec.body()), letRec.loc());
        } else if (expr instanceof CoreLambda lambda) {
            return new CoreLambda(lambda.param(), fn.apply(lambda.body()), lambda.loc());
        } else if (expr instanceof CoreApp app) {
            return new CoreApp(fn.apply(app.func()), map(app.args(), fn), app.loc());
        } else if (expr instanceof CoreMatch match) {
            CoreExpr scrutinee = fn.apply(match.expr());
            List<CoreMatchCase> cases = new ArrayList<>(match.cases().size());
            for (CoreMatchCase c : match.cases()) {
                CoreExpr guard = c.guard() != null ? fn.apply(c.guard()) : null;
                cases.add(new CoreMatchCase(c.pattern(), guard, fn.apply(c.body()), c.loc()));
            }
            return new CoreMatch(scrutinee, cases, match.loc());
        } else if (expr instanceof CoreRecord record) {
            return new CoreRecord(mapFields(record.fields(), fn), record.loc());
        } else if (expr instanceof CoreRecordAccess access) {
            return new CoreRecordAccess(fn.apply(access.record()), access.field(), access.loc());
        } else if (expr instanceof CoreRecordUpdate update) {
            return new CoreRecordUpdate(fn.apply(update.record()), mapFields(update.updates(), fn), update.loc());
        } else if (expr instanceof CoreVariant variant) {
            return new CoreVariant(variant.constructor(), map(variant.args(), fn), variant.loc());
        } else if (expr instanceof CoreBinOp binOp) {
            return new CoreBinOp(binOp.op(), fn.apply(binOp.left()), fn.apply(binOp.right()), binOp.loc());
        } else if (expr instanceof CoreUnaryOp unary) {
            return new CoreUnaryOp(unary.op(), fn.apply(unary.expr()), unary.loc());
        } else if (expr instanceof CoreTypeAnnotation annotation) {
            return new CoreTypeAnnotation(fn.apply(annotation.expr()), annotation.typeExpr(), annotation.loc());
        } else if (expr instanceof CoreUnsafe unsafe) {
            return new CoreUnsafe(fn.apply(unsafe.expr()), unsafe.loc());
        } else if (expr instanceof CoreTuple tuple) {
            return new CoreTuple(map(tuple.elements(), fn), tuple.loc());
        }
        throw new IllegalStateException("Unknown core expression kind: " + expr.kind());
    }

    /**
     * Calls {@code fn} on every expression node, parent before children, children in slot order.
     */
    public static void visitExpr(CoreExpr expr, Consumer<CoreExpr> fn) {
        fn.accept(expr);
        for (CoreExpr child : children(expr)) {
            visitExpr(child, fn);
        }
    }

    /**
     * Threads an accumulator through the nodes in {@link #visitExpr} order.
     */
    public static <T> T foldExpr(CoreExpr expr, BiFunction<CoreExpr, T, T> fn, T initial) {
        T acc = fn.apply(expr, initial);
        for (CoreExpr child : children(expr)) {
            acc = foldExpr(child, fn, acc);
        }
        return acc;
    }

    /**
     * Direct child expressions in slot order.
     */
    public static List<CoreExpr> children(CoreExpr expr) {
        List<CoreExpr> result = new ArrayList<>();
        if (expr instanceof CoreLet let) {
            result.add(let.value());
            result.add(let.body());
        } else if (expr instanceof CoreLetRecExpr letRec) {
            for (CoreRecBinding b : letRec.bindings()) {
                result.add(b.value());
            }
            result.add(letRec.body());
        } else if (expr instanceof CoreLambda lambda) {
            result.add(lambda.body());
        } else if (expr instanceof CoreApp app) {
            result.add(app.func());
            result.addAll(app.args());
        } else if (expr instanceof CoreMatch match) {
            result.add(match.expr());
            for (CoreMatchCase c : match.cases()) {
                if (c.guard() != null) {
                    result.add(c.guard());
                }
                result.add(c.body());
            }
        } else if (expr instanceof CoreRecord record) {
            addFields(result, record.fields());
        } else if (expr instanceof CoreRecordAccess access) {
            result.add(access.record());
        } else if (expr instanceof CoreRecordUpdate update) {
            result.add(update.record());
            addFields(result, update.updates());
        } else if (expr instanceof CoreVariant variant) {
            result.addAll(variant.args());
        } else if (expr instanceof CoreBinOp binOp) {
            result.add(binOp.left());
            result.add(binOp.right());
        } else if (expr instanceof CoreUnaryOp unary) {
            result.add(unary.expr());
        } else if (expr instanceof CoreTypeAnnotation annotation) {
            result.add(annotation.expr());
        } else if (expr instanceof CoreUnsafe unsafe) {
            result.add(unsafe.expr());
        } else if (expr instanceof CoreTuple tuple) {
            result.addAll(tuple.elements());
        }
        return result;
    }

    private static void addFields(List<CoreExpr> out, List<CoreRecordField> fields) {
        for (CoreRecordField field : fields) {
            if (field instanceof CoreRecordField.Field f) {
                out.add(f.value());
            } else if (field instanceof CoreRecordField.Spread s) {
                out.add(s.expr());
            }
        }
    }

    private static List<CoreExpr> map(List<CoreExpr> exprs, UnaryOperator<CoreExpr> fn) {
        List<CoreExpr> result = new ArrayList<>(exprs.size());
        for (CoreExpr e : exprs) {
            result.add(fn.apply(e));
        }
        return result;
    }

    private static List<CoreRecordField> mapFields(List<CoreRecordField> fields, UnaryOperator<CoreExpr> fn) {
        List<CoreRecordField> result = new ArrayList<>(fields.size());
        for (CoreRecordField field : fields) {
            if (field instanceof CoreRecordField.Field f) {
                result.add(new CoreRecordField.Field(f.name(), fn.apply(f.value()), f.loc()));
            } else if (field instanceof CoreRecordField.Spread s) {
                result.add(new CoreRecordField.Spread(fn.apply(s.expr()), s.loc()));
            }
        }
        return result;
    }
}
