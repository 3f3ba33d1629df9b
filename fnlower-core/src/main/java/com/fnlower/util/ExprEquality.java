package com.fnlower.util;

import com.fnlower.ir.*;

import java.util.List;
import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Structural equality on core trees. Locations are ignored; everything else must match,
 * including the spelling of bound variables. Float literals compare by bit pattern.
 */
public final class ExprEquality {

    private ExprEquality() {}

    public static boolean exprEquals(CoreExpr a, CoreExpr b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null || a.getClass() != b.getClass()) {
            return false;
        }

        if (a instanceof CoreIntLit x) {
            return x.value() == ((CoreIntLit) b).value();
        } else if (a instanceof CoreFloatLit x) {
            return Double.doubleToLongBits(x.value()) == Double.doubleToLongBits(((CoreFloatLit) b).value());
        } else if (a instanceof CoreStringLit x) {
            return x.value().equals(((CoreStringLit) b).value());
        } else if (a instanceof CoreBoolLit x) {
            return x.value() == ((CoreBoolLit) b).value();
        } else if (a instanceof CoreUnitLit) {
            return true;
        } else if (a instanceof CoreVar x) {
            return x.name().equals(((CoreVar) b).name());
        } else if (a instanceof CoreLet x) {
            CoreLet y = (CoreLet) b;
            return x.mutable() == y.mutable()
                && x.recursive() == y.recursive()
                && patternEquals(x.pattern(), y.pattern())
                && exprEquals(x.value(), y.value())
                && exprEquals(x.body(), y.body());
        } else if (a instanceof CoreLetRecExpr x) {
            CoreLetRecExpr y = (CoreLetRecExpr) b;
            return listEquals(x.bindings(), y.bindings(), ExprEquality::bindingEquals)
                && exprEquals(x.body(), y.body());
        } else if (a instanceof CoreLambda x) {
            CoreLambda y = (CoreLambda) b;
            return patternEquals(x.param(), y.param()) && exprEquals(x.body(), y.body());
        } else if (a instanceof CoreApp x) {
            CoreApp y = (CoreApp) b;
            return exprEquals(x.func(), y.func()) && listEquals(x.args(), y.args(), ExprEquality::exprEquals);
        } else if (a instanceof CoreMatch x) {
            CoreMatch y = (CoreMatch) b;
            return exprEquals(x.expr(), y.expr()) && listEquals(x.cases(), y.cases(), ExprEquality::caseEquals);
        } else if (a instanceof CoreRecord x) {
            return listEquals(x.fields(), ((CoreRecord) b).fields(), ExprEquality::fieldEquals);
        } else if (a instanceof CoreRecordAccess x) {
            CoreRecordAccess y = (CoreRecordAccess) b;
            return x.field().equals(y.field()) && exprEquals(x.record(), y.record());
        } else if (a instanceof CoreRecordUpdate x) {
            CoreRecordUpdate y = (CoreRecordUpdate) b;
            return exprEquals(x.record(), y.record())
                && listEquals(x.updates(), y.updates(), ExprEquality::fieldEquals);
        } else if (a instanceof CoreVariant x) {
            CoreVariant y = (CoreVariant) b;
            return x.constructor().equals(y.constructor())
                && listEquals(x.args(), y.args(), ExprEquality::exprEquals);
        } else if (a instanceof CoreBinOp x) {
            CoreBinOp y = (CoreBinOp) b;
            return x.op() == y.op() && exprEquals(x.left(), y.left()) && exprEquals(x.right(), y.right());
        } else if (a instanceof CoreUnaryOp x) {
            CoreUnaryOp y = (CoreUnaryOp) b;
            return x.op() == y.op() && exprEquals(x.expr(), y.expr());
        } else if (a instanceof CoreTypeAnnotation x) {
            CoreTypeAnnotation y = (CoreTypeAnnotation) b;
            return exprEquals(x.expr(), y.expr()) && typeExprEquals(x.typeExpr(), y.typeExpr());
        } else if (a instanceof CoreUnsafe x) {
            return exprEquals(x.expr(), ((CoreUnsafe) b).expr());
        } else if (a instanceof CoreTuple x) {
            return listEquals(x.elements(), ((CoreTuple) b).elements(), ExprEquality::exprEquals);
        }
        return false;
    }

    /**
     * Hook for a looser notion of equivalence (alpha-renaming, algebraic identities).
     * Currently the same as {@link #exprEquals}.
     */
    public static boolean exprEquivalent(CoreExpr a, CoreExpr b) {
        return exprEquals(a, b);
    }

    public static boolean patternEquals(CorePattern a, CorePattern b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null || a.getClass() != b.getClass()) {
            return false;
        }

        if (a instanceof CoreWildcardPattern) {
            return true;
        } else if (a instanceof CoreVarPattern x) {
            return x.name().equals(((CoreVarPattern) b).name());
        } else if (a instanceof CoreLiteralPattern x) {
            return literalEquals(x.literal(), ((CoreLiteralPattern) b).literal());
        } else if (a instanceof CoreVariantPattern x) {
            CoreVariantPattern y = (CoreVariantPattern) b;
            return x.constructor().equals(y.constructor())
                && listEquals(x.args(), y.args(), ExprEquality::patternEquals);
        } else if (a instanceof CoreRecordPattern x) {
            return listEquals(x.fields(), ((CoreRecordPattern) b).fields(),
                (f, g) -> f.name().equals(g.name()) && patternEquals(f.pattern(), g.pattern()));
        } else if (a instanceof CoreTuplePattern x) {
            return listEquals(x.elements(), ((CoreTuplePattern) b).elements(), ExprEquality::patternEquals);
        }
        return false;
    }

    public static boolean typeExprEquals(CoreTypeExpr a, CoreTypeExpr b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null || a.getClass() != b.getClass()) {
            return false;
        }

        if (a instanceof CoreTypeVar x) {
            return x.name().equals(((CoreTypeVar) b).name());
        } else if (a instanceof CoreTypeConst x) {
            return x.name().equals(((CoreTypeConst) b).name());
        } else if (a instanceof CoreTypeApp x) {
            CoreTypeApp y = (CoreTypeApp) b;
            return typeExprEquals(x.constructor(), y.constructor())
                && listEquals(x.args(), y.args(), ExprEquality::typeExprEquals);
        } else if (a instanceof CoreFunctionType x) {
            CoreFunctionType y = (CoreFunctionType) b;
            return listEquals(x.params(), y.params(), ExprEquality::typeExprEquals)
                && typeExprEquals(x.returnType(), y.returnType());
        } else if (a instanceof CoreRecordType x) {
            return listEquals(x.fields(), ((CoreRecordType) b).fields(),
                (f, g) -> f.name().equals(g.name()) && typeExprEquals(f.typeExpr(), g.typeExpr()));
        } else if (a instanceof CoreVariantType x) {
            return listEquals(x.constructors(), ((CoreVariantType) b).constructors(),
                (f, g) -> f.name().equals(g.name()) && listEquals(f.args(), g.args(), ExprEquality::typeExprEquals));
        } else if (a instanceof CoreUnionType x) {
            return listEquals(x.types(), ((CoreUnionType) b).types(), ExprEquality::typeExprEquals);
        } else if (a instanceof CoreTupleType x) {
            return listEquals(x.elements(), ((CoreTupleType) b).elements(), ExprEquality::typeExprEquals);
        }
        return false;
    }

    private static boolean caseEquals(CoreMatchCase a, CoreMatchCase b) {
        return patternEquals(a.pattern(), b.pattern())
            && exprEquals(a.guard(), b.guard())
            && exprEquals(a.body(), b.body());
    }

    private static boolean bindingEquals(CoreRecBinding a, CoreRecBinding b) {
        return a.mutable() == b.mutable()
            && patternEquals(a.pattern(), b.pattern())
            && exprEquals(a.value(), b.value());
    }

    private static boolean fieldEquals(CoreRecordField a, CoreRecordField b) {
        if (a instanceof CoreRecordField.Field x && b instanceof CoreRecordField.Field y) {
            return x.name().equals(y.name()) && exprEquals(x.value(), y.value());
        }
        if (a instanceof CoreRecordField.Spread x && b instanceof CoreRecordField.Spread y) {
            return exprEquals(x.expr(), y.expr());
        }
        return false;
    }

    private static boolean literalEquals(Object a, Object b) {
        if (a instanceof Double x && b instanceof Double y) {
            return Double.doubleToLongBits(x) == Double.doubleToLongBits(y);
        }
        return Objects.equals(a, b);
    }

    private static <T> boolean listEquals(List<T> a, List<T> b, BiPredicate<T, T> eq) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!eq.test(a.get(i), b.get(i))) {
                return false;
            }
        }
        return true;
    }
}
