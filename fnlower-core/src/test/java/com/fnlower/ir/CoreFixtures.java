package com.fnlower.ir;

import com.fnlower.ast.Location;

import java.util.List;

/**
 * Short constructors for core trees in tests.
 */
public final class CoreFixtures {

    public static final Location LOC = new Location("test.fn", 1, 1, 0);

    private CoreFixtures() {}

    public static CoreIntLit cInt(long value) {
        return new CoreIntLit(value, LOC);
    }

    public static CoreFloatLit cFloat(double value) {
        return new CoreFloatLit(value, LOC);
    }

    public static CoreStringLit cStr(String value) {
        return new CoreStringLit(value, LOC);
    }

    public static CoreBoolLit cBool(boolean value) {
        return new CoreBoolLit(value, LOC);
    }

    public static CoreUnitLit cUnit() {
        return new CoreUnitLit(LOC);
    }

    public static CoreVar cVar(String name) {
        return new CoreVar(name, LOC);
    }

    public static CoreLambda cLam(String param, CoreExpr body) {
        return new CoreLambda(cpVar(param), body, LOC);
    }

    public static CoreApp cApp(CoreExpr func, CoreExpr... args) {
        return new CoreApp(func, List.of(args), LOC);
    }

    public static CoreLet cLet(String name, CoreExpr value, CoreExpr body) {
        return new CoreLet(cpVar(name), value, body, false, false, LOC);
    }

    public static CoreLet cLetRec(String name, CoreExpr value, CoreExpr body) {
        return new CoreLet(cpVar(name), value, body, false, true, LOC);
    }

    public static CoreLetRecExpr cLetRecGroup(List<CoreRecBinding> bindings, CoreExpr body) {
        return new CoreLetRecExpr(bindings, body, LOC);
    }

    public static CoreRecBinding cBinding(String name, CoreExpr value) {
        return new CoreRecBinding(cpVar(name), value, false, LOC);
    }

    public static CoreBinOp cBin(CoreBinaryOp op, CoreExpr left, CoreExpr right) {
        return new CoreBinOp(op, left, right, LOC);
    }

    public static CoreBinOp cAdd(CoreExpr left, CoreExpr right) {
        return cBin(CoreBinaryOp.ADD, left, right);
    }

    public static CoreMatch cMatch(CoreExpr expr, CoreMatchCase... cases) {
        return new CoreMatch(expr, List.of(cases), LOC);
    }

    public static CoreMatchCase cCase(CorePattern pattern, CoreExpr body) {
        return new CoreMatchCase(pattern, null, body, LOC);
    }

    public static CoreMatchCase cCase(CorePattern pattern, CoreExpr guard, CoreExpr body) {
        return new CoreMatchCase(pattern, guard, body, LOC);
    }

    public static CoreVariant cVariant(String constructor, CoreExpr... args) {
        return new CoreVariant(constructor, List.of(args), LOC);
    }

    public static CoreTuple cTuple(CoreExpr... elements) {
        return new CoreTuple(List.of(elements), LOC);
    }

    public static CoreRecord cRecord(CoreRecordField... fields) {
        return new CoreRecord(List.of(fields), LOC);
    }

    public static CoreRecordField cField(String name, CoreExpr value) {
        return new CoreRecordField.Field(name, value, LOC);
    }

    public static CoreRecordField cSpread(CoreExpr expr) {
        return new CoreRecordField.Spread(expr, LOC);
    }

    // Patterns

    public static CoreVarPattern cpVar(String name) {
        return new CoreVarPattern(name, LOC);
    }

    public static CoreWildcardPattern cpWild() {
        return new CoreWildcardPattern(LOC);
    }

    public static CoreLiteralPattern cpLit(Object literal) {
        return new CoreLiteralPattern(literal, LOC);
    }

    public static CoreVariantPattern cpVariant(String constructor, CorePattern... args) {
        return new CoreVariantPattern(constructor, List.of(args), LOC);
    }

    public static CoreTuplePattern cpTuple(CorePattern... elements) {
        return new CoreTuplePattern(List.of(elements), LOC);
    }
}
