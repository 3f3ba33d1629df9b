package com.fnlower.desugar;

import com.fnlower.ast.BinaryOp;
import com.fnlower.ast.Expr;
import com.fnlower.ir.*;
import com.fnlower.util.AstTransform;
import com.fnlower.util.ExprEquality;
import com.fnlower.util.Substitution;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.fnlower.ast.SurfaceFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class OperatorDesugarTest {

    private final Desugarer desugarer = new Desugarer();

    private static CoreVar v(String name) {
        return new CoreVar(name, LOC);
    }

    private static CoreApp call(CoreExpr func, CoreExpr arg) {
        return new CoreApp(func, List.of(arg), LOC);
    }

    /** Beta-reduces single-variable lambdas applied to one argument until nothing changes. */
    private static CoreExpr betaNormalize(CoreExpr expr) {
        CoreExpr current = expr;
        for (int i = 0; i < 20; i++) {
            CoreExpr next = AstTransform.transformExpr(current, e -> {
                if (e instanceof CoreApp app
                        && app.args().size() == 1
                        && app.func() instanceof CoreLambda lambda
                        && lambda.param() instanceof CoreVarPattern param) {
                    return Substitution.substitute(lambda.body(), param.name(), app.args().get(0));
                }
                return e;
            });
            if (ExprEquality.exprEquals(next, current)) {
                return next;
            }
            current = next;
        }
        return current;
    }

    @Test
    void testArithmeticPassesThrough() {
        CoreBinOp result = (CoreBinOp) desugarer.desugar(binOp(BinaryOp.MULTIPLY, intLit(2), var("x")));
        assertEquals(CoreBinaryOp.MULTIPLY, result.op());
        assertEquals(new CoreIntLit(2, LOC), result.left());
        assertEquals(v("x"), result.right());
    }

    @Test
    void testEveryPlainOperatorMapsByName() {
        for (BinaryOp op : BinaryOp.values()) {
            if (op == BinaryOp.CONS || op == BinaryOp.FORWARD_COMPOSE || op == BinaryOp.BACKWARD_COMPOSE) {
                continue;
            }
            CoreBinOp result = (CoreBinOp) desugarer.desugar(binOp(op, var("a"), var("b")));
            assertEquals(op.name(), result.op().name());
        }
    }

    @Test
    void testSugarOperatorsNeverReachPassThrough() {
        for (BinaryOp op : List.of(BinaryOp.CONS, BinaryOp.FORWARD_COMPOSE, BinaryOp.BACKWARD_COMPOSE)) {
            assertThrows(DesugarInternalError.class, () -> Operators.toCore(op, LOC));
        }
    }

    @Test
    void testPipeIsSingleApplication() {
        assertEquals(call(v("f"), v("x")), desugarer.desugar(pipe(var("x"), var("f"))));
    }

    @Test
    void testPipeIntoPartialApplication() {
        Expr surface = pipe(var("x"), app(var("map"), var("g")));
        CoreExpr expected = call(new CoreApp(v("map"), List.of(v("g")), LOC), v("x"));
        assertEquals(expected, desugarer.desugar(surface));
    }

    @Test
    void testForwardComposition() {
        CoreLambda result = (CoreLambda) desugarer.desugar(binOp(BinaryOp.FORWARD_COMPOSE, var("f"), var("g")));
        assertEquals(new CoreVarPattern("$composed0", LOC), result.param());
        assertEquals(call(v("g"), call(v("f"), v("$composed0"))), result.body());
    }

    @Test
    void testBackwardComposition() {
        CoreLambda result = (CoreLambda) desugarer.desugar(binOp(BinaryOp.BACKWARD_COMPOSE, var("f"), var("g")));
        assertEquals(new CoreVarPattern("$composed0", LOC), result.param());
        assertEquals(call(v("f"), call(v("g"), v("$composed0"))), result.body());
    }

    @Test
    void testCompositionDoesNotReuseFunctionParameterNames() {
        Expr f = lambda("x", var("x"));
        CoreLambda result = (CoreLambda) desugarer.desugar(binOp(BinaryOp.FORWARD_COMPOSE, f, var("g")));
        assertTrue(((CoreVarPattern) result.param()).name().startsWith("$composed"));
    }

    @Test
    void testChainedForwardCompositionAppliesLeftToRight() {
        // (f >> g) >> h
        Expr chain = binOp(BinaryOp.FORWARD_COMPOSE,
            binOp(BinaryOp.FORWARD_COMPOSE, var("f"), var("g")),
            var("h"));
        CoreExpr applied = call(desugarer.desugar(chain), v("arg"));

        CoreExpr expected = call(v("h"), call(v("g"), call(v("f"), v("arg"))));
        assertTrue(ExprEquality.exprEquals(expected, betaNormalize(applied)));
    }

    @Test
    void testChainedBackwardCompositionAppliesRightToLeft() {
        // (f << g) << h
        Expr chain = binOp(BinaryOp.BACKWARD_COMPOSE,
            binOp(BinaryOp.BACKWARD_COMPOSE, var("f"), var("g")),
            var("h"));
        CoreExpr applied = call(desugarer.desugar(chain), v("arg"));

        CoreExpr expected = call(v("f"), call(v("g"), call(v("h"), v("arg"))));
        assertTrue(ExprEquality.exprEquals(expected, betaNormalize(applied)));
    }

    @Test
    void testNestedCompositionsGetDistinctParameters() {
        Expr chain = binOp(BinaryOp.FORWARD_COMPOSE,
            binOp(BinaryOp.FORWARD_COMPOSE, var("f"), var("g")),
            var("h"));
        CoreLambda outer = (CoreLambda) desugarer.desugar(chain);
        CoreApp body = (CoreApp) outer.body();
        CoreApp innerCall = (CoreApp) body.args().get(0);
        CoreLambda inner = (CoreLambda) innerCall.func();
        assertNotEquals(outer.param(), inner.param());
    }
}
