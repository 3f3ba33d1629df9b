package com.fnlower.desugar;

import com.fnlower.ast.BinaryOp;
import com.fnlower.ast.Expr;
import com.fnlower.ast.ListCons;
import com.fnlower.ast.ListLit;
import com.fnlower.ir.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.fnlower.ast.SurfaceFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class ListDesugarTest {

    private final Desugarer desugarer = new Desugarer();

    private static CoreExpr nil() {
        return new CoreVariant("Nil", List.of(), LOC);
    }

    private static CoreExpr cons(CoreExpr head, CoreExpr tail) {
        return new CoreVariant("Cons", List.of(head, tail), LOC);
    }

    private static CoreExpr num(long n) {
        return new CoreIntLit(n, LOC);
    }

    @Test
    void testEmptyListIsNil() {
        assertEquals(nil(), desugarer.desugar(list()));
    }

    @Test
    void testThreeElementsWalkToNil() {
        CoreExpr result = desugarer.desugar(list(intLit(1), intLit(2), intLit(3)));

        CoreExpr current = result;
        for (long expected = 1; expected <= 3; expected++) {
            CoreVariant node = assertInstanceOf(CoreVariant.class, current);
            assertEquals("Cons", node.constructor());
            assertEquals(2, node.args().size());
            assertEquals(num(expected), node.args().get(0));
            current = node.args().get(1);
        }
        CoreVariant end = assertInstanceOf(CoreVariant.class, current);
        assertEquals("Nil", end.constructor());
        assertTrue(end.args().isEmpty());

        assertEquals(cons(num(1), cons(num(2), cons(num(3), nil()))), result);
    }

    @Test
    void testChainDepthMatchesElementCount() {
        for (int k = 0; k <= 5; k++) {
            Expr[] elements = new Expr[k];
            for (int i = 0; i < k; i++) {
                elements[i] = intLit(i);
            }
            CoreExpr current = desugarer.desugar(list(elements));
            int depth = 0;
            while (current instanceof CoreVariant v && v.constructor().equals("Cons")) {
                depth++;
                current = v.args().get(1);
            }
            assertEquals(k, depth);
            assertEquals(nil(), current);
        }
    }

    @Test
    void testTrailingSpreadBecomesTail() {
        ListLit list = listOf(elem(intLit(1)), elem(intLit(2)), spread(var("rest")));
        assertEquals(cons(num(1), cons(num(2), new CoreVar("rest", LOC))), desugarer.desugar(list));
    }

    @Test
    void testLoneSpreadIsTheSpreadExpression() {
        assertEquals(new CoreVar("xs", LOC), desugarer.desugar(listOf(spread(var("xs")))));
    }

    @Test
    void testLeadingSpreadUsesConcat() {
        ListLit list = listOf(spread(var("xs")), elem(intLit(1)));
        CoreApp result = (CoreApp) desugarer.desugar(list);
        assertEquals(new CoreVar("concat", LOC), result.func());
        assertEquals(List.of(new CoreVar("xs", LOC), cons(num(1), nil())), result.args());
    }

    @Test
    void testSegmentsAreConcatenatedRightAssociatively() {
        ListLit list = listOf(elem(intLit(1)), spread(var("a")), elem(intLit(2)), spread(var("b")));
        CoreExpr concat = new CoreVar("concat", LOC);
        CoreExpr expected = new CoreApp(concat, List.of(
            cons(num(1), nil()),
            new CoreApp(concat, List.of(
                new CoreVar("a", LOC),
                new CoreApp(concat, List.of(cons(num(2), nil()), new CoreVar("b", LOC)), LOC)
            ), LOC)
        ), LOC);
        assertEquals(expected, desugarer.desugar(list));
    }

    @Test
    void testConcatFunctionIsConfigurable() {
        Desugarer custom = new Desugarer(new FreshVarGen(),
            DesugarOptions.defaults().withListConcatFunction("List.append"));
        CoreApp result = (CoreApp) custom.desugar(listOf(spread(var("a")), spread(var("b"))));
        assertEquals(new CoreVar("List.append", LOC), result.func());
    }

    @Test
    void testConsOperatorAndConsExpression() {
        CoreExpr expected = cons(num(1), new CoreVar("t", LOC));
        assertEquals(expected, desugarer.desugar(binOp(BinaryOp.CONS, intLit(1), var("t"))));
        assertEquals(expected, desugarer.desugar(new ListCons(intLit(1), var("t"), LOC)));
    }

    @Test
    void testMissingElementFails() {
        ListLit list = new ListLit(Arrays.asList(elem(intLit(1)), null), LOC);
        DesugarException e = assertThrows(DesugarException.class, () -> desugarer.desugar(list));
        assertEquals("List has undefined element at index 1", e.getMessage());
    }

    @Test
    void testEmptyListPattern() {
        assertEquals(
            new CoreVariantPattern("Nil", List.of(), LOC),
            desugarer.desugarPattern(pList(List.of(), null)));
    }

    @Test
    void testRestOnlyPatternIsTheRestPattern() {
        assertEquals(new CoreVarPattern("rest", LOC), desugarer.desugarPattern(pList(List.of(), pVar("rest"))));
    }

    @Test
    void testListPatternWithRest() {
        CorePattern expected = new CoreVariantPattern("Cons", List.of(
            new CoreVarPattern("x", LOC),
            new CoreVariantPattern("Cons", List.of(new CoreVarPattern("y", LOC), new CoreVarPattern("rest", LOC)), LOC)
        ), LOC);
        assertEquals(expected, desugarer.desugarPattern(pList(List.of(pVar("x"), pVar("y")), pVar("rest"))));
    }

    @Test
    void testFixedLengthListPattern() {
        CorePattern expected = new CoreVariantPattern("Cons", List.of(
            new CoreWildcardPattern(LOC),
            new CoreVariantPattern("Nil", List.of(), LOC)
        ), LOC);
        assertEquals(expected, desugarer.desugarPattern(pList(List.of(pWild()), null)));
    }
}
