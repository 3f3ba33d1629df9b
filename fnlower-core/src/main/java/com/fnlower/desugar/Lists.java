package com.fnlower.desugar;

import com.fnlower.ast.ListElement;
import com.fnlower.ast.ListPattern;
import com.fnlower.ast.Location;
import com.fnlower.ast.Pattern;
import com.fnlower.ir.CoreApp;
import com.fnlower.ir.CoreExpr;
import com.fnlower.ir.CorePattern;
import com.fnlower.ir.CoreVar;
import com.fnlower.ir.CoreVariant;
import com.fnlower.ir.CoreVariantPattern;

import java.util.ArrayList;
import java.util.List;

/**
 * Encodes list literals, {@code ::} and list patterns as {@code Cons}/{@code Nil} variants.
 */
final class Lists {

    static final String CONS = "Cons";
    static final String NIL = "Nil";

    private Lists() {}

    static CoreExpr nil(Location loc) {
        return new CoreVariant(NIL, List.of(), loc);
    }

    static CoreExpr cons(CoreExpr head, CoreExpr tail, Location loc) {
        return new CoreVariant(CONS, List.of(head, tail), loc);
    }

    /**
     * Three shapes:
     * <ul>
     *   <li>no spread: {@code [a, b]} becomes {@code Cons(a, Cons(b, Nil))}</li>
     *   <li>only the last element spread: {@code [a, ...r]} becomes {@code Cons(a, r)}</li>
     *   <li>otherwise segments are joined with the configured concat function</li>
     * </ul>
     */
    static CoreExpr desugarList(Desugarer desugarer, List<ListElement> elements, Location loc) {
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i) == null) {
                throw new DesugarException("List has undefined element at index " + i, loc);
            }
        }
        if (elements.isEmpty()) {
            return nil(loc);
        }

        int spreads = 0;
        for (ListElement element : elements) {
            if (element instanceof ListElement.Spread) {
                spreads++;
            }
        }
        ListElement last = elements.get(elements.size() - 1);

        if (spreads == 0) {
            return consChain(desugarer, elements, nil(loc), loc);
        }
        if (spreads == 1 && last instanceof ListElement.Spread) {
            List<ListElement> leading = elements.subList(0, elements.size() - 1);
            // Leading elements are desugared before the spread to keep source order.
            List<CoreExpr> heads = desugarElements(desugarer, leading);
            CoreExpr tail = desugarer.desugar(last.expr());
            return foldCons(heads, tail, loc);
        }
        return desugarWithConcat(desugarer, elements, loc);
    }

    private static CoreExpr desugarWithConcat(Desugarer desugarer, List<ListElement> elements, Location loc) {
        List<CoreExpr> segments = new ArrayList<>();
        List<ListElement> run = new ArrayList<>();
        for (ListElement element : elements) {
            if (element instanceof ListElement.Spread) {
                if (!run.isEmpty()) {
                    segments.add(consChain(desugarer, run, nil(loc), loc));
                    run = new ArrayList<>();
                }
                segments.add(desugarer.desugar(element.expr()));
            } else {
                run.add(element);
            }
        }
        if (!run.isEmpty()) {
            segments.add(consChain(desugarer, run, nil(loc), loc));
        }

        String concat = desugarer.options().listConcatFunction();
        CoreExpr result = segments.get(segments.size() - 1);
        for (int i = segments.size() - 2; i >= 0; i--) {
            result = new CoreApp(new CoreVar(concat, loc), List.of(segments.get(i), result), loc);
        }
        return result;
    }

    private static CoreExpr consChain(Desugarer desugarer, List<ListElement> elements, CoreExpr tail, Location loc) {
        return foldCons(desugarElements(desugarer, elements), tail, loc);
    }

    private static List<CoreExpr> desugarElements(Desugarer desugarer, List<ListElement> elements) {
        List<CoreExpr> result = new ArrayList<>(elements.size());
        for (ListElement element : elements) {
            result.add(desugarer.desugar(element.expr()));
        }
        return result;
    }

    private static CoreExpr foldCons(List<CoreExpr> heads, CoreExpr tail, Location loc) {
        CoreExpr result = tail;
        for (int i = heads.size() - 1; i >= 0; i--) {
            result = cons(heads.get(i), result, loc);
        }
        return result;
    }

    /**
     * {@code [p1, p2, ...rest]} becomes {@code Cons(p1, Cons(p2, rest))}; without a rest the
     * chain ends in {@code Nil}. A lone rest pattern is returned as is.
     */
    static CorePattern desugarListPattern(Desugarer desugarer, ListPattern pattern) {
        Location loc = pattern.loc();
        List<CorePattern> elements = desugarer.desugarPatterns(pattern.elements(), "List pattern", loc);
        Pattern rest = pattern.rest();

        CorePattern result = rest != null
            ? desugarer.desugarPattern(rest)
            : new CoreVariantPattern(NIL, List.of(), loc);
        for (int i = elements.size() - 1; i >= 0; i--) {
            result = new CoreVariantPattern(CONS, List.of(elements.get(i), result), loc);
        }
        return result;
    }
}
