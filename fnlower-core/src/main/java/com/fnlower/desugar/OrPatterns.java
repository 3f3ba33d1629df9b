package com.fnlower.desugar;

import com.fnlower.ast.ConstructorPattern;
import com.fnlower.ast.ListPattern;
import com.fnlower.ast.MatchCase;
import com.fnlower.ast.OrPattern;
import com.fnlower.ast.Pattern;
import com.fnlower.ast.RecordPattern;
import com.fnlower.ast.TuplePattern;
import com.fnlower.ast.TypeAnnotatedPattern;
import com.fnlower.ir.CoreExpr;
import com.fnlower.ir.CoreMatchCase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Or-pattern elimination by case duplication.
 *
 * <p>{@code | A | B when g => e} becomes two cases, {@code A when g => e} and
 * {@code B when g => e}. Guard and body are desugared again for every alternative so no
 * core subtree is shared between cases.
 */
final class OrPatterns {

    private OrPatterns() {}

    static List<CoreMatchCase> expandCases(Desugarer desugarer, List<MatchCase> cases) {
        List<CoreMatchCase> result = new ArrayList<>(cases.size());
        for (MatchCase matchCase : cases) {
            for (Pattern alternative : alternatives(matchCase.pattern())) {
                CoreExpr guard = matchCase.guard() != null ? desugarer.desugar(matchCase.guard()) : null;
                result.add(new CoreMatchCase(
                    desugarer.desugarPattern(alternative),
                    guard,
                    desugarer.desugar(matchCase.body()),
                    matchCase.loc()));
            }
        }
        return result;
    }

    /**
     * Lists the or-free patterns a pattern stands for, in source order. Nested or-patterns
     * multiply out left to right: {@code (A | B, C | D)} gives
     * {@code (A, C), (A, D), (B, C), (B, D)}.
     */
    static List<Pattern> alternatives(Pattern pattern) {
        if (pattern instanceof OrPattern orPattern) {
            List<Pattern> result = new ArrayList<>();
            for (Pattern p : orPattern.patterns()) {
                result.addAll(alternatives(p));
            }
            return result;
        } else if (pattern instanceof ConstructorPattern ctor) {
            List<Pattern> result = new ArrayList<>();
            for (List<Pattern> args : product(ctor.args())) {
                result.add(new ConstructorPattern(ctor.constructor(), args, ctor.loc()));
            }
            return result;
        } else if (pattern instanceof TuplePattern tuple) {
            List<Pattern> result = new ArrayList<>();
            for (List<Pattern> elements : product(tuple.elements())) {
                result.add(new TuplePattern(elements, tuple.loc()));
            }
            return result;
        } else if (pattern instanceof RecordPattern record) {
            List<Pattern> fieldPatterns = new ArrayList<>(record.fields().size());
            for (RecordPattern.Field field : record.fields()) {
                fieldPatterns.add(field.pattern());
            }
            List<Pattern> result = new ArrayList<>();
            for (List<Pattern> combo : product(fieldPatterns)) {
                List<RecordPattern.Field> fields = new ArrayList<>(combo.size());
                for (int i = 0; i < combo.size(); i++) {
                    RecordPattern.Field field = record.fields().get(i);
                    fields.add(new RecordPattern.Field(field.name(), combo.get(i), field.loc()));
                }
                result.add(new RecordPattern(fields, record.loc()));
            }
            return result;
        } else if (pattern instanceof ListPattern list) {
            List<Pattern> parts = new ArrayList<>(list.elements());
            if (list.rest() != null) {
                parts.add(list.rest());
            }
            List<Pattern> result = new ArrayList<>();
            for (List<Pattern> combo : product(parts)) {
                if (list.rest() != null) {
                    List<Pattern> elements = combo.subList(0, combo.size() - 1);
                    result.add(new ListPattern(new ArrayList<>(elements), combo.get(combo.size() - 1), list.loc()));
                } else {
                    result.add(new ListPattern(combo, null, list.loc()));
                }
            }
            return result;
        } else if (pattern instanceof TypeAnnotatedPattern annotated) {
            List<Pattern> result = new ArrayList<>();
            for (Pattern inner : alternatives(annotated.pattern())) {
                result.add(new TypeAnnotatedPattern(inner, annotated.typeExpr(), annotated.loc()));
            }
            return result;
        }
        // May be null inside a malformed sub-pattern list; desugarPatterns reports it.
        return Collections.singletonList(pattern);
    }

    private static List<List<Pattern>> product(List<Pattern> patterns) {
        List<List<Pattern>> combos = new ArrayList<>();
        combos.add(new ArrayList<>());
        for (Pattern p : patterns) {
            List<Pattern> choices = alternatives(p);
            List<List<Pattern>> next = new ArrayList<>(combos.size() * choices.size());
            for (List<Pattern> prefix : combos) {
                for (Pattern choice : choices) {
                    List<Pattern> combo = new ArrayList<>(prefix);
                    combo.add(choice);
                    next.add(combo);
                }
            }
            combos = next;
        }
        return combos;
    }
}
