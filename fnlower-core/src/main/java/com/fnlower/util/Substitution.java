package com.fnlower.util;

import com.fnlower.ir.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Capture-avoiding substitution over core expressions.
 *
 * <p>At every binder (let, let-rec group, lambda parameter, match case) the substitution is
 * first narrowed to the entries that can still apply inside it: names the binder rebinds are
 * dropped, as are names with no free occurrence in its scope. If nothing is left the binder
 * is returned untouched. Otherwise:
 * <ol>
 *   <li>If a name it binds is free in one of the remaining replacements, all of its bound
 *       names are renamed with {@link #freshen}, and substitution continues into the renamed
 *       scope.</li>
 *   <li>Otherwise substitution continues into the scope with the narrowed entries.</li>
 * </ol>
 * A non-recursive let's value sits outside its own binding and sees the unrestricted
 * substitution. Let-rec values and the value of a {@code recursive} let are inside it.
 *
 * <p>Replacements are inserted as is; substitution is applied once, not to a fixed point.
 * Renamed variables keep their own locations.
 */
public final class Substitution {

    private Substitution() {}

    /**
     * Replaces free occurrences of {@code name} in {@code expr} with {@code replacement}.
     */
    public static CoreExpr substitute(CoreExpr expr, String name, CoreExpr replacement) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(replacement, "replacement");
        return substituteMultiple(expr, Map.of(name, replacement));
    }

    /**
     * Simultaneous substitution: each replacement is inserted without being rewritten by the
     * other entries. Returns {@code expr} itself when none of the names occurs free in it.
     */
    public static CoreExpr substituteMultiple(CoreExpr expr, Map<String, CoreExpr> bindings) {
        Objects.requireNonNull(expr, "expr");
        Objects.requireNonNull(bindings, "bindings");
        return new Substituter(bindings, false).apply(expr);
    }

    /**
     * Returns {@code base} if it is not in {@code avoid}, otherwise {@code base_k} for the
     * smallest {@code k >= 1} not in {@code avoid}.
     */
    public static String freshen(String base, Set<String> avoid) {
        if (!avoid.contains(base)) {
            return base;
        }
        int k = 1;
        String candidate = base + "_" + k;
        while (avoid.contains(candidate)) {
            k++;
            candidate = base + "_" + k;
        }
        return candidate;
    }

    private static final class Substituter {

        private final Map<String, CoreExpr> bindings;
        private final Set<String> freeInReplacements;
        // Renaming mode: replacements are variables that take the location of the occurrence.
        private final boolean keepLocations;

        Substituter(Map<String, CoreExpr> bindings, boolean keepLocations) {
            this.bindings = bindings;
            this.keepLocations = keepLocations;
            this.freeInReplacements = new HashSet<>();
            for (CoreExpr replacement : bindings.values()) {
                freeInReplacements.addAll(AstAnalysis.freeVars(replacement));
            }
        }

        CoreExpr apply(CoreExpr e) {
            Substituter active = restrict(Set.of(), AstAnalysis.freeVars(e));
            return active.bindings.isEmpty() ? e : active.subst(e);
        }

        CoreExpr subst(CoreExpr e) {
            if (e instanceof CoreVar v) {
                CoreExpr replacement = bindings.get(v.name());
                if (replacement == null) {
                    return e;
                }
                if (keepLocations && replacement instanceof CoreVar renamed) {
                    return new CoreVar(renamed.name(), v.loc());
                }
                return replacement;
            } else if (e instanceof CoreLet let) {
                return substLet(let);
            } else if (e instanceof CoreLetRecExpr letRec) {
                return substLetRec(letRec);
            } else if (e instanceof CoreLambda lambda) {
                return substLambda(lambda);
            } else if (e instanceof CoreMatch match) {
                List<CoreMatchCase> cases = new ArrayList<>(match.cases().size());
                CoreExpr scrutinee = subst(match.expr());
                for (CoreMatchCase c : match.cases()) {
                    cases.add(substCase(c));
                }
                return new CoreMatch(scrutinee, cases, match.loc());
            }
            // Binder-free node: recurse into every child slot.
            return AstTransform.transformChildren(e, this::subst);
        }

        private CoreExpr substLet(CoreLet let) {
            Set<String> bound = AstAnalysis.patternBoundVars(let.pattern());
            if (let.recursive()) {
                Set<String> scopeFree = AstAnalysis.freeVars(let.value());
                scopeFree.addAll(AstAnalysis.freeVars(let.body()));
                Substituter inner = restrict(bound, scopeFree);
                if (inner.bindings.isEmpty()) {
                    return let;
                }
                if (inner.capturesAny(bound)) {
                    Map<String, String> renaming = renaming(bound, avoidSet(inner, bound, scopeFree));
                    return new CoreLet(
                        renamePattern(let.pattern(), renaming),
                        inner.subst(rename(let.value(), renaming)),
                        inner.subst(rename(let.body(), renaming)),
                        let.mutable(), let.recursive(), let.loc());
                }
                return new CoreLet(let.pattern(), inner.subst(let.value()), inner.subst(let.body()),
                    let.mutable(), let.recursive(), let.loc());
            }

            CoreExpr value = subst(let.value());
            Set<String> scopeFree = AstAnalysis.freeVars(let.body());
            Substituter inner = restrict(bound, scopeFree);
            if (inner.bindings.isEmpty()) {
                return new CoreLet(let.pattern(), value, let.body(), let.mutable(), let.recursive(), let.loc());
            }
            if (inner.capturesAny(bound)) {
                Map<String, String> renaming = renaming(bound, avoidSet(inner, bound, scopeFree));
                return new CoreLet(
                    renamePattern(let.pattern(), renaming),
                    value,
                    inner.subst(rename(let.body(), renaming)),
                    let.mutable(), let.recursive(), let.loc());
            }
            return new CoreLet(let.pattern(), value, inner.subst(let.body()),
                let.mutable(), let.recursive(), let.loc());
        }

        private CoreExpr substLetRec(CoreLetRecExpr letRec) {
            Set<String> bound = new HashSet<>();
            Set<String> scopeFree = new HashSet<>(AstAnalysis.freeVars(letRec.body()));
            for (CoreRecBinding b : letRec.bindings()) {
                bound.addAll(AstAnalysis.patternBoundVars(b.pattern()));
                scopeFree.addAll(AstAnalysis.freeVars(b.value()));
            }
            Substituter inner = restrict(bound, scopeFree);
            if (inner.bindings.isEmpty()) {
                return letRec;
            }

            List<CoreRecBinding> bindingsOut = new ArrayList<>(letRec.bindings().size());
            if (inner.capturesAny(bound)) {
                // One renaming for the whole group keeps the bindings consistent with each other.
                Map<String, String> renaming = renaming(bound, avoidSet(inner, bound, scopeFree));
                for (CoreRecBinding b : letRec.bindings()) {
                    bindingsOut.add(new CoreRecBinding(
                        renamePattern(b.pattern(), renaming),
                        inner.subst(rename(b.value(), renaming)),
                        b.mutable(),
                        b.loc()));
                }
                return new CoreLetRecExpr(bindingsOut, inner.subst(rename(letRec.body(), renaming)), letRec.loc());
            }
            for (CoreRecBinding b : letRec.bindings()) {
                bindingsOut.add(new CoreRecBinding(b.pattern(), inner.subst(b.value()), b.mutable(), b.loc()));
            }
            return new CoreLetRecExpr(bindingsOut, inner.subst(letRec.body()), letRec.loc());
        }

        private CoreExpr substLambda(CoreLambda lambda) {
            Set<String> bound = AstAnalysis.patternBoundVars(lambda.param());
            Set<String> scopeFree = AstAnalysis.freeVars(lambda.body());
            Substituter inner = restrict(bound, scopeFree);
            if (inner.bindings.isEmpty()) {
                return lambda;
            }
            if (inner.capturesAny(bound)) {
                Map<String, String> renaming = renaming(bound, avoidSet(inner, bound, scopeFree));
                return new CoreLambda(
                    renamePattern(lambda.param(), renaming),
                    inner.subst(rename(lambda.body(), renaming)),
                    lambda.loc());
            }
            return new CoreLambda(lambda.param(), inner.subst(lambda.body()), lambda.loc());
        }

        private CoreMatchCase substCase(CoreMatchCase c) {
            Set<String> bound = AstAnalysis.patternBoundVars(c.pattern());
            Set<String> scopeFree = AstAnalysis.freeVars(c.body());
            if (c.guard() != null) {
                scopeFree.addAll(AstAnalysis.freeVars(c.guard()));
            }
            Substituter inner = restrict(bound, scopeFree);
            if (inner.bindings.isEmpty()) {
                return c;
            }
            if (inner.capturesAny(bound)) {
                Map<String, String> renaming = renaming(bound, avoidSet(inner, bound, scopeFree));
                CoreExpr guard = c.guard() != null ? inner.subst(rename(c.guard(), renaming)) : null;
                return new CoreMatchCase(
                    renamePattern(c.pattern(), renaming),
                    guard,
                    inner.subst(rename(c.body(), renaming)),
                    c.loc());
            }
            CoreExpr guard = c.guard() != null ? inner.subst(c.guard()) : null;
            return new CoreMatchCase(c.pattern(), guard, inner.subst(c.body()), c.loc());
        }

        private boolean capturesAny(Set<String> bound) {
            for (String name : bound) {
                if (freeInReplacements.contains(name)) {
                    return true;
                }
            }
            return false;
        }

        // Names a renamed binder must not take; the outer domain is included so a new name is
        // never picked up by a pending entry.
        private Set<String> avoidSet(Substituter inner, Set<String> bound, Set<String> scopeFree) {
            Set<String> avoid = new HashSet<>(inner.freeInReplacements);
            avoid.addAll(scopeFree);
            avoid.addAll(bindings.keySet());
            avoid.addAll(bound);
            return avoid;
        }

        /**
         * Picks a new name for every bound name in {@code avoid}. Chosen names join the
         * avoid set so two binders never collapse into one.
         */
        private static Map<String, String> renaming(Set<String> bound, Set<String> avoid) {
            Map<String, String> renaming = new LinkedHashMap<>();
            for (String name : bound) {
                if (avoid.contains(name)) {
                    String fresh = freshen(name, avoid);
                    avoid.add(fresh);
                    renaming.put(name, fresh);
                }
            }
            return renaming;
        }

        /**
         * Entries that still apply inside a binder: not rebound by it and free in its scope.
         */
        private Substituter restrict(Set<String> bound, Set<String> scopeFree) {
            Map<String, CoreExpr> restricted = new LinkedHashMap<>();
            for (Map.Entry<String, CoreExpr> entry : bindings.entrySet()) {
                if (!bound.contains(entry.getKey()) && scopeFree.contains(entry.getKey())) {
                    restricted.put(entry.getKey(), entry.getValue());
                }
            }
            if (restricted.size() == bindings.size()) {
                return this;
            }
            return new Substituter(restricted, keepLocations);
        }
    }

    private static CoreExpr rename(CoreExpr expr, Map<String, String> renaming) {
        if (renaming.isEmpty()) {
            return expr;
        }
        Map<String, CoreExpr> asVars = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : renaming.entrySet()) {
            asVars.put(entry.getKey(), new CoreVar(entry.getValue(), null));
        }
        return new Substituter(asVars, true).apply(expr);
    }

    private static CorePattern renamePattern(CorePattern pattern, Map<String, String> renaming) {
        if (pattern instanceof CoreVarPattern v) {
            String renamed = renaming.get(v.name());
            return renamed != null ? new CoreVarPattern(renamed, v.loc()) : v;
        } else if (pattern instanceof CoreVariantPattern variant) {
            List<CorePattern> args = new ArrayList<>(variant.args().size());
            for (CorePattern arg : variant.args()) {
                args.add(renamePattern(arg, renaming));
            }
            return new CoreVariantPattern(variant.constructor(), args, variant.loc());
        } else if (pattern instanceof CoreRecordPattern record) {
            List<CoreRecordPatternField> fields = new ArrayList<>(record.fields().size());
            for (CoreRecordPatternField field : record.fields()) {
                fields.add(new CoreRecordPatternField(field.name(), renamePattern(field.pattern(), renaming), field.loc()));
            }
            return new CoreRecordPattern(fields, record.loc());
        } else if (pattern instanceof CoreTuplePattern tuple) {
            List<CorePattern> elements = new ArrayList<>(tuple.elements().size());
            for (CorePattern element : tuple.elements()) {
                elements.add(renamePattern(element, renaming));
            }
            return new CoreTuplePattern(elements, tuple.loc());
        }
        return pattern;
    }
}
