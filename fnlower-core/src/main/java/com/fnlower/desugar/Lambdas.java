package com.fnlower.desugar;

import com.fnlower.ast.Expr;
import com.fnlower.ast.Location;
import com.fnlower.ast.Pattern;
import com.fnlower.ir.CoreExpr;
import com.fnlower.ir.CoreLambda;
import com.fnlower.ir.CorePattern;

import java.util.ArrayList;
import java.util.List;

/**
 * Currying of multi-parameter lambdas.
 */
final class Lambdas {

    private Lambdas() {}

    /**
     * {@code (a, b, c) => body} becomes {@code (a) => (b) => (c) => body}. Every generated
     * lambda reuses the location of the surface lambda.
     */
    static CoreExpr curry(Desugarer desugarer, List<Pattern> params, Expr body, Location loc) {
        if (params.isEmpty()) {
            throw new DesugarException(
                "Lambda with zero parameters",
                loc,
                "Lambdas must have at least one parameter");
        }

        List<CorePattern> coreParams = new ArrayList<>(params.size());
        for (int i = 0; i < params.size(); i++) {
            Pattern param = params.get(i);
            if (param == null) {
                throw new DesugarException("Lambda has undefined parameter at index " + i, loc);
            }
            coreParams.add(desugarer.desugarPattern(param));
        }

        CoreExpr result = desugarer.desugar(body);
        for (int i = coreParams.size() - 1; i >= 0; i--) {
            result = new CoreLambda(coreParams.get(i), result, loc);
        }
        return result;
    }
}
