package com.fnlower.desugar;

import com.fnlower.ast.Expr;
import com.fnlower.ast.Let;
import com.fnlower.ast.Location;
import com.fnlower.ir.CoreExpr;
import com.fnlower.ir.CoreLet;
import com.fnlower.ir.CorePattern;

import java.util.ArrayList;
import java.util.List;

/**
 * Block lowering: {@code { let x = 1; let y = 2; x + y }} becomes
 * {@code let x = 1 in let y = 2 in x + y}.
 */
final class Blocks {

    private Blocks() {}

    static CoreExpr desugarBlock(Desugarer desugarer, List<Expr> exprs, Location loc) {
        if (exprs.isEmpty()) {
            throw new DesugarException(
                "Empty block expression",
                loc,
                "Block must contain at least one expression");
        }
        for (int i = 0; i < exprs.size(); i++) {
            if (exprs.get(i) == null) {
                throw new DesugarException("Block has undefined expression at index " + i, loc);
            }
        }
        if (exprs.size() == 1) {
            return desugarer.desugar(exprs.get(0));
        }

        int last = exprs.size() - 1;
        List<Let> lets = new ArrayList<>(last);
        for (int i = 0; i < last; i++) {
            Expr e = exprs.get(i);
            if (!(e instanceof Let let)) {
                throw new DesugarException(
                    "Non-let expression in block (except final expression)",
                    e.loc(),
                    "All expressions in a block except the last must be let bindings");
            }
            lets.add(let);
        }

        // Statement lets carry no body of their own; the rest of the block is their scope.
        List<CorePattern> patterns = new ArrayList<>(last);
        List<CoreExpr> values = new ArrayList<>(last);
        for (Let let : lets) {
            patterns.add(desugarer.desugarPattern(let.pattern()));
            values.add(desugarer.desugar(let.value()));
        }

        CoreExpr result = desugarer.desugar(exprs.get(last));
        for (int i = last - 1; i >= 0; i--) {
            Let let = lets.get(i);
            result = new CoreLet(patterns.get(i), values.get(i), result, let.mutable(), let.recursive(), let.loc());
        }
        return result;
    }
}
