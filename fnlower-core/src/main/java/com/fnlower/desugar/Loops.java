package com.fnlower.desugar;

import com.fnlower.ast.Location;
import com.fnlower.ast.While;
import com.fnlower.ir.CoreApp;
import com.fnlower.ir.CoreExpr;
import com.fnlower.ir.CoreLambda;
import com.fnlower.ir.CoreLet;
import com.fnlower.ir.CoreLetRecExpr;
import com.fnlower.ir.CoreLiteralPattern;
import com.fnlower.ir.CoreMatch;
import com.fnlower.ir.CoreMatchCase;
import com.fnlower.ir.CoreRecBinding;
import com.fnlower.ir.CoreUnitLit;
import com.fnlower.ir.CoreVar;
import com.fnlower.ir.CoreVarPattern;
import com.fnlower.ir.CoreWildcardPattern;

import java.util.List;

/**
 * While loops become a self-recursive closure:
 * <pre>
 * let rec $loopN = (_) => match cond {
 *     | true => let _ = body in $loopN(())
 *     | false => ()
 * } in $loopN(())
 * </pre>
 */
final class Loops {

    private Loops() {}

    static CoreExpr desugarWhile(Desugarer desugarer, While loop) {
        Location loc = loop.loc();
        String name = desugarer.gen().fresh("loop");
        CoreExpr condition = desugarer.desugar(loop.condition());
        CoreExpr body = desugarer.desugar(loop.body());

        CoreExpr again = new CoreApp(new CoreVar(name, loc), List.of(new CoreUnitLit(loc)), loc);
        CoreExpr step = new CoreLet(new CoreWildcardPattern(loc), body, again, false, false, loc);
        CoreExpr test = new CoreMatch(condition, List.of(
            new CoreMatchCase(new CoreLiteralPattern(Boolean.TRUE, loc), null, step, loc),
            new CoreMatchCase(new CoreLiteralPattern(Boolean.FALSE, loc), null, new CoreUnitLit(loc), loc)
        ), loc);
        CoreExpr closure = new CoreLambda(new CoreWildcardPattern(loc), test, loc);

        CoreExpr start = new CoreApp(new CoreVar(name, loc), List.of(new CoreUnitLit(loc)), loc);
        return new CoreLetRecExpr(
            List.of(new CoreRecBinding(new CoreVarPattern(name, loc), closure, false, loc)),
            start,
            loc);
    }
}
