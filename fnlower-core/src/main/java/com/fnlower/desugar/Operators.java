package com.fnlower.desugar;

import com.fnlower.ast.BinOp;
import com.fnlower.ast.BinaryOp;
import com.fnlower.ast.Location;
import com.fnlower.ast.Pipe;
import com.fnlower.ast.Unary;
import com.fnlower.ir.CoreApp;
import com.fnlower.ir.CoreBinOp;
import com.fnlower.ir.CoreBinaryOp;
import com.fnlower.ir.CoreExpr;
import com.fnlower.ir.CoreLambda;
import com.fnlower.ir.CoreUnary;
import com.fnlower.ir.CoreVar;
import com.fnlower.ir.CoreVarPattern;

import java.util.List;

/**
 * Binary operators, composition and pipes.
 */
final class Operators {

    private Operators() {}

    static CoreExpr desugarBinOp(Desugarer desugarer, BinOp binOp) {
        Location loc = binOp.loc();
        return switch (binOp.op()) {
            case CONS -> Lists.cons(desugarer.desugar(binOp.left()), desugarer.desugar(binOp.right()), loc);
            case FORWARD_COMPOSE -> compose(desugarer, binOp, true);
            case BACKWARD_COMPOSE -> compose(desugarer, binOp, false);
            default -> new CoreBinOp(
                toCore(binOp.op(), loc),
                desugarer.desugar(binOp.left()),
                desugarer.desugar(binOp.right()),
                loc);
        };
    }

    /**
     * {@code f >> g} becomes {@code (v) => g(f(v))} and {@code f << g} becomes
     * {@code (v) => f(g(v))}, where {@code v} is a fresh {@code $composedN}.
     */
    private static CoreExpr compose(Desugarer desugarer, BinOp binOp, boolean forward) {
        Location loc = binOp.loc();
        String param = desugarer.gen().fresh("composed");
        CoreExpr f = desugarer.desugar(binOp.left());
        CoreExpr g = desugarer.desugar(binOp.right());

        CoreExpr first = forward ? f : g;
        CoreExpr second = forward ? g : f;
        CoreExpr inner = new CoreApp(first, List.of(new CoreVar(param, loc)), loc);
        CoreExpr outer = new CoreApp(second, List.of(inner), loc);
        return new CoreLambda(new CoreVarPattern(param, loc), outer, loc);
    }

    /**
     * {@code x |> f} becomes {@code f(x)}.
     */
    static CoreExpr desugarPipe(Desugarer desugarer, Pipe pipe) {
        CoreExpr data = desugarer.desugar(pipe.expr());
        CoreExpr func = desugarer.desugar(pipe.func());
        return new CoreApp(func, List.of(data), pipe.loc());
    }

    static CoreBinaryOp toCore(BinaryOp op, Location loc) {
        return switch (op) {
            case ADD -> CoreBinaryOp.ADD;
            case SUBTRACT -> CoreBinaryOp.SUBTRACT;
            case MULTIPLY -> CoreBinaryOp.MULTIPLY;
            case DIVIDE -> CoreBinaryOp.DIVIDE;
            case MODULO -> CoreBinaryOp.MODULO;
            case EQUAL -> CoreBinaryOp.EQUAL;
            case NOT_EQUAL -> CoreBinaryOp.NOT_EQUAL;
            case LESS_THAN -> CoreBinaryOp.LESS_THAN;
            case LESS_EQUAL -> CoreBinaryOp.LESS_EQUAL;
            case GREATER_THAN -> CoreBinaryOp.GREATER_THAN;
            case GREATER_EQUAL -> CoreBinaryOp.GREATER_EQUAL;
            case LOGICAL_AND -> CoreBinaryOp.LOGICAL_AND;
            case LOGICAL_OR -> CoreBinaryOp.LOGICAL_OR;
            case CONCAT -> CoreBinaryOp.CONCAT;
            case REF_ASSIGN -> CoreBinaryOp.REF_ASSIGN;
            case CONS, FORWARD_COMPOSE, BACKWARD_COMPOSE ->
                throw new DesugarInternalError("Operator " + op + " must be lowered before reaching a core binary operator", loc);
        };
    }

    static CoreUnary toCore(Unary op) {
        return switch (op) {
            case NEGATE -> CoreUnary.NEGATE;
            case LOGICAL_NOT -> CoreUnary.LOGICAL_NOT;
            case DEREF -> CoreUnary.DEREF;
        };
    }
}
