package com.fnlower.ir;

import com.fnlower.ast.Location;
import java.util.List;

/**
 * Constructor application. Lists are encoded as {@code Cons(head, tail)} and {@code Nil()}.
 */
public record CoreVariant(
    String constructor,
    List<CoreExpr> args,
    Location loc
) implements CoreExpr {
    public CoreVariant {
        args = List.copyOf(args);
    }

    @Override
    public String kind() {
        return "CoreVariant";
    }
}
