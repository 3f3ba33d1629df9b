package com.fnlower.ir;

import com.fnlower.ast.Location;
import java.util.List;

/**
 * Mutually recursive binding group. Every binding value sees every bound name.
 */
public record CoreLetRecExpr(
    List<CoreRecBinding> bindings,
    CoreExpr body,
    Location loc
) implements CoreExpr {
    public CoreLetRecExpr {
        bindings = List.copyOf(bindings);
    }

    @Override
    public String kind() {
        return "CoreLetRecExpr";
    }
}
