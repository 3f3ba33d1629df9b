package com.fnlower.ir;

import com.fnlower.ast.Location;
import java.util.List;

public record CoreApp(
    CoreExpr func,
    List<CoreExpr> args,
    Location loc
) implements CoreExpr {
    public CoreApp {
        args = List.copyOf(args);
    }

    @Override
    public String kind() {
        return "CoreApp";
    }
}
