package com.fnlower.ir;

import com.fnlower.ast.Location;
import java.util.List;

public record CoreTypeApp(
    CoreTypeExpr constructor,
    List<CoreTypeExpr> args,
    Location loc
) implements CoreTypeExpr {
    public CoreTypeApp {
        args = List.copyOf(args);
    }

    @Override
    public String kind() {
        return "CoreTypeApp";
    }
}
