package com.fnlower.ir;

import com.fnlower.ast.Location;
import java.util.List;

public record CoreMatch(
    CoreExpr expr,
    List<CoreMatchCase> cases,
    Location loc
) implements CoreExpr {
    public CoreMatch {
        cases = List.copyOf(cases);
    }

    @Override
    public String kind() {
        return "CoreMatch";
    }
}
