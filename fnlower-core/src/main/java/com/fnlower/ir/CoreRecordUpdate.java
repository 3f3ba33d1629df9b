package com.fnlower.ir;

import com.fnlower.ast.Location;
import java.util.List;

public record CoreRecordUpdate(
    CoreExpr record,
    List<CoreRecordField> updates,
    Location loc
) implements CoreExpr {
    public CoreRecordUpdate {
        updates = List.copyOf(updates);
    }

    @Override
    public String kind() {
        return "CoreRecordUpdate";
    }
}
