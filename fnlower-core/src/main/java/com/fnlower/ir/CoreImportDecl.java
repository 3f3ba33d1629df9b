package com.fnlower.ir;

import com.fnlower.ast.Location;
import java.util.List;

public record CoreImportDecl(
    List<CoreImportItem> items,
    String from,
    Location loc
) implements CoreDeclaration {
    public CoreImportDecl {
        items = List.copyOf(items);
    }

    @Override
    public String kind() {
        return "CoreImportDecl";
    }
}
