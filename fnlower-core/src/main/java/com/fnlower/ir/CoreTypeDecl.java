package com.fnlower.ir;

import com.fnlower.ast.Location;
import java.util.List;

public record CoreTypeDecl(
    String name,
    List<String> params,
    CoreTypeDefinition definition,
    boolean exported,
    Location loc
) implements CoreDeclaration {
    public CoreTypeDecl {
        params = List.copyOf(params);
    }

    @Override
    public String kind() {
        return "CoreTypeDecl";
    }
}
