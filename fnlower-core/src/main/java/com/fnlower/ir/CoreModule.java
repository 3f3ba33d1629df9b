package com.fnlower.ir;

import com.fnlower.ast.Location;
import java.util.List;

public record CoreModule(
    List<CoreImportDecl> imports,
    List<CoreDeclaration> declarations,
    Location loc
) implements CoreNode {
    public CoreModule {
        imports = List.copyOf(imports);
        declarations = List.copyOf(declarations);
    }

    @Override
    public String kind() {
        return "CoreModule";
    }
}
