package com.fnlower.ir;

public sealed interface CoreDeclaration extends CoreNode permits
    CoreLetDecl, CoreLetRecGroup, CoreTypeDecl,
    CoreExternalDecl, CoreExternalTypeDecl, CoreImportDecl {
}
