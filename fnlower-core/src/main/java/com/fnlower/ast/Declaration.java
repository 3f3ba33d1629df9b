package com.fnlower.ast;

public sealed interface Declaration extends Node permits
    LetDecl, LetRecGroup, TypeDecl,
    ExternalDecl, ExternalTypeDecl, ExternalBlock,
    ImportDecl {
}
