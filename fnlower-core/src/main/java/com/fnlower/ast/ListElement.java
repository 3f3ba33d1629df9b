package com.fnlower.ast;

public sealed interface ListElement {

    Expr expr();

    record Element(Expr expr) implements ListElement {
    }

    record Spread(Expr expr) implements ListElement {
    }
}
