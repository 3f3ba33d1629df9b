package com.fnlower.ast;

public record LetRecBinding(Pattern pattern, Expr value, boolean mutable, Location loc) {
}
