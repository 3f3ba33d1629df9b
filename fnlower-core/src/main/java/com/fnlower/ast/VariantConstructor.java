package com.fnlower.ast;

import java.util.List;

public record VariantConstructor(String name, List<TypeExpr> args, Location loc) {
}
