package com.fnlower.ir;

public record CoreImportItem(String name, String alias, boolean typeOnly) {
}
