package com.fnlower.ast;

/**
 * Source position of a node. Lines and columns are 1-based, the offset is 0-based.
 */
public record Location(String file, int line, int column, int offset) {

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
