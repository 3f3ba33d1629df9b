package com.fnlower.desugar;

import com.fnlower.ast.Location;

/**
 * Broken internal invariant: a node kind no branch handles, or a construct that an earlier
 * step should already have removed. Indicates a bug rather than bad user input.
 */
public class DesugarInternalError extends IllegalStateException {

    private final Location loc;

    public DesugarInternalError(String message) {
        this(message, null);
    }

    public DesugarInternalError(String message, Location loc) {
        super(loc == null ? message : message + " (at " + loc + ")");
        this.loc = loc;
    }

    public Location getLoc() {
        return loc;
    }
}
