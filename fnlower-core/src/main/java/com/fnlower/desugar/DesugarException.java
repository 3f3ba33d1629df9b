package com.fnlower.desugar;

import com.fnlower.ast.Location;

/**
 * Structural problem found while lowering a surface tree, such as an empty block.
 * Carries the offending location and, when one helps, a hint for the user.
 */
public class DesugarException extends RuntimeException {

    private final Location loc;
    private final String hint;

    public DesugarException(String message, Location loc) {
        this(message, loc, null);
    }

    public DesugarException(String message, Location loc, String hint) {
        super(message);
        this.loc = loc;
        this.hint = hint;
    }

    public Location getLoc() {
        return loc;
    }

    /**
     * @return the remediation hint, or null
     */
    public String getHint() {
        return hint;
    }

    /**
     * Renders the error the way the command line reports it:
     * <pre>
     * Error: Empty block expression
     *   at main.fn:3:5
     *   Hint: Block must contain at least one expression
     * </pre>
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("Error: ").append(getMessage());
        if (loc != null) {
            sb.append("\n  at ").append(loc.file()).append(':').append(loc.line()).append(':').append(loc.column());
        }
        if (hint != null) {
            sb.append("\n  Hint: ").append(hint);
        }
        return sb.toString();
    }
}
