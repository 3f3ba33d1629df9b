package com.fnlower.desugar;

/**
 * Mints temporary identifiers that surface code cannot spell.
 *
 * <p>Names have the form {@code "$" + prefix + counter}. The counter belongs to this
 * instance only, so two generators hand out overlapping names. Not thread-safe.
 */
public final class FreshVarGen {

    private static final String DEFAULT_PREFIX = "tmp";

    private int counter = 0;

    /**
     * Returns {@code $<prefix><n>} and advances the counter.
     *
     * @param prefix name stem, e.g. {@code "composed"} or {@code "loop"}
     */
    public String fresh(String prefix) {
        return "$" + prefix + counter++;
    }

    public String fresh() {
        return fresh(DEFAULT_PREFIX);
    }

    /**
     * Sets the counter back to zero.
     */
    public void reset() {
        counter = 0;
    }
}
