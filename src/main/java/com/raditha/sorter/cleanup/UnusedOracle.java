package com.raditha.sorter.cleanup;

/**
 * Answers whether the declaration starting at a line is unused.
 */
@FunctionalInterface
public interface UnusedOracle {

    /**
     * @param line 1-indexed buffer line
     */
    boolean isUnused(int line);
}
