package com.raditha.sorter.model;

/**
 * A buffer write that was rejected. The run carries on past it.
 *
 * @param operation what was being written, e.g. "sort" or "prune"
 * @param range     lines the write targeted
 * @param error     reason reported by the buffer
 */
public record WriteFailure(String operation, Range range, String error) {
}
