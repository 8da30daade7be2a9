package com.openforge.rxmate.stats;

import java.util.List;

/**
 * Process-wide call counters per tool name.
 *
 * Increments from concurrent turns must not be lost; exactness beyond that
 * is not required (a duplicate increment is tolerated). Entries appear on
 * first increment and are never removed.
 */
public interface ToolUsageCounter {

    void increment(String toolName);

    /** Current counts, highest first. */
    List<ToolUsageEntry> snapshot();
}
