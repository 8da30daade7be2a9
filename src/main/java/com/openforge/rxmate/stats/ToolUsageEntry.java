package com.openforge.rxmate.stats;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Comparator;

/** One row of the usage report: {@code {"tool_name": ..., "call_count": ...}}. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ToolUsageEntry(String toolName, long callCount) {

    /** Count descending, then name for a stable order among ties. */
    public static final Comparator<ToolUsageEntry> BY_COUNT_DESC =
            Comparator.comparingLong(ToolUsageEntry::callCount).reversed()
                    .thenComparing(ToolUsageEntry::toolName);
}
