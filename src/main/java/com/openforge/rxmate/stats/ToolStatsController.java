package com.openforge.rxmate.stats;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only usage report consumed by the stats view.
 *
 *   GET /api/tools/stats  →  {"tools":[{"tool_name":"list_stores","call_count":42}, ...]}
 */
@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
public class ToolStatsController {

    private final ToolUsageCounter usageCounter;

    @GetMapping("/stats")
    public ResponseEntity<StatsResponse> stats() {
        return ResponseEntity.ok(new StatsResponse(usageCounter.snapshot()));
    }

    public record StatsResponse(List<ToolUsageEntry> tools) {}
}
