package com.openforge.rxmate.stats;

import com.openforge.rxmate.domain.ToolStat;
import com.openforge.rxmate.repository.ToolStatRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.LongAdder;

/**
 * Usage counter held in memory and mirrored to the {@code tool_stats} table.
 *
 * Reads are served from memory. The table is read once at startup to seed the
 * in-memory counts, and every increment is written behind on the single
 * {@code toolStatsExecutor} thread. A failed write is logged and dropped, so
 * the two views may drift apart by the writes lost since the last restart.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PersistentToolUsageCounter implements ToolUsageCounter {

    private final ToolStatRepository repository;
    private final ExecutorService    toolStatsExecutor;

    private final ConcurrentMap<String, LongAdder> counts = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPersisted() {
        try {
            List<ToolStat> stored = repository.findAllByOrderByCallCountDesc();
            stored.forEach(stat -> counter(stat.getToolName()).add(stat.getCallCount()));
            log.info("[ToolStats] Loaded {} persisted counter(s)", stored.size());
        } catch (RuntimeException e) {
            log.warn("[ToolStats] Could not load persisted counters, starting from zero: {}", e.getMessage());
        }
    }

    @Override
    public void increment(String toolName) {
        counter(toolName).increment();
        try {
            toolStatsExecutor.execute(() -> persistIncrement(toolName));
        } catch (RejectedExecutionException e) {
            log.warn("[ToolStats] Write-behind rejected for [{}]: {}", toolName, e.getMessage());
        }
    }

    @Override
    public List<ToolUsageEntry> snapshot() {
        return counts.entrySet().stream()
                .map(e -> new ToolUsageEntry(e.getKey(), e.getValue().sum()))
                .sorted(ToolUsageEntry.BY_COUNT_DESC)
                .toList();
    }

    void persistIncrement(String toolName) {
        try {
            if (repository.incrementBy(toolName, 1) > 0) return;
            try {
                repository.save(ToolStat.first(toolName, 1));
            } catch (DataIntegrityViolationException raced) {
                // another writer created the row first
                repository.incrementBy(toolName, 1);
            }
        } catch (RuntimeException e) {
            log.warn("[ToolStats] Failed to persist increment for [{}]: {}", toolName, e.getMessage(), e);
        }
    }

    private LongAdder counter(String toolName) {
        return counts.computeIfAbsent(toolName, name -> new LongAdder());
    }
}
