package com.openforge.rxmate.stats;

import com.openforge.rxmate.domain.ToolStat;
import com.openforge.rxmate.repository.ToolStatRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PersistentToolUsageCounterTest {

    private ToolStatRepository repository;
    private PersistentToolUsageCounter counter;

    @BeforeEach
    void setUp() {
        repository = mock(ToolStatRepository.class);
        when(repository.incrementBy(anyString(), anyLong())).thenReturn(1);
        counter = new PersistentToolUsageCounter(repository, new DirectExecutorService());
    }

    @Test
    void shouldSeedCountsFromPersistedRows() {
        when(repository.findAllByOrderByCallCountDesc()).thenReturn(List.of(
                ToolStat.first("list_stores", 3), ToolStat.first("search_users", 7)));

        counter.loadPersisted();

        assertThat(counter.snapshot()).containsExactly(
                new ToolUsageEntry("search_users", 7),
                new ToolUsageEntry("list_stores", 3));
    }

    @Test
    void shouldStartFromZeroWhenStoreUnavailable() {
        when(repository.findAllByOrderByCallCountDesc()).thenThrow(new IllegalStateException("no database"));

        counter.loadPersisted();
        counter.increment("list_stores");

        assertThat(counter.snapshot()).containsExactly(new ToolUsageEntry("list_stores", 1));
    }

    @Test
    void shouldOrderByCountThenName() {
        counter.increment("b_tool");
        counter.increment("a_tool");
        counter.increment("c_tool");
        counter.increment("c_tool");

        assertThat(counter.snapshot()).extracting(ToolUsageEntry::toolName)
                .containsExactly("c_tool", "a_tool", "b_tool");
    }

    @Test
    void shouldWriteEachIncrementBehind() {
        counter.increment("list_stores");
        counter.increment("list_stores");

        verify(repository, times(2)).incrementBy("list_stores", 1);
        verify(repository, never()).save(any());
    }

    @Test
    void shouldInsertRowOnFirstUse() {
        when(repository.incrementBy("list_stores", 1)).thenReturn(0);

        counter.increment("list_stores");

        verify(repository).save(any(ToolStat.class));
    }

    @Test
    void shouldFallBackToUpdateWhenInsertRaces() {
        when(repository.incrementBy("list_stores", 1)).thenReturn(0, 1);
        when(repository.save(any(ToolStat.class))).thenThrow(new DataIntegrityViolationException("duplicate key"));

        counter.persistIncrement("list_stores");

        verify(repository, times(2)).incrementBy("list_stores", 1);
    }

    @Test
    void shouldKeepCountingWhenPersistenceFails() {
        when(repository.incrementBy(anyString(), anyLong())).thenThrow(new IllegalStateException("db down"));

        counter.increment("list_stores");

        assertThat(counter.snapshot()).containsExactly(new ToolUsageEntry("list_stores", 1));
    }

    @Test
    void shouldNotLoseConcurrentIncrements() throws InterruptedException {
        int threads = 8;
        int perThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < threads; t++) {
            pool.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < perThread; i++) counter.increment("check_stock_availability");
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(counter.snapshot())
                .containsExactly(new ToolUsageEntry("check_stock_availability", (long) threads * perThread));
    }

    /** Runs write-behind tasks on the calling thread. */
    private static final class DirectExecutorService extends AbstractExecutorService {

        private boolean shutdown;

        @Override
        public void execute(Runnable command) {
            command.run();
        }

        @Override
        public void shutdown() {
            shutdown = true;
        }

        @Override
        public List<Runnable> shutdownNow() {
            shutdown = true;
            return new ArrayList<>();
        }

        @Override
        public boolean isShutdown() {
            return shutdown;
        }

        @Override
        public boolean isTerminated() {
            return shutdown;
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) {
            return true;
        }
    }
}
