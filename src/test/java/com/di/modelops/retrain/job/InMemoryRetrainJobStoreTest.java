package com.di.modelops.retrain.job;

import com.di.modelops.config.ModelOpsProperties;
import com.di.modelops.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryRetrainJobStore Tests")
class InMemoryRetrainJobStoreTest {

    private final MutableClock clock = MutableClock.at("2026-01-10T12:00:00Z");
    private final InMemoryRetrainJobStore store = new InMemoryRetrainJobStore(new ModelOpsProperties(), clock);

    @ParameterizedTest
    @CsvSource({
            "1, 2",
            "3, 8",
            "5, 16",
            "10, 32"
    })
    @DisplayName("With M queued jobs and N > M concurrent claimers, exactly M distinct jobs are claimed")
    void testClaimNext_ExactlyMOfN(int queued, int callers) throws Exception {
        for (int i = 0; i < queued; i++) {
            store.create(JobFixtures.newJob("cohort-" + i));
            clock.advance(Duration.ofSeconds(1));
        }

        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch ready = new CountDownLatch(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<RetrainJob>>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    ready.countDown();
                    start.await();
                    return store.claimNext(null);
                }));
            }
            assertTrue(ready.await(10, TimeUnit.SECONDS));
            start.countDown();

            Set<Long> claimed = new HashSet<>();
            int empty = 0;
            for (Future<Optional<RetrainJob>> f : futures) {
                Optional<RetrainJob> job = f.get(10, TimeUnit.SECONDS);
                if (job.isPresent()) {
                    assertTrue(claimed.add(job.get().getId()));
                    assertEquals(RetrainJobStatus.RUNNING, job.get().getStatus());
                } else {
                    empty++;
                }
            }
            assertEquals(queued, claimed.size());
            assertEquals(callers - queued, empty);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Only one active job per cohort")
    void testCreate_SingleActivePerCohort() {
        EnqueueResult first = store.create(JobFixtures.newJob("2025-26"));
        EnqueueResult second = store.create(JobFixtures.newJob("2025-26"));

        assertTrue(first.isCreated());
        assertFalse(second.isCreated());
        assertEquals(first.getJob().getId(), second.getJob().getId());
        assertEquals(1, store.list("2025-26", 10).size());
    }

    @Test
    @DisplayName("Claims are oldest first")
    void testClaimNext_Fifo() {
        long older = store.create(JobFixtures.newJob("a")).getJob().getId();
        clock.advance(Duration.ofMinutes(1));
        store.create(JobFixtures.newJob("b"));

        assertEquals(older, store.claimNext(null).orElseThrow().getId());
    }

    @Test
    @DisplayName("Finalize rejects unknown, queued and terminal jobs")
    void testFinalize_Rules() {
        assertThrows(RetrainJobNotFoundException.class,
                () -> store.finalize(42L, RetrainJobStatus.COMPLETED, RunDetails.simulated(), null, null));

        long id = store.create(JobFixtures.newJob("2025-26")).getJob().getId();
        assertThrows(RetrainJobStateException.class,
                () -> store.finalize(id, RetrainJobStatus.COMPLETED, RunDetails.simulated(), null, null));

        store.claimNext("2025-26");
        RetrainJob done = store.finalize(id, RetrainJobStatus.FAILED, RunDetails.forMode(true), "trainer crashed", null);
        assertEquals(RetrainJobStatus.FAILED, done.getStatus());
        assertEquals("trainer crashed", done.getError());
        assertNotNull(done.getCompletedAt());

        assertThrows(RetrainJobStateException.class,
                () -> store.finalize(id, RetrainJobStatus.COMPLETED, RunDetails.simulated(), null, null));
        assertEquals(RetrainJobStatus.FAILED, store.findById(id).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("findRecentActive only sees active jobs inside the window")
    void testFindRecentActive() {
        long id = store.create(JobFixtures.newJob("2025-26")).getJob().getId();
        clock.advance(Duration.ofHours(2));

        assertEquals(id, store.findRecentActive("2025-26", clock.instant().minus(Duration.ofHours(12)))
                .orElseThrow().getId());
        assertTrue(store.findRecentActive("2025-26", clock.instant().minus(Duration.ofHours(1))).isEmpty());
        assertTrue(store.findRecentActive("2024-25", clock.instant().minus(Duration.ofHours(12))).isEmpty());
    }
}
