package microbatch.dispatch;

import microbatch.FlushTrigger;
import microbatch.Job;
import microbatch.JobProcessor;
import microbatch.queue.Flush;
import microbatch.queue.QueuedJob;
import microbatch.spi.MetricsExporter;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchDispatcherTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    @Test
    void constructorRejectsNegativeWorkerCount() {
        assertThrows(IllegalArgumentException.class, () ->
                new BatchDispatcher<String, Integer>(String::length, -1, "w-", MetricsExporter.NOOP, WAIT));
    }

    @Test
    void constructorRejectsNullProcessor() {
        assertThrows(NullPointerException.class, () ->
                new BatchDispatcher<String, Integer>(null, 0, "w-", MetricsExporter.NOOP, WAIT));
    }

    @Test
    void resolvesEachJobWithItsOwnOutput() throws Exception {
        try (var dispatcher = new BatchDispatcher<String, Integer>(String::length, 0, "w-",
                MetricsExporter.NOOP, WAIT)) {
            List<QueuedJob<String, Integer>> jobs = List.of(queued(1, "a"), queued(2, "bbb"), queued(3, "cc"));

            dispatcher.dispatch(new Flush<>(FlushTrigger.SIZE, jobs));

            assertEquals(1, jobs.get(0).result().get(WAIT));
            assertEquals(3, jobs.get(1).result().get(WAIT));
            assertEquals(2, jobs.get(2).result().get(WAIT));
        }
    }

    @Test
    void unboundedPoolRunsWholeBatchConcurrently() throws Exception {
        int batch = 16;
        CountDownLatch allStarted = new CountDownLatch(batch);
        CountDownLatch release = new CountDownLatch(1);
        JobProcessor<String, String> gate = s -> {
            allStarted.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return s;
        };
        try (var dispatcher = new BatchDispatcher<>(gate, 0, "w-", MetricsExporter.NOOP, WAIT)) {
            List<QueuedJob<String, String>> jobs = new ArrayList<>();
            for (int i = 0; i < batch; i++) {
                jobs.add(queued(i, "j" + i));
            }
            dispatcher.dispatch(new Flush<>(FlushTrigger.TIMER, jobs));

            assertTrue(allStarted.await(5, TimeUnit.SECONDS));
            assertEquals(batch, dispatcher.inFlight());
            release.countDown();
            for (QueuedJob<String, String> job : jobs) {
                job.result().get(WAIT);
            }
        }
    }

    @Test
    void workerCountBoundsConcurrency() throws Exception {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        JobProcessor<String, String> tracking = s -> {
            int now = running.incrementAndGet();
            maxRunning.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            running.decrementAndGet();
            return s;
        };
        try (var dispatcher = new BatchDispatcher<>(tracking, 2, "w-", MetricsExporter.NOOP, WAIT)) {
            List<QueuedJob<String, String>> jobs = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                jobs.add(queued(i, "j" + i));
            }
            dispatcher.dispatch(new Flush<>(FlushTrigger.SIZE, jobs));
            for (QueuedJob<String, String> job : jobs) {
                job.result().get(WAIT);
            }
        }

        assertTrue(maxRunning.get() <= 2, "max concurrent processors: " + maxRunning.get());
    }

    @Test
    void emptyFlushIsRecordedButDispatchesNothing() {
        AtomicInteger flushes = new AtomicInteger();
        AtomicInteger jobsInFlushes = new AtomicInteger(-1);
        MetricsExporter metrics = new RecordingMetrics() {
            @Override
            public void recordFlush(FlushTrigger trigger, int batchSize) {
                flushes.incrementAndGet();
                jobsInFlushes.set(batchSize);
            }
        };
        try (var dispatcher = new BatchDispatcher<String, String>(s -> s, 0, "w-", metrics, WAIT)) {
            dispatcher.dispatch(new Flush<>(FlushTrigger.TIMER, List.of()));

            assertEquals(1, flushes.get());
            assertEquals(0, jobsInFlushes.get());
            assertEquals(0, dispatcher.inFlight());
        }
    }

    @Test
    void processorFailureIsCountedAndResultStaysOpen() throws Exception {
        CountDownLatch failed = new CountDownLatch(1);
        MetricsExporter metrics = new RecordingMetrics() {
            @Override
            public void incrementJobsFailed() {
                failed.countDown();
            }
        };
        JobProcessor<String, String> failing = s -> {
            throw new IllegalArgumentException("bad input: " + s);
        };
        try (var dispatcher = new BatchDispatcher<>(failing, 1, "w-", metrics, WAIT)) {
            QueuedJob<String, String> job = queued(9, "x");
            dispatcher.dispatch(new Flush<>(FlushTrigger.SIZE, List.of(job)));

            assertTrue(failed.await(5, TimeUnit.SECONDS));
            assertFalse(job.result().isDone());
        }
    }

    @Test
    void dispatchAfterCloseCountsJobsAsFailed() {
        AtomicInteger failures = new AtomicInteger();
        MetricsExporter metrics = new RecordingMetrics() {
            @Override
            public void incrementJobsFailed() {
                failures.incrementAndGet();
            }
        };
        var dispatcher = new BatchDispatcher<String, String>(s -> s, 0, "w-", metrics, WAIT);
        dispatcher.close();

        QueuedJob<String, String> job = queued(1, "late");
        dispatcher.dispatch(new Flush<>(FlushTrigger.TIMER, List.of(job)));

        assertEquals(1, failures.get());
        assertEquals(0, dispatcher.inFlight());
        assertFalse(job.result().isDone());
    }

    @Test
    void closeWaitsForInFlightJobs() throws Exception {
        JobProcessor<String, String> slow = s -> {
            try {
                Thread.sleep(30);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return s;
        };
        var dispatcher = new BatchDispatcher<>(slow, 0, "w-", MetricsExporter.NOOP, WAIT);
        QueuedJob<String, String> job = queued(1, "slow");
        dispatcher.dispatch(new Flush<>(FlushTrigger.SIZE, List.of(job)));

        dispatcher.close();

        assertTrue(job.result().isDone());
        assertEquals(0, dispatcher.inFlight());
    }

    private static <B> QueuedJob<String, B> queued(long id, String data) {
        return QueuedJob.of(Job.of(id, data));
    }

    private static class RecordingMetrics implements MetricsExporter {
        @Override
        public void incrementJobsSubmitted() {
        }

        @Override
        public void incrementJobsRejected() {
        }

        @Override
        public void recordFlush(FlushTrigger trigger, int batchSize) {
        }

        @Override
        public void incrementJobsProcessed() {
        }

        @Override
        public void incrementJobsFailed() {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }
    }
}
