package microbatch.scheduler;

import microbatch.FlushTrigger;
import microbatch.Job;
import microbatch.dispatch.BatchDispatcher;
import microbatch.queue.JobQueue;
import microbatch.queue.QueuedJob;
import microbatch.spi.MetricsExporter;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchSchedulerTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    @Test
    void rejectsNonPositiveBatchSize() {
        JobQueue<String, String> queue = new JobQueue<>();
        try (var dispatcher = newDispatcher(MetricsExporter.NOOP)) {
            assertThrows(IllegalArgumentException.class, () ->
                    new BatchScheduler<>(queue, dispatcher, MetricsExporter.NOOP, 0, WAIT, "s-"));
        }
    }

    @Test
    void sealingTheQueueEndsTheLoopAndStopsTheTimer() throws Exception {
        RecordingMetrics metrics = new RecordingMetrics();
        JobQueue<String, String> queue = new JobQueue<>();
        try (var dispatcher = newDispatcher(metrics)) {
            var scheduler = new BatchScheduler<>(queue, dispatcher, metrics, 5, Duration.ofMinutes(5), "s-");
            scheduler.start();
            assertTrue(scheduler.isTimerRunning());
            QueuedJob<String, String> job = QueuedJob.of(Job.of(1, "left over"));
            queue.offer(job);

            queue.seal();

            assertTrue(scheduler.awaitTermination(WAIT));
            assertFalse(scheduler.isTimerRunning());
            assertEquals("left over", job.result().get(WAIT));
            assertEquals(List.of(FlushTrigger.SHUTDOWN), metrics.triggers);
        }
    }

    @Test
    void drainNowDispatchesOnCallingThread() throws Exception {
        RecordingMetrics metrics = new RecordingMetrics();
        JobQueue<String, String> queue = new JobQueue<>();
        try (var dispatcher = newDispatcher(metrics)) {
            var scheduler = new BatchScheduler<>(queue, dispatcher, metrics, 5, Duration.ofMinutes(5), "s-");
            QueuedJob<String, String> job = QueuedJob.of(Job.of(1, "queued"));
            queue.offer(job);
            queue.seal();

            scheduler.drainNow();

            assertTrue(scheduler.isTerminated());
            assertEquals("queued", job.result().get(WAIT));
            assertEquals(List.of(FlushTrigger.SHUTDOWN), metrics.triggers);
            assertEquals(0, queue.size());
        }
    }

    @Test
    void timerTicksFlushWholeQueue() throws Exception {
        RecordingMetrics metrics = new RecordingMetrics();
        JobQueue<String, String> queue = new JobQueue<>();
        try (var dispatcher = newDispatcher(metrics)) {
            var scheduler = new BatchScheduler<>(queue, dispatcher, metrics, 100, Duration.ofMillis(20), "s-");
            QueuedJob<String, String> a = QueuedJob.of(Job.of(1, "a"));
            QueuedJob<String, String> b = QueuedJob.of(Job.of(2, "b"));
            queue.offer(a);
            queue.offer(b);
            scheduler.start();

            assertEquals("a", a.result().get(WAIT));
            assertEquals("b", b.result().get(WAIT));
            assertTrue(metrics.triggers.contains(FlushTrigger.TIMER));
            assertFalse(metrics.triggers.contains(FlushTrigger.SIZE));

            queue.seal();
            assertTrue(scheduler.awaitTermination(WAIT));
        }
    }

    @Test
    void repeatedSizeFlushesKeepASingleTimerTickQueued() throws Exception {
        JobQueue<String, String> queue = new JobQueue<>();
        try (var dispatcher = new BatchDispatcher<String, String>(s -> s, 2, "w-", MetricsExporter.NOOP, WAIT)) {
            var scheduler = new BatchScheduler<>(queue, dispatcher, MetricsExporter.NOOP, 1, Duration.ofMinutes(5), "s-");
            scheduler.start();

            for (int i = 0; i < 5_000; i++) {
                QueuedJob<String, String> job = QueuedJob.of(Job.of(i, "job-" + i));
                queue.offer(job);
                job.result().get(WAIT);
            }

            assertTrue(scheduler.pendingTimerTicks() <= 2,
                    "pending timer ticks: " + scheduler.pendingTimerTicks());

            queue.seal();
            assertTrue(scheduler.awaitTermination(WAIT));
        }
    }

    private static BatchDispatcher<String, String> newDispatcher(MetricsExporter metrics) {
        return new BatchDispatcher<>(s -> s, 0, "w-", metrics, WAIT);
    }

    private static final class RecordingMetrics implements MetricsExporter {
        final List<FlushTrigger> triggers = new CopyOnWriteArrayList<>();

        @Override
        public void incrementJobsSubmitted() {
        }

        @Override
        public void incrementJobsRejected() {
        }

        @Override
        public void recordFlush(FlushTrigger trigger, int batchSize) {
            // timer ticks on an empty queue are noise here
            if (batchSize > 0 || trigger != FlushTrigger.TIMER) {
                triggers.add(trigger);
            }
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
