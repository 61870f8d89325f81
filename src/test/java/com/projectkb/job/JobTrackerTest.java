package com.projectkb.job;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.projectkb.ingest.ErrorKind;

class JobTrackerTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldCompleteWhenLastFileIsRecorded() {
        JobTracker tracker = new JobTracker(new LocalJsonJobStore(tempDir), fixedClock());
        tracker.createJob("job-1", "alpha", "user-1", files(3));
        tracker.start("job-1");

        tracker.recordSuccess("job-1", 0, "doc-0");
        IngestionJob afterTwo = tracker.recordFailure("job-1", 1, ErrorKind.UNSUPPORTED_FORMAT, "image/png");
        assertEquals(JobStatus.PROCESSING, afterTwo.status());
        assertEquals(66.7, afterTwo.progressPercentage());
        assertEquals(50.0, afterTwo.successRate());

        IngestionJob done = tracker.recordSuccess("job-1", 2, "doc-2");

        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals(2, done.processedFiles());
        assertEquals(1, done.failedFiles());
        assertEquals(100.0, done.progressPercentage());
        assertNotNull(done.completedAt());
        assertEquals(List.of(new FileError(1, "file-1.txt", ErrorKind.UNSUPPORTED_FORMAT, "image/png")), done.errors());
    }

    @Test
    void shouldNotLoseConcurrentUpdates() throws Exception {
        int files = 64;
        JobTracker tracker = new JobTracker(new LocalJsonJobStore(tempDir), Clock.systemUTC());
        tracker.createJob("job-1", "alpha", "user-1", files(files));
        tracker.start("job-1");

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < files; i++) {
            int index = i;
            futures.add(pool.submit(() -> {
                start.await();
                if (index % 4 == 0) {
                    tracker.recordFailure("job-1", index, ErrorKind.EXTRACTION, "bad");
                } else {
                    tracker.recordSuccess("job-1", index, "doc-" + index);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get();
        }
        pool.shutdown();

        IngestionJob job = tracker.get("job-1");
        assertEquals(JobStatus.COMPLETED, job.status());
        assertEquals(48, job.processedFiles());
        assertEquals(16, job.failedFiles());
    }

    @Test
    void shouldNeverLeaveTerminalStatus() {
        JobTracker tracker = new JobTracker(new LocalJsonJobStore(tempDir), fixedClock());
        tracker.createJob("job-1", "alpha", "user-1", files(1));
        tracker.start("job-1");
        tracker.recordSuccess("job-1", 0, "doc-0");

        assertThrows(IllegalStateException.class, () -> tracker.fail("job-1", "late failure"));
        assertThrows(IllegalStateException.class, () -> tracker.start("job-1"));
        assertThrows(IllegalStateException.class, () -> tracker.recordSuccess("job-1", 0, "doc-0"));
        assertEquals(JobStatus.COMPLETED, tracker.get("job-1").status());
        assertFalse(tracker.requestCancel("job-1").cancelRequested());
    }

    @Test
    void shouldAbortUnattemptedFilesWhenJobFails() {
        JobTracker tracker = new JobTracker(new LocalJsonJobStore(tempDir), fixedClock());
        tracker.createJob("job-1", "alpha", "user-1", files(4));
        tracker.start("job-1");
        tracker.recordSuccess("job-1", 0, "doc-0");
        tracker.recordFailure("job-1", 1, ErrorKind.STORAGE, "disk full");

        IngestionJob failed = tracker.fail("job-1", "Storage unavailable");

        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals(1, failed.processedFiles());
        assertEquals(3, failed.failedFiles());
        assertEquals(failed.totalFiles(), failed.processedFiles() + failed.failedFiles());
        assertEquals(List.of(ErrorKind.STORAGE, ErrorKind.ABORTED, ErrorKind.ABORTED),
                failed.errors().stream().map(FileError::kind).toList());
    }

    @Test
    void shouldPersistJobsAcrossRestartAndFailInterruptedOnes() {
        JobTracker tracker = new JobTracker(new LocalJsonJobStore(tempDir), fixedClock());
        tracker.createJob("finished", "alpha", "user-1", files(1));
        tracker.start("finished");
        tracker.recordSuccess("finished", 0, "doc-0");
        tracker.createJob("running", "alpha", "user-1", files(2));
        tracker.start("running");
        tracker.recordSuccess("running", 0, "doc-1");
        tracker.createJob("queued", "alpha", "user-2", files(1));

        JobTracker restarted = new JobTracker(new LocalJsonJobStore(tempDir), fixedClock());
        assertEquals(2, restarted.failInterruptedJobs());

        assertEquals(JobStatus.COMPLETED, restarted.get("finished").status());
        IngestionJob running = restarted.get("running");
        assertEquals(JobStatus.FAILED, running.status());
        assertEquals(1, running.processedFiles());
        assertEquals(ErrorKind.INTERRUPTED, running.errors().get(0).kind());
        assertEquals(JobStatus.FAILED, restarted.get("queued").status());
    }

    @Test
    void shouldListNewestFirstAndPurgeOldFinishedJobs() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
        JobTracker tracker = new JobTracker(new LocalJsonJobStore(tempDir), clock);
        tracker.createJob("old", "alpha", "user-1", files(1));
        tracker.start("old");
        tracker.recordSuccess("old", 0, "doc-0");
        clock.advance(Duration.ofDays(40));
        tracker.createJob("new", "alpha", "user-1", files(1));
        tracker.createJob("other", "beta", "user-2", files(1));

        assertEquals(List.of("new", "old"), tracker.listByProject("alpha", 10).stream().map(IngestionJob::id).toList());
        assertEquals(List.of("other"), tracker.listByUser("user-2", 10).stream().map(IngestionJob::id).toList());

        assertEquals(1, tracker.purgeFinishedBefore(clock.instant().minus(Duration.ofDays(30))));
        assertThrows(JobNotFoundException.class, () -> tracker.get("old"));
        assertTrue(tracker.get("new").status() == JobStatus.PENDING);
    }

    @Test
    void shouldRecordCancelRequest() {
        JobTracker tracker = new JobTracker(new LocalJsonJobStore(tempDir), fixedClock());
        tracker.createJob("job-1", "alpha", "user-1", files(2));
        tracker.start("job-1");

        tracker.requestCancel("job-1");

        assertTrue(tracker.isCancelRequested("job-1"));
        assertThrows(JobNotFoundException.class, () -> tracker.requestCancel("missing"));
    }

    private static List<JobFile> files(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> JobFile.pending(i, "file-" + i + ".txt", 10, "text/plain"))
                .toList();
    }

    private static Clock fixedClock() {
        return Clock.fixed(Instant.parse("2026-01-05T10:00:00Z"), ZoneOffset.UTC);
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
