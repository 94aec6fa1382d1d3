package io.deskflow.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import io.deskflow.TempDirs;
import io.deskflow.lock.FileLock;
import io.deskflow.model.RunRecord;
import io.deskflow.model.RunStatus;
import io.deskflow.model.RunTrigger;
import io.deskflow.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class CronSchedulerTest {
    private static final LocalDateTime NINE_AM = LocalDateTime.of(2026, 3, 2, 9, 0, 0);

    @Test
    void falseConditionSkipsWithoutTakingTheLock() throws Exception {
        Path root = Files.createTempDirectory("deskflow-sched-cond-");
        CronScheduler scheduler = new CronScheduler(new FileLock("test"), root.resolve("reports"), 1, 100L);
        try {
            Path lock = root.resolve("jobs").resolve("gated.lock");
            AtomicInteger runs = new AtomicInteger();
            AtomicInteger lockSeenDuringCondition = new AtomicInteger();
            scheduler.addJob("0 9 * * *", () -> runs.incrementAndGet(), lock, List.of(() -> {
                if (Files.exists(lock)) {
                    lockSeenDuringCondition.incrementAndGet();
                }
                return false;
            }));

            List<Future<JobFiring>> firings = scheduler.runPending(NINE_AM);

            Assertions.assertEquals(1, firings.size());
            Assertions.assertEquals(JobOutcome.SKIPPED_CONDITION, firings.get(0).get(5, TimeUnit.SECONDS).outcome());
            Assertions.assertEquals(0, runs.get());
            Assertions.assertEquals(0, lockSeenDuringCondition.get());
            Assertions.assertFalse(Files.exists(lock));
        } finally {
            scheduler.close();
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void throwingConditionCountsAsFalse() throws Exception {
        Path root = Files.createTempDirectory("deskflow-sched-cond-throw-");
        CronScheduler scheduler = new CronScheduler(new FileLock("test"), root.resolve("reports"), 1, 100L);
        try {
            scheduler.addJob("0 9 * * *", () -> "ran", root.resolve("a.lock"), List.of(() -> {
                throw new IllegalStateException("sensor failed");
            }));

            JobFiring firing = scheduler.runPending(NINE_AM).get(0).get(5, TimeUnit.SECONDS);

            Assertions.assertEquals(JobOutcome.SKIPPED_CONDITION, firing.outcome());
        } finally {
            scheduler.close();
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void overlappingFiringIsSkippedWhileTargetRuns() throws Exception {
        Path root = Files.createTempDirectory("deskflow-sched-overlap-");
        CronScheduler scheduler = new CronScheduler(new FileLock("test"), root.resolve("reports"), 2, 100L);
        try {
            Path lock = root.resolve("slow.lock");
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            AtomicInteger runs = new AtomicInteger();
            scheduler.addJob("* * * * * *", () -> {
                runs.incrementAndGet();
                started.countDown();
                Assertions.assertTrue(release.await(10, TimeUnit.SECONDS));
                return "done";
            }, lock);

            Future<JobFiring> first = scheduler.runPending(NINE_AM).get(0);
            Assertions.assertTrue(started.await(5, TimeUnit.SECONDS));
            Assertions.assertTrue(Files.exists(lock));

            JobFiring second = scheduler.runPending(NINE_AM.plusSeconds(1)).get(0).get(5, TimeUnit.SECONDS);
            Assertions.assertEquals(JobOutcome.SKIPPED_OVERLAP, second.outcome());

            release.countDown();
            Assertions.assertEquals(JobOutcome.COMPLETED, first.get(5, TimeUnit.SECONDS).outcome());
            Assertions.assertFalse(Files.exists(lock));
            Assertions.assertEquals(1, runs.get());

            JobFiring third = scheduler.runPending(NINE_AM.plusSeconds(2)).get(0).get(5, TimeUnit.SECONDS);
            Assertions.assertEquals(JobOutcome.COMPLETED, third.outcome());
        } finally {
            scheduler.close();
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void crashingJobWritesReportAndOthersStillRun() throws Exception {
        Path root = Files.createTempDirectory("deskflow-sched-crash-");
        Path reports = root.resolve("reports");
        CronScheduler scheduler = new CronScheduler(new FileLock("test"), reports, 2, 100L);
        try {
            List<RunRecord> published = new CopyOnWriteArrayList<>();
            scheduler.addListener(published::add);
            Path logFile = root.resolve("deskflow.log");
            Files.writeString(logFile, "line one\nline two\n", StandardCharsets.UTF_8);
            scheduler.addJob(new ScheduledJob("nightly-export", CronExpression.parse("0 9 * * *"), () -> {
                throw new IllegalStateException("disk full");
            }, root.resolve("export.lock"), List.of(), logFile));
            ScheduledJob healthy = scheduler.addJob("0 9 * * *", () -> 42, root.resolve("healthy.lock"));

            List<Future<JobFiring>> firings = scheduler.runPending(NINE_AM);
            JobFiring crashed = firings.get(0).get(5, TimeUnit.SECONDS);
            JobFiring ok = firings.get(1).get(5, TimeUnit.SECONDS);

            Assertions.assertEquals(JobOutcome.FAILED, crashed.outcome());
            Assertions.assertEquals("disk full", crashed.error());
            Assertions.assertNotNull(crashed.crashReport());
            Assertions.assertTrue(crashed.crashReport().getFileName().toString().startsWith("crash_"));
            JsonNode report = Jsons.mapper().readTree(Files.readString(crashed.crashReport(), StandardCharsets.UTF_8));
            Assertions.assertEquals("nightly-export", report.path("job_id").asText());
            Assertions.assertEquals("java.lang.IllegalStateException", report.path("error_type").asText());
            Assertions.assertTrue(report.path("stack_trace").asText().contains("disk full"));
            Assertions.assertTrue(report.path("log").asText().contains("line two"));
            Assertions.assertFalse(report.path("env").path("java").asText().isEmpty());
            Assertions.assertFalse(Files.exists(root.resolve("export.lock")));

            Assertions.assertEquals(JobOutcome.COMPLETED, ok.outcome());
            Assertions.assertNull(ok.crashReport());

            List<RunRecord> sorted = published.stream().sorted(Comparator.comparing(RunRecord::flowName)).toList();
            Assertions.assertEquals(2, sorted.size());
            Assertions.assertEquals("job:" + healthy.id(), sorted.get(0).flowName());
            Assertions.assertEquals(RunStatus.SUCCESS, sorted.get(0).status());
            Assertions.assertEquals("job:nightly-export", sorted.get(1).flowName());
            Assertions.assertEquals(RunStatus.FAILED, sorted.get(1).status());
            Assertions.assertEquals("internal_error", sorted.get(1).reason());
            Assertions.assertEquals(RunTrigger.SCHEDULED, sorted.get(1).trigger());
        } finally {
            scheduler.close();
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void runRecordTargetsAreNotRepublished() throws Exception {
        Path root = Files.createTempDirectory("deskflow-sched-record-");
        CronScheduler scheduler = new CronScheduler(new FileLock("test"), root.resolve("reports"), 1, 100L);
        try {
            List<RunRecord> published = new CopyOnWriteArrayList<>();
            scheduler.addListener(published::add);
            scheduler.addJob("0 9 * * *", () -> RunRecord.failed("r1", "invoice", RunTrigger.SCHEDULED, 1L, 2L,
                    "s1", "timeout", "wait_for timed out", List.of()), root.resolve("flow.lock"));

            JobFiring firing = scheduler.runPending(NINE_AM).get(0).get(5, TimeUnit.SECONDS);

            Assertions.assertEquals(JobOutcome.FAILED, firing.outcome());
            Assertions.assertEquals("wait_for timed out", firing.error());
            Assertions.assertNull(firing.crashReport());
            Assertions.assertTrue(published.isEmpty());
            Assertions.assertFalse(Files.exists(root.resolve("reports")));
        } finally {
            scheduler.close();
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void jobsReportCountsAndNextFire() throws Exception {
        Path root = Files.createTempDirectory("deskflow-sched-status-");
        Clock clock = Clock.fixed(Instant.parse("2026-03-02T08:30:00Z"), ZoneOffset.UTC);
        CronScheduler scheduler = new CronScheduler(new FileLock("test"), root.resolve("reports"), 1, 100L, clock);
        try {
            ScheduledJob job = scheduler.addJob("0 9 * * *", () -> "ok", root.resolve("s.lock"));
            Assertions.assertThrows(IllegalArgumentException.class, () -> scheduler.addJob(job));

            scheduler.runPending(NINE_AM).get(0).get(5, TimeUnit.SECONDS);
            scheduler.runPending(NINE_AM.plusMinutes(1));

            JobStatus status = scheduler.jobs().get(0);
            Assertions.assertEquals(job.id(), status.id());
            Assertions.assertEquals("0 9 * * *", status.cron());
            Assertions.assertEquals(NINE_AM, status.nextFire());
            Assertions.assertEquals(1L, status.counts().get(JobOutcome.COMPLETED));
            Assertions.assertEquals(0L, status.counts().get(JobOutcome.FAILED));
            Assertions.assertEquals(JobOutcome.COMPLETED, status.lastFiring().outcome());
        } finally {
            scheduler.close();
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void tickFiresEachSecondOnce() throws Exception {
        Path root = Files.createTempDirectory("deskflow-sched-tick-");
        Clock clock = Clock.fixed(Instant.parse("2026-03-02T09:00:00Z"), ZoneOffset.UTC);
        CronScheduler scheduler = new CronScheduler(new FileLock("test"), root.resolve("reports"), 1, 100L, clock);
        try {
            AtomicInteger runs = new AtomicInteger();
            scheduler.addJob("* * * * * *", runs::incrementAndGet, root.resolve("t.lock"));

            scheduler.tick();
            scheduler.tick();
            scheduler.stop();

            Assertions.assertEquals(1, runs.get());
            Assertions.assertEquals(1L, scheduler.jobs().get(0).counts().get(JobOutcome.COMPLETED));
        } finally {
            scheduler.close();
            TempDirs.deleteRecursively(root);
        }
    }
}
