package io.deskflow.config;

import io.deskflow.TempDirs;
import io.deskflow.config.RuntimeSettings.JobSettings;
import io.deskflow.config.RuntimeSettings.MissingRoleKeyPolicy;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class RuntimeSettingsTest {

    @Test
    void missingFileGivesDefaults() throws Exception {
        Path dir = Files.createTempDirectory("deskflow-settings-");
        try {
            RuntimeSettings settings = RuntimeSettings.load(dir.resolve("deskflow-settings.json"));

            Assertions.assertEquals(RuntimeSettings.defaults(), settings);
            Assertions.assertEquals(0L, settings.staleLockMs());
            Assertions.assertEquals(MissingRoleKeyPolicy.DENY, settings.missingRoleKeyPolicy());
            Assertions.assertTrue(settings.jobs().isEmpty());
        } finally {
            TempDirs.deleteRecursively(dir);
        }
    }

    @Test
    void partialAndInvalidFieldsFallBack() throws Exception {
        Path dir = Files.createTempDirectory("deskflow-settings-partial-");
        try {
            Path file = dir.resolve("deskflow-settings.json");
            Files.writeString(file, """
                    {"staleLockMs": "90000", "schedulerPollMs": "fast", "schedulerWorkers": -3,
                     "missingRoleKeyPolicy": "Allow"}
                    """, StandardCharsets.UTF_8);

            RuntimeSettings settings = RuntimeSettings.load(file);

            Assertions.assertEquals(90_000L, settings.staleLockMs());
            Assertions.assertEquals(RuntimeSettings.DEFAULT_SCHEDULER_POLL_MS, settings.schedulerPollMs());
            Assertions.assertEquals(RuntimeSettings.DEFAULT_SCHEDULER_WORKERS, settings.schedulerWorkers());
            Assertions.assertEquals(MissingRoleKeyPolicy.ALLOW, settings.missingRoleKeyPolicy());

            Files.writeString(file, "[not an object", StandardCharsets.UTF_8);
            Assertions.assertEquals(RuntimeSettings.defaults(), RuntimeSettings.load(file));
        } finally {
            TempDirs.deleteRecursively(dir);
        }
    }

    @Test
    void parsesJobsAndSkipsIncompleteEntries() throws Exception {
        Path dir = Files.createTempDirectory("deskflow-settings-jobs-");
        try {
            Path file = dir.resolve("deskflow-settings.json");
            Files.writeString(file, """
                    {"jobs": [
                      {"id": "nightly", "cron": "0 2 * * *", "flow": "export", "role": "ops",
                       "conditions": ["vpn", " !screen_locked ", ""]},
                      {"id": "broken", "flow": "export"},
                      {"id": "hourly", "cron": "0 * * * *", "flow": "sync", "lock": "locks/sync.lock"}
                    ]}
                    """, StandardCharsets.UTF_8);

            List<JobSettings> jobs = RuntimeSettings.load(file).jobs();

            Assertions.assertEquals(2, jobs.size());
            Assertions.assertEquals(new JobSettings("nightly", "0 2 * * *", "export", "ops", null,
                    List.of("vpn", "!screen_locked")), jobs.get(0));
            Assertions.assertEquals("locks/sync.lock", jobs.get(1).lock());
            Assertions.assertNull(jobs.get(1).role());
            Assertions.assertTrue(jobs.get(1).conditions().isEmpty());
        } finally {
            TempDirs.deleteRecursively(dir);
        }
    }

    @Test
    void savedSettingsLoadBack() throws Exception {
        Path dir = Files.createTempDirectory("deskflow-settings-save-");
        try {
            Path file = dir.resolve("nested").resolve("deskflow-settings.json");
            RuntimeSettings settings = new RuntimeSettings(5_000L, 500L, 4, MissingRoleKeyPolicy.ALLOW,
                    List.of(new JobSettings("j", "*/5 * * * *", "f", null, null, List.of("ac_power"))));

            settings.save(file);

            Assertions.assertEquals(settings, RuntimeSettings.load(file));
        } finally {
            TempDirs.deleteRecursively(dir);
        }
    }
}
