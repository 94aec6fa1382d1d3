package io.deskflow.observability;

import io.deskflow.TempDirs;
import io.deskflow.util.Jsons;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

final class StepLogWriterTest {

    @Test
    void writesOneMaskedLinePerStep() throws Exception {
        Path root = Files.createTempDirectory("deskflow-steplog-");
        try {
            StepLogWriter writer = new StepLogWriter(root.resolve("run-1"));
            writer.stepSucceeded("run-1", "login", "fill", Map.of("selector", "#pw", "password", "hunter2"), 12L, "ok");
            writer.stepFailed("run-1", "submit", "click", Map.of("selector", "#go"), 30L, "element_not_found", "#go not found");

            List<String> lines = Files.readAllLines(writer.file(), StandardCharsets.UTF_8);
            Assertions.assertEquals(2, lines.size());
            JsonNode ok = Jsons.mapper().readTree(lines.get(0));
            JsonNode failed = Jsons.mapper().readTree(lines.get(1));
            Assertions.assertEquals("ok", ok.path("status").asText());
            Assertions.assertEquals("***", ok.path("params").path("password").asText());
            Assertions.assertEquals("#pw", ok.path("params").path("selector").asText());
            Assertions.assertEquals("error", failed.path("status").asText());
            Assertions.assertEquals("element_not_found", failed.path("reason").asText());
            Assertions.assertEquals("submit", failed.path("step_id").asText());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void masksStructuredResults() throws Exception {
        Path root = Files.createTempDirectory("deskflow-steplog-result-");
        try {
            StepLogWriter writer = new StepLogWriter(root.resolve("run-2"));
            writer.stepSucceeded("run-2", "fetch", "evaluate", Map.of("script", "session()"), 5L,
                    Map.of("user", "alice", "session_token", "abc", "rows", List.of(1, 2)));
            writer.stepSucceeded("run-2", "shot", "screenshot", Map.of(), 5L, new byte[]{1, 2, 3});

            List<String> lines = Files.readAllLines(writer.file(), StandardCharsets.UTF_8);
            JsonNode structured = Jsons.mapper().readTree(lines.get(0)).path("result");
            Assertions.assertEquals("alice", structured.path("user").asText());
            Assertions.assertEquals("***", structured.path("session_token").asText());
            Assertions.assertEquals(2, structured.path("rows").size());
            Assertions.assertEquals("3 bytes", Jsons.mapper().readTree(lines.get(1)).path("result").asText());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }
}
