package io.deskflow.cli;

import io.deskflow.DeskFlowException;
import io.deskflow.TempDirs;
import io.deskflow.config.DeskFlowConfig;
import io.deskflow.model.Flow;
import io.deskflow.model.FlowOperation;
import io.deskflow.model.Step;
import io.deskflow.storage.FlowStore;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeskFlowCommandTest {
    @Test
    void parseVarsShouldSplitOnFirstEquals() {
        Map<String, Object> vars = DeskFlowCommand.parseVars(List.of("user=alice", "query=a=b", "empty="));
        assertEquals(Map.of("user", "alice", "query", "a=b", "empty", ""), vars);
        assertTrue(DeskFlowCommand.parseVars(null).isEmpty());

        DeskFlowException e = assertThrows(DeskFlowException.class, () -> DeskFlowCommand.parseVars(List.of("=x")));
        assertEquals("invalid_params", e.reason());
    }

    @Test
    void runShouldReportExitCodes() throws Exception {
        Path root = Files.createTempDirectory("deskflow-cli-");
        try {
            assertEquals(0, execute("--root", root.toString(), "init").exitCode);
            new FlowStore(new DeskFlowConfig(root)).save(Flow.of("greet", List.of(
                    Step.of("s1", "set", Map.of("name", "who", "value", "${who}")),
                    Step.of("s2", "press_any_key", Map.of())
            )));

            Result missing = execute("--root", root.toString(), "run", "nope");
            assertEquals(1, missing.exitCode);
            assertTrue(missing.out.contains("\"flow_not_found\""));

            Result failed = execute("--root", root.toString(), "run", "greet", "--var", "who=world");
            assertEquals(2, failed.exitCode);
            assertTrue(failed.out.contains("\"unknown_action\""));

            assertEquals(1, execute("--root", root.toString(), "run", "greet", "--var", "broken").exitCode);
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void flowEditShouldRespectRoles() throws Exception {
        Path root = Files.createTempDirectory("deskflow-cli-edit-");
        try {
            DeskFlowConfig config = new DeskFlowConfig(root);
            FlowStore store = new FlowStore(config);
            store.save(Flow.of("invoice", List.of()).withRoles(Map.of(FlowOperation.EDIT, Set.of("admin"))));

            Result denied = execute("--root", root.toString(), "flow-edit", "invoice", "--role", "ops", "--set-desc", "x");
            assertEquals(1, denied.exitCode);
            assertTrue(denied.out.contains("\"permission_denied\""));
            assertEquals("", store.load("invoice").orElseThrow().description());

            Result allowed = execute("--root", root.toString(), "flow-edit", "invoice", "--role", "admin", "--set-desc", "monthly");
            assertEquals(0, allowed.exitCode);
            assertEquals("monthly", store.load("invoice").orElseThrow().description());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void statsShouldRenderEachFormat() throws Exception {
        Path root = Files.createTempDirectory("deskflow-cli-stats-");
        try {
            assertTrue(execute("--root", root.toString(), "stats").out.contains("\"totals\""));
            assertTrue(execute("--root", root.toString(), "stats", "--format", "prometheus").out.contains("deskflow_runs_total"));
            assertTrue(execute("--root", root.toString(), "stats", "--format", "html").out.contains("<html"));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    private static Result execute(String... args) {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            System.setOut(capture);
            int code = new CommandLine(new DeskFlowCommand()).execute(args);
            return new Result(code, buffer.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(original);
        }
    }

    private record Result(int exitCode, String out) {
    }
}
