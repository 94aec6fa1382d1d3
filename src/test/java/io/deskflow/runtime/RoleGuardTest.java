package io.deskflow.runtime;

import io.deskflow.TempDirs;
import io.deskflow.action.ActionDispatcher;
import io.deskflow.action.ActionRegistry;
import io.deskflow.config.DeskFlowConfig;
import io.deskflow.config.RuntimeSettings.MissingRoleKeyPolicy;
import io.deskflow.lock.FileLock;
import io.deskflow.model.Flow;
import io.deskflow.model.FlowOperation;
import io.deskflow.observability.AuditLogger;
import io.deskflow.storage.FlowStore;
import io.deskflow.util.Jsons;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

final class RoleGuardTest {
    private static final Flow GUARDED = Flow.of("invoice", List.of()).withRoles(Map.of(
            FlowOperation.EDIT, Set.of("admin"),
            FlowOperation.RUN, Set.of("ops", "admin"),
            FlowOperation.APPROVE, Set.of()
    ));

    @Test
    void listedOperationsRequireMembership() {
        RoleGuard guard = new RoleGuard(MissingRoleKeyPolicy.DENY);

        Assertions.assertTrue(guard.isAllowed(GUARDED, FlowOperation.EDIT, "admin"));
        Assertions.assertFalse(guard.isAllowed(GUARDED, FlowOperation.EDIT, "ops"));
        Assertions.assertFalse(guard.isAllowed(GUARDED, FlowOperation.EDIT, null));
        Assertions.assertFalse(guard.isAllowed(GUARDED, FlowOperation.APPROVE, "admin"));
        Assertions.assertTrue(guard.isAllowed(GUARDED, FlowOperation.RUN, " ops "));
    }

    @Test
    void missingKeyFollowsPolicyAndEmptyMapAllowsAll() {
        Assertions.assertFalse(new RoleGuard(MissingRoleKeyPolicy.DENY).isAllowed(GUARDED, FlowOperation.PUBLISH, "admin"));
        Assertions.assertTrue(new RoleGuard(MissingRoleKeyPolicy.ALLOW).isAllowed(GUARDED, FlowOperation.PUBLISH, "anyone"));
        Assertions.assertTrue(new RoleGuard(MissingRoleKeyPolicy.DENY)
                .isAllowed(Flow.of("plain", List.of()), FlowOperation.PUBLISH, null));
    }

    @Test
    void deniedEditHasNoSideEffectsAndAllowedEditIsObservable() throws Exception {
        Path root = Files.createTempDirectory("deskflow-rbac-");
        try {
            DeskFlowConfig config = new DeskFlowConfig(root);
            FlowStore store = new FlowStore(config);
            AuditLogger audit = new AuditLogger(config.auditFile(), "");
            FlowRunner runner = new FlowRunner(new ActionDispatcher(new ActionRegistry()), new FileLock("test"),
                    config.runLockFile(), new RoleGuard(MissingRoleKeyPolicy.DENY), store, audit, config.runsRoot());
            store.save(GUARDED);
            String before = Files.readString(store.flowFile("invoice"), StandardCharsets.UTF_8);
            AtomicInteger editorCalls = new AtomicInteger();

            PermissionDeniedException denied = Assertions.assertThrows(PermissionDeniedException.class,
                    () -> runner.editFlow(GUARDED, "ops", f -> {
                        editorCalls.incrementAndGet();
                        return f.withDescription("hacked");
                    }));
            Assertions.assertEquals("permission_denied", denied.reason());
            Assertions.assertEquals(FlowOperation.EDIT, denied.operation());
            Assertions.assertEquals(0, editorCalls.get());
            Assertions.assertEquals(before, Files.readString(store.flowFile("invoice"), StandardCharsets.UTF_8));

            Flow edited = runner.editFlow(GUARDED, "admin", f -> f.withDescription("reviewed"));
            Assertions.assertEquals("reviewed", edited.description());
            Assertions.assertEquals("reviewed", store.load("invoice").orElseThrow().description());

            List<String> auditLines = Files.readAllLines(config.auditFile(), StandardCharsets.UTF_8);
            JsonNode deniedRow = Jsons.mapper().readTree(auditLines.get(0));
            JsonNode allowedRow = Jsons.mapper().readTree(auditLines.get(1));
            Assertions.assertEquals("flow.edit", deniedRow.path("action").asText());
            Assertions.assertEquals("denied", deniedRow.path("result").asText());
            Assertions.assertEquals("allowed", allowedRow.path("result").asText());
            Assertions.assertEquals(2L, audit.verify());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void publishAndApproveAreGuardedToo() throws Exception {
        Path root = Files.createTempDirectory("deskflow-rbac-publish-");
        try {
            DeskFlowConfig config = new DeskFlowConfig(root);
            FlowStore store = new FlowStore(config);
            FlowRunner runner = new FlowRunner(new ActionDispatcher(new ActionRegistry()), new FileLock("test"),
                    config.runLockFile(), new RoleGuard(MissingRoleKeyPolicy.ALLOW), store, null, null);

            Path published = runner.publishFlow(GUARDED, "anyone");
            Assertions.assertTrue(Files.exists(published));
            Assertions.assertThrows(PermissionDeniedException.class, () -> runner.approveFlow(GUARDED, "admin"));
            Assertions.assertTrue(store.approval("invoice").isEmpty());
            Assertions.assertEquals(Map.of("name", "invoice", "published", true, "approved", false), store.describe("invoice"));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }
}
