package io.deskflow.storage;

import io.deskflow.config.DeskFlowConfig;
import io.deskflow.flow.FlowDocuments;
import io.deskflow.model.Flow;
import io.deskflow.util.Hashing;
import io.deskflow.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Flow documents on disk: working copies under {@code flows/}, published copies
 * under {@code published/}, approval records under {@code approvals/}. Files are
 * named after the flow.
 */
public final class FlowStore {
    private final DeskFlowConfig config;

    public FlowStore(DeskFlowConfig config) {
        this.config = config;
    }

    public Path flowFile(String name) {
        return config.flowsRoot().resolve(fileName(name));
    }

    public Path publishedFile(String name) {
        return config.publishedRoot().resolve(fileName(name));
    }

    public Path approvalFile(String name) {
        return config.approvalsRoot().resolve(fileName(name));
    }

    public Optional<Flow> load(String name) {
        Path file = flowFile(name);
        return Files.exists(file) ? Optional.of(FlowDocuments.read(file)) : Optional.empty();
    }

    public Path save(Flow flow) {
        Path file = flowFile(flow.name());
        FlowDocuments.write(flow, file);
        return file;
    }

    public List<String> list() {
        List<String> out = new ArrayList<>();
        if (!Files.isDirectory(config.flowsRoot())) {
            return out;
        }
        try (Stream<Path> files = Files.list(config.flowsRoot())) {
            files.filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .forEach(p -> out.add(FlowDocuments.read(p).name()));
        } catch (IOException e) {
            throw new RuntimeException("Failed to list flows in " + config.flowsRoot(), e);
        }
        return out;
    }

    /**
     * Copies the current document of {@code flow} into the published area. The
     * working copy is written first when it does not exist yet.
     */
    public Path publish(Flow flow) {
        Path source = flowFile(flow.name());
        if (!Files.exists(source)) {
            save(flow);
        }
        Path target = publishedFile(flow.name());
        try {
            Files.createDirectories(target.getParent());
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            return target;
        } catch (IOException e) {
            throw new RuntimeException("Failed to publish flow: " + flow.name(), e);
        }
    }

    public Approval approve(Flow flow, String role) {
        Approval approval = new Approval(
                flow.name(),
                flow.version(),
                versionHash(flow),
                role,
                Instant.now().toString()
        );
        Path file = approvalFile(flow.name());
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, Jsons.toJson(approval), StandardCharsets.UTF_8);
            return approval;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write approval: " + file, e);
        }
    }

    public Optional<Approval> approval(String name) {
        Path file = approvalFile(name);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Jsons.mapper().readValue(Files.readString(file, StandardCharsets.UTF_8), Approval.class));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read approval: " + file, e);
        }
    }

    public static String versionHash(Flow flow) {
        return Hashing.sha256Hex(Jsons.toCompactJson(FlowDocuments.toNode(flow)));
    }

    public Map<String, Object> describe(String name) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("name", name);
        out.put("published", Files.exists(publishedFile(name)));
        out.put("approved", Files.exists(approvalFile(name)));
        return out;
    }

    static String fileName(String name) {
        StringBuilder sb = new StringBuilder(name.length() + 5);
        for (int i = 0; i < name.length(); i++) {
            char ch = name.charAt(i);
            boolean ok = Character.isLetterOrDigit(ch) || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '_');
        }
        return sb.append(".json").toString();
    }

    public record Approval(
            String flowName,
            String version,
            String versionHash,
            String role,
            String approvedAt
    ) {
    }
}
