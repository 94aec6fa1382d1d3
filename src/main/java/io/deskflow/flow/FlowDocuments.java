package io.deskflow.flow;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.deskflow.model.Flow;
import io.deskflow.model.FlowOperation;
import io.deskflow.model.OnError;
import io.deskflow.model.Step;
import io.deskflow.model.StepDefaults;
import io.deskflow.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads and writes flow documents.
 *
 * <pre>
 * {
 *   "version": "1",
 *   "meta": {"name": "invoice", "desc": "", "roles": {"edit": ["admin"], "run": ["ops"]}},
 *   "inputs": {"customer": "ACME"},
 *   "variables": {"count": {"type": "int", "value": 0}},
 *   "defaults": {"retry": 1, "timeoutMs": 30000},
 *   "steps": [{"id": "s1", "action": "open", "selector": {}, "params": {"url": "..."}, "out": "page",
 *              "retry": 2, "timeoutMs": 5000,
 *              "onError": {"recover": "scroll", "screenshot": true, "continue": false}}]
 * }
 * </pre>
 *
 * <p>{@code onError.recover} is either a step object or the name of an action run
 * without params.
 */
public final class FlowDocuments {
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private FlowDocuments() {
    }

    public static Flow read(Path file) {
        try {
            return parse(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read flow document: " + file, e);
        }
    }

    public static Flow parse(String json) {
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(json);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid flow document JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Flow document must be a JSON object");
        }
        JsonNode meta = root.path("meta");
        String name = meta.path("name").asText("");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Flow document is missing meta.name");
        }
        return new Flow(
                name,
                root.path("version").asText("1.0"),
                meta.path("desc").asText(""),
                parseRoles(meta.path("roles")),
                toMap(root.path("inputs")),
                parseVariables(root.path("variables")),
                parseDefaults(root.path("defaults")),
                parseSteps(root.path("steps"))
        );
    }

    public static void write(Flow flow, Path file) {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, toJson(flow), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write flow document: " + file, e);
        }
    }

    public static String toJson(Flow flow) {
        return Jsons.toJson(toNode(flow));
    }

    public static ObjectNode toNode(Flow flow) {
        ObjectNode root = Jsons.mapper().createObjectNode();
        root.put("version", flow.version());
        ObjectNode meta = root.putObject("meta");
        meta.put("name", flow.name());
        meta.put("desc", flow.description());
        ObjectNode roles = meta.putObject("roles");
        flow.roles().forEach((op, names) -> {
            ArrayNode arr = roles.putArray(op.key());
            names.forEach(arr::add);
        });
        root.set("inputs", Jsons.mapper().valueToTree(flow.inputs()));
        root.set("variables", Jsons.mapper().valueToTree(flow.variables()));
        StepDefaults defaults = flow.defaults();
        if (defaults.retry() != null || defaults.timeoutMs() != null) {
            ObjectNode node = root.putObject("defaults");
            putIfSet(node, defaults.retry(), defaults.timeoutMs());
        }
        ArrayNode steps = root.putArray("steps");
        for (Step step : flow.steps()) {
            steps.add(stepNode(step));
        }
        return root;
    }

    private static ObjectNode stepNode(Step step) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("id", step.id());
        node.put("action", step.action());
        node.set("selector", Jsons.mapper().valueToTree(step.selector()));
        node.set("params", Jsons.mapper().valueToTree(step.params()));
        if (step.out() != null) {
            node.put("out", step.out());
        }
        putIfSet(node, step.retry(), step.timeoutMs());
        OnError onError = step.onError();
        if (!onError.isEmpty()) {
            ObjectNode handler = node.putObject("onError");
            if (onError.continueRun()) {
                handler.put("continue", true);
            }
            if (onError.screenshot()) {
                handler.put("screenshot", true);
            }
            if (onError.recover() != null) {
                handler.set("recover", stepNode(onError.recover()));
            }
        }
        return node;
    }

    private static void putIfSet(ObjectNode node, Integer retry, Long timeoutMs) {
        if (retry != null) {
            node.put("retry", retry);
        }
        if (timeoutMs != null) {
            node.put("timeoutMs", timeoutMs);
        }
    }

    private static Map<FlowOperation, Set<String>> parseRoles(JsonNode node) {
        Map<FlowOperation, Set<String>> out = new EnumMap<>(FlowOperation.class);
        if (node == null || !node.isObject()) {
            return out;
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            FlowOperation op = FlowOperation.fromString(entry.getKey());
            Set<String> names = new LinkedHashSet<>();
            JsonNode value = entry.getValue();
            if (value.isArray()) {
                for (JsonNode role : value) {
                    String roleName = role.asText("").trim();
                    if (!roleName.isEmpty()) {
                        names.add(roleName);
                    }
                }
            } else if (value.isTextual() && !value.asText().isBlank()) {
                names.add(value.asText().trim());
            }
            out.put(op, names);
        }
        return out;
    }

    private static Map<String, Object> parseVariables(JsonNode node) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return out;
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode declared = entry.getValue();
            // {"type": ..., "value": ...} declarations keep only the default value.
            JsonNode value = declared.isObject() && declared.has("value") ? declared.get("value") : declared;
            out.put(entry.getKey(), Jsons.mapper().convertValue(value, Object.class));
        }
        return out;
    }

    private static List<Step> parseSteps(JsonNode node) {
        List<Step> steps = new ArrayList<>();
        if (node == null || node.isMissingNode() || node.isNull()) {
            return steps;
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("Flow steps must be an array");
        }
        Set<String> seen = new LinkedHashSet<>();
        for (JsonNode stepNode : node) {
            String id = stepNode.path("id").asText("");
            if (!seen.add(id)) {
                throw new IllegalArgumentException("Duplicate step id: " + id);
            }
            steps.add(parseStep(stepNode, id));
        }
        return steps;
    }

    private static Step parseStep(JsonNode node, String id) {
        return new Step(
                id,
                node.path("action").asText(""),
                toMap(node.path("selector")),
                toMap(node.path("params")),
                node.path("out").asText(null),
                optionalInt(node.path("retry"), id + ".retry"),
                optionalLong(node.path("timeoutMs"), id + ".timeoutMs"),
                parseOnError(node.path("onError"), id)
        );
    }

    private static OnError parseOnError(JsonNode node, String stepId) {
        if (node == null || !node.isObject()) {
            return OnError.NONE;
        }
        JsonNode recoverNode = node.path("recover");
        Step recover = null;
        String recoverId = stepId + ".recover";
        if (recoverNode.isTextual() && !recoverNode.asText().isBlank()) {
            recover = Step.of(recoverId, recoverNode.asText().trim(), Map.of());
        } else if (recoverNode.isObject()) {
            recover = parseStep(recoverNode, recoverNode.path("id").asText(recoverId));
        }
        return new OnError(node.path("continue").asBoolean(false), recover, node.path("screenshot").asBoolean(false));
    }

    private static StepDefaults parseDefaults(JsonNode node) {
        if (node == null || !node.isObject()) {
            return StepDefaults.NONE;
        }
        return new StepDefaults(optionalInt(node.path("retry"), "defaults.retry"),
                optionalLong(node.path("timeoutMs"), "defaults.timeoutMs"));
    }

    private static Integer optionalInt(JsonNode node, String field) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (!node.canConvertToInt()) {
            throw new IllegalArgumentException(field + " must be an integer");
        }
        return node.asInt();
    }

    private static Long optionalLong(JsonNode node, String field) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (!node.canConvertToLong()) {
            throw new IllegalArgumentException(field + " must be an integer");
        }
        return node.asLong();
    }

    private static Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new LinkedHashMap<>();
        }
        return Jsons.mapper().convertValue(node, MAP_TYPE);
    }
}
