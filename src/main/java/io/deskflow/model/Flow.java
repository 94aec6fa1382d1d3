package io.deskflow.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed flow document. Instances are immutable: editing produces a new flow.
 *
 * <p>{@code roles} holds only the operations the document lists; a missing key
 * is distinct from an empty role set.
 */
public record Flow(
        String name,
        String version,
        String description,
        Map<FlowOperation, Set<String>> roles,
        Map<String, Object> inputs,
        Map<String, Object> variables,
        StepDefaults defaults,
        List<Step> steps
) {
    public Flow {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("flow name cannot be empty");
        }
        version = version == null || version.isBlank() ? "1.0" : version;
        description = description == null ? "" : description;
        EnumMap<FlowOperation, Set<String>> copiedRoles = new EnumMap<>(FlowOperation.class);
        if (roles != null) {
            roles.forEach((op, names) -> copiedRoles.put(op, Collections.unmodifiableSet(new LinkedHashSet<>(names))));
        }
        roles = Collections.unmodifiableMap(copiedRoles);
        inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        defaults = defaults == null ? StepDefaults.NONE : defaults;
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static Flow of(String name, List<Step> steps) {
        return new Flow(name, "1.0", "", Map.of(), Map.of(), Map.of(), StepDefaults.NONE, steps);
    }

    public Optional<Set<String>> rolesFor(FlowOperation operation) {
        return Optional.ofNullable(roles.get(operation));
    }

    public Flow withRoles(Map<FlowOperation, Set<String>> value) {
        return new Flow(name, version, description, value, inputs, variables, defaults, steps);
    }

    public Flow withDescription(String value) {
        return new Flow(name, version, value, roles, inputs, variables, defaults, steps);
    }

    public Flow withSteps(List<Step> value) {
        return new Flow(name, version, description, roles, inputs, variables, defaults, value);
    }

    public Flow withDefaults(StepDefaults value) {
        return new Flow(name, version, description, roles, inputs, variables, value, steps);
    }

    public Flow withVersion(String value) {
        return new Flow(name, value, description, roles, inputs, variables, defaults, steps);
    }
}
