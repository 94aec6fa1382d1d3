package io.deskflow.action;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-indexed action table. Listing and resolution read the same map, so an
 * action that is not listed cannot be resolved either.
 */
public final class ActionRegistry {
    public static final String DEFAULT_CATEGORY = "general";

    private final Map<String, Registration> actions = new ConcurrentHashMap<>();

    public void register(Action action) {
        register(DEFAULT_CATEGORY, action);
    }

    public void register(String category, Action action) {
        register(category, action.name(), action);
    }

    /**
     * Registers {@code action} under an additional name, for aliases such as
     * {@code find_row} for {@code table.find_row}.
     */
    public void register(String category, String name, Action action) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("action name cannot be empty");
        }
        String safeCategory = category == null || category.isBlank() ? DEFAULT_CATEGORY : category.trim();
        actions.put(name.trim(), new Registration(safeCategory, action));
    }

    public boolean disable(String name) {
        return name != null && actions.remove(name) != null;
    }

    public Optional<Action> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Registration registration = actions.get(name);
        return registration == null ? Optional.empty() : Optional.of(registration.action());
    }

    public Action resolve(String name) {
        return findByName(name).orElseThrow(() -> new UnknownActionException(name));
    }

    public Set<String> names() {
        return new TreeSet<>(actions.keySet());
    }

    public Map<String, List<String>> listActions() {
        Map<String, List<String>> out = new TreeMap<>();
        for (Map.Entry<String, Registration> entry : actions.entrySet()) {
            out.computeIfAbsent(entry.getValue().category(), ignored -> new ArrayList<>()).add(entry.getKey());
        }
        out.values().forEach(list -> list.sort(String::compareTo));
        return out;
    }

    private record Registration(String category, Action action) {
    }
}
