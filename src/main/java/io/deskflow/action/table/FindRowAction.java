package io.deskflow.action.table;

import io.deskflow.action.Action;
import io.deskflow.action.ActionException;
import io.deskflow.action.ActionParams;
import io.deskflow.action.ExecutionContext;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Returns the first row matching the criteria, or every match with {@code all=true}.
 * Criteria come from {@code criteria} (map), {@code query} (text form) or, failing
 * both, the remaining params.
 */
public final class FindRowAction implements Action {
    public static final String NAME = "table.find_row";
    private static final Set<String> RESERVED = Set.of("criteria", "query", "all");

    private final TableBackend backend;

    public FindRowAction(TableBackend backend) {
        this.backend = backend;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Object execute(Map<String, Object> selector, Map<String, Object> params, ExecutionContext context) {
        ActionParams p = ActionParams.of(name(), params);
        TableQuery query = query(p, params);
        List<TableRow> matches;
        try {
            matches = backend.rows(selector).stream().filter(query::matches).toList();
        } catch (RuntimeException e) {
            throw ActionException.backend(name(), e);
        }
        if (matches.isEmpty()) {
            throw new ActionException("row_not_found", "no row matches " + query);
        }
        return p.bool("all", false) ? matches : matches.get(0);
    }

    private TableQuery query(ActionParams p, Map<String, Object> params) {
        try {
            if (p.raw("criteria") instanceof Map<?, ?> raw) {
                Map<String, Object> criteria = new LinkedHashMap<>();
                raw.forEach((k, v) -> criteria.put(String.valueOf(k), v));
                return nonEmpty(TableQuery.of(criteria));
            }
            if (p.has("query")) {
                return TableQuery.parse(p.requireString("query"));
            }
            Map<String, Object> rest = new LinkedHashMap<>(params);
            rest.keySet().removeAll(RESERVED);
            return nonEmpty(TableQuery.of(rest));
        } catch (IllegalArgumentException e) {
            throw ActionException.invalidParams(name(), e.getMessage());
        }
    }

    private static TableQuery nonEmpty(TableQuery query) {
        if (query.isEmpty()) {
            throw new IllegalArgumentException("missing 'criteria'");
        }
        return query;
    }
}
