package io.deskflow.action;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code ${name}} placeholders with run variables. A string consisting
 * of a single placeholder yields the variable's value unchanged (a row object
 * stays a row object); placeholders embedded in longer text are stringified.
 * {@code $${...}} escapes a literal placeholder.
 */
public final class VariableResolver {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$?\\$\\{([A-Za-z_][A-Za-z0-9_.\\-]*)}");
    private static final Pattern WHOLE = Pattern.compile("^\\$\\{([A-Za-z_][A-Za-z0-9_.\\-]*)}$");

    private VariableResolver() {
    }

    public static Map<String, Object> resolveMap(Map<String, Object> input, ExecutionContext context) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (input == null) {
            return out;
        }
        input.forEach((key, value) -> out.put(key, resolveValue(value, context)));
        return out;
    }

    public static Object resolveValue(Object value, ExecutionContext context) {
        if (value instanceof String text) {
            return resolveString(text, context);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            map.forEach((key, item) -> out.put(String.valueOf(key), resolveValue(item, context)));
            return out;
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(resolveValue(item, context));
            }
            return out;
        }
        return value;
    }

    private static Object resolveString(String text, ExecutionContext context) {
        Matcher whole = WHOLE.matcher(text);
        if (whole.matches()) {
            return lookup(whole.group(1), context);
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String token = matcher.group();
            String replacement;
            if (token.startsWith("$$")) {
                replacement = token.substring(1);
            } else {
                Object found = lookup(matcher.group(1), context);
                replacement = found == null ? "" : String.valueOf(found);
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static Object lookup(String name, ExecutionContext context) {
        if (!context.has(name)) {
            throw new ActionException("unknown_variable", "Undefined variable: " + name);
        }
        return context.get(name).orElse(null);
    }
}
