package io.deskflow.security;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.deskflow.util.Jsons;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Replaces secrets in step params, audit details and step logs before they are
 * written anywhere.
 *
 * <ul>
 *   <li>A key naming a credential is masked whatever its value.</li>
 *   <li>The {@code value} typed into a password field (a {@code fill} step whose
 *       {@code selector} targets one) is masked.</li>
 *   <li>Long opaque tokens are masked under any key.</li>
 * </ul>
 */
public final class SensitiveDataMasker {
    public static final String MASK = "***";
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final List<String> CREDENTIAL_KEYS = List.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential", "cookie"
    );
    private static final Pattern PASSWORD_FIELD = Pattern.compile(
            "type\\s*=\\s*['\"]?password|passw|\\b(pin|otp)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern OPAQUE_TOKEN = Pattern.compile("^[A-Za-z0-9+=_\\-]{24,}$");

    private SensitiveDataMasker() {
    }

    public static Map<String, Object> masked(Map<String, ?> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode tree = Jsons.mapper().valueToTree(input);
        return Jsons.mapper().convertValue(maskedTree(tree), MAP_TYPE);
    }

    public static JsonNode maskedTree(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            return maskObject(input);
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            input.forEach(item -> out.add(maskedTree(item)));
            return out;
        }
        if (input.isTextual() && isOpaqueToken(input.asText(""))) {
            return TextNode.valueOf(MASK);
        }
        return input;
    }

    static boolean isCredentialKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        return CREDENTIAL_KEYS.stream().anyMatch(key::contains);
    }

    static boolean targetsPasswordField(JsonNode selector) {
        return selector != null && selector.isTextual() && PASSWORD_FIELD.matcher(selector.asText()).find();
    }

    private static ObjectNode maskObject(JsonNode input) {
        boolean passwordField = targetsPasswordField(input.get("selector"));
        ObjectNode out = Jsons.mapper().createObjectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = input.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            if (isCredentialKey(key) || (passwordField && "value".equals(key))) {
                out.put(key, MASK);
            } else {
                out.set(key, maskedTree(field.getValue()));
            }
        }
        return out;
    }

    // Paths and URLs are long too but carry separators the token alphabet lacks.
    private static boolean isOpaqueToken(String value) {
        return OPAQUE_TOKEN.matcher(value.trim()).matches();
    }
}
