package io.trialforge.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trialforge.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keeps credentials out of audit rows and regret hints. Trial traces routinely echo environment
 * variables and request headers, so both structured details and free text are scrubbed.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential"
    );
    private static final Pattern ASSIGNMENT = Pattern.compile(
            "(?i)\\b([A-Za-z0-9_\\-]*(?:password|passwd|secret|token|apikey|api_key|credential)[A-Za-z0-9_\\-]*)\\s*([=:])\\s*(\\S+)"
    );
    private static final Pattern BEARER = Pattern.compile("(?i)\\bbearer\\s+[A-Za-z0-9+/=_\\-.]+");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                String key = entry.getKey();
                if (isSensitiveKey(key)) {
                    out.put(key, MASK);
                } else {
                    out.set(key, masked(entry.getValue()));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual()) {
            String text = input.asText("");
            if (likelySecretValue(text)) {
                return Jsons.mapper().valueToTree(MASK);
            }
            String scrubbed = maskText(text);
            return scrubbed.equals(text) ? input : Jsons.mapper().valueToTree(scrubbed);
        }
        return input;
    }

    /**
     * Masks {@code key=value} / {@code key: value} assignments of secret-looking keys and bearer
     * tokens inside free text. Everything else is left as is.
     */
    public static String maskText(String text) {
        if (text == null || text.isEmpty()) {
            return text == null ? "" : text;
        }
        String out = ASSIGNMENT.matcher(text).replaceAll("$1$2" + MASK);
        return BEARER.matcher(out).replaceAll("Bearer " + MASK);
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean likelySecretValue(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim();
        if (v.length() < 32) {
            return false;
        }
        // Long opaque strings mixing letters and digits are treated as tokens.
        return v.matches("^[A-Za-z0-9+/=\\-]{32,}$")
                && v.chars().anyMatch(Character::isDigit)
                && v.chars().anyMatch(Character::isLetter);
    }
}
