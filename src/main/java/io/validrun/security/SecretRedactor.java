package io.validrun.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.validrun.util.Jsons;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scrubs known secret values and secret-looking keys from snapshots and captured text.
 */
public final class SecretRedactor {
    public static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "apikey", "api_key", "credential"
    );
    // Shorter secrets only match as a whole token.
    static final int MIN_SUBSTRING_LENGTH = 4;
    private static final String MASK_REPLACEMENT = Matcher.quoteReplacement(MASK);

    private final List<Pattern> secretPatterns;

    public SecretRedactor(Collection<String> secretValues) {
        List<String> values = new ArrayList<>();
        if (secretValues != null) {
            for (String value : secretValues) {
                if (value != null && !value.isEmpty() && !values.contains(value)) {
                    values.add(value);
                }
            }
        }
        // Longest first so a secret containing another secret is masked whole.
        values.sort(Comparator.comparingInt(String::length).reversed());
        this.secretPatterns = values.stream().map(SecretRedactor::patternFor).toList();
    }

    private static Pattern patternFor(String secret) {
        String quoted = Pattern.quote(secret);
        if (secret.length() >= MIN_SUBSTRING_LENGTH) {
            return Pattern.compile(quoted);
        }
        return Pattern.compile("(?<![\\p{Alnum}_])" + quoted + "(?![\\p{Alnum}_])");
    }

    public static SecretRedactor none() {
        return new SecretRedactor(List.of());
    }

    public boolean isEmpty() {
        return secretPatterns.isEmpty();
    }

    public String redactText(String text) {
        if (text == null || secretPatterns.isEmpty()) {
            return text;
        }
        String out = text;
        for (Pattern secret : secretPatterns) {
            out = secret.matcher(out).replaceAll(MASK_REPLACEMENT);
        }
        return out;
    }

    /**
     * Environment snapshot: values equal to a secret or under a sensitive-looking key are masked.
     */
    public Map<String, String> redactEnvironment(Map<String, String> environment) {
        Map<String, String> out = new LinkedHashMap<>();
        if (environment == null) {
            return out;
        }
        for (Map.Entry<String, String> entry : environment.entrySet()) {
            String value = entry.getValue();
            if (isSensitiveKey(entry.getKey()) || containsSecret(value)) {
                out.put(entry.getKey(), MASK);
            } else {
                out.put(entry.getKey(), value);
            }
        }
        return out;
    }

    public JsonNode redactJson(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                out.set(entry.getKey(), redactJson(entry.getValue()));
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(redactJson(value));
            }
            return out;
        }
        if (input.isTextual() && containsSecret(input.asText())) {
            return Jsons.mapper().getNodeFactory().textNode(redactText(input.asText()));
        }
        return input;
    }

    private boolean containsSecret(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (Pattern secret : secretPatterns) {
            if (secret.matcher(value).find()) {
                return true;
            }
        }
        return false;
    }

    static boolean isSensitiveKey(String rawKey) {
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
}
