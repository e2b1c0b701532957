package io.mcoda.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcoda.context.ContentRedactor;
import io.mcoda.util.Jsons;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Replaces every match of a configured pattern in lane content with {@code <redacted>}.
 *
 * <p>With heuristics enabled it also redacts values of {@code key=value} / {@code key: value} pairs
 * whose key looks sensitive and long opaque mixed-case alphanumeric tokens of 32 or more characters.
 * Both also hit ordinary source code, so they are off unless asked for.
 */
public final class PatternRedactor implements ContentRedactor {
    public static final String MARKER = "<redacted>";
    private static final String JSON_MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential"
    );
    private static final Pattern ASSIGNMENT = Pattern.compile(
            "(?i)\\b([A-Za-z0-9_\\-]*(?:password|passwd|secret|token|apikey|api_key|credential)[A-Za-z0-9_\\-]*)"
                    + "(\\s*[:=]\\s*)(\"[^\"]*\"|'[^']*'|[^\\s,;]+)");
    private static final Pattern OPAQUE_TOKEN = Pattern.compile(
            "(?<![A-Za-z0-9+=_\\-])(?=[A-Za-z0-9+=_\\-]*[0-9])(?=[A-Za-z0-9+=_\\-]*[a-z])(?=[A-Za-z0-9+=_\\-]*[A-Z])"
                    + "[A-Za-z0-9+=_\\-]{32,}");

    private final List<Pattern> patterns;
    private final boolean heuristics;

    public PatternRedactor(List<String> redactPatterns) {
        this(redactPatterns, false);
    }

    public PatternRedactor(List<String> redactPatterns, boolean heuristics) {
        List<Pattern> compiled = new ArrayList<>();
        if (redactPatterns != null) {
            for (String raw : redactPatterns) {
                if (raw == null || raw.isBlank()) {
                    continue;
                }
                try {
                    compiled.add(Pattern.compile(raw));
                } catch (PatternSyntaxException e) {
                    throw new IllegalArgumentException("Invalid redact pattern: " + raw, e);
                }
            }
        }
        this.patterns = List.copyOf(compiled);
        this.heuristics = heuristics;
    }

    @Override
    public Redaction redact(String content) {
        if (content == null || content.isEmpty()) {
            return new Redaction(content == null ? "" : content, 0);
        }
        int count = 0;
        String output = content;
        for (Pattern pattern : patterns) {
            Counted counted = replaceAll(pattern.matcher(output), m -> MARKER);
            output = counted.text();
            count += counted.count();
        }
        if (!heuristics) {
            return new Redaction(output, count);
        }
        Counted assignments = replaceAll(ASSIGNMENT.matcher(output), m -> {
            if (m.group(3).equals(MARKER)) {
                return null;
            }
            return m.group(1) + m.group(2) + MARKER;
        });
        output = assignments.text();
        count += assignments.count();
        Counted tokens = replaceAll(OPAQUE_TOKEN.matcher(output), m -> MARKER);
        return new Redaction(tokens.text(), count + tokens.count());
    }

    /**
     * Copy of {@code input} with sensitive keys and opaque string values masked, for printing
     * stored payloads.
     */
    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                if (isSensitiveKey(entry.getKey())) {
                    out.put(entry.getKey(), JSON_MASK);
                } else {
                    out.set(entry.getKey(), masked(entry.getValue()));
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
        if (input.isTextual() && OPAQUE_TOKEN.matcher(input.asText("").trim()).matches()) {
            return Jsons.mapper().valueToTree(JSON_MASK);
        }
        return input;
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

    // A null replacement keeps the match as is and does not count.
    private static Counted replaceAll(Matcher matcher, Function<Matcher, String> replacement) {
        StringBuilder sb = new StringBuilder();
        int count = 0;
        while (matcher.find()) {
            String value = replacement.apply(matcher);
            if (value == null) {
                matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group()));
            } else {
                matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
                count++;
            }
        }
        matcher.appendTail(sb);
        return new Counted(sb.toString(), count);
    }

    private record Counted(String text, int count) {
    }
}
