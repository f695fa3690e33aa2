package com.flowkeeper.core.nodes;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code ${path}} references against an execution context.
 * <p>
 * Paths use dots and brackets: {@code ${user.name}}, {@code ${users[0].name}},
 * {@code ${doc['content-type']}}. A reference that does not resolve is left in
 * the output verbatim. Objects and arrays are rendered as JSON.
 */
@Component
public class TemplateInterpolator {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");
    private static final Pattern BRACKET = Pattern.compile("\\[(?:'([^']+)'|\"([^\"]+)\"|(\\w+))]");

    private final ObjectMapper objectMapper;

    public TemplateInterpolator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String interpolate(String template, JsonNode context) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String replacement = resolve(context, matcher.group(1))
                    .map(this::render)
                    .orElse(matcher.group());
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Interpolates, then parses the result when it looks like a JSON object or
     * array. Falls back to a text node when it is not valid JSON.
     */
    public JsonNode interpolateToJson(String template, JsonNode context) {
        String interpolated = interpolate(template, context);
        String trimmed = interpolated.trim();
        boolean looksLikeJson = (trimmed.startsWith("{") && trimmed.endsWith("}"))
                || (trimmed.startsWith("[") && trimmed.endsWith("]"));
        if (looksLikeJson) {
            try {
                return objectMapper.readTree(trimmed);
            } catch (JsonProcessingException e) {
                return TextNode.valueOf(interpolated);
            }
        }
        return TextNode.valueOf(interpolated);
    }

    /**
     * Resolves a single reference, with or without the surrounding {@code ${ }}.
     */
    public Optional<JsonNode> resolveReference(String reference, JsonNode context) {
        if (reference == null) {
            return Optional.empty();
        }
        String path = reference.trim();
        if (path.startsWith("${") && path.endsWith("}")) {
            path = path.substring(2, path.length() - 1);
        }
        return resolve(context, path);
    }

    /**
     * Walks {@code path} from {@code root}. JSON null resolves to a null node;
     * a missing key or out-of-range index resolves to empty.
     */
    public Optional<JsonNode> resolve(JsonNode root, String path) {
        JsonNode current = root;
        for (String key : splitPath(path)) {
            if (current == null || current.isNull() || current.isMissingNode()) {
                return Optional.empty();
            }
            if (current.isArray()) {
                if (!key.chars().allMatch(Character::isDigit)) {
                    return Optional.empty();
                }
                current = current.get(Integer.parseInt(key));
            } else if (current.isObject()) {
                current = current.get(key);
            } else {
                return Optional.empty();
            }
        }
        return Optional.ofNullable(current);
    }

    static List<String> splitPath(String path) {
        String normalized = BRACKET.matcher(path.trim()).replaceAll(match -> {
            String key = match.group(1) != null ? match.group(1)
                    : match.group(2) != null ? match.group(2) : match.group(3);
            return Matcher.quoteReplacement("." + key);
        });
        List<String> keys = new ArrayList<>();
        for (String key : normalized.split("\\.")) {
            if (!key.isEmpty()) {
                keys.add(key);
            }
        }
        return keys;
    }

    private String render(JsonNode value) {
        if (value.isContainerNode()) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return value.toString();
            }
        }
        return value.isNull() ? "null" : value.asText();
    }
}
