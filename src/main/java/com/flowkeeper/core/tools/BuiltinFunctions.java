package com.flowkeeper.core.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowkeeper.core.agent.ToolExecutionException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * Function tools every agent can be given, selected by {@code config.functionName}.
 */
@Component
public class BuiltinFunctions {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final DateTimeFormatter US_DATE_TIME =
            DateTimeFormatter.ofPattern("M/d/yyyy, h:mm:ss a", Locale.US);
    private static final DateTimeFormatter US_DATE = DateTimeFormatter.ofPattern("M/d/yyyy", Locale.US);
    private static final DateTimeFormatter US_TIME = DateTimeFormatter.ofPattern("h:mm:ss a", Locale.US);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public BuiltinFunctions(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    BuiltinFunctions(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @throws ToolExecutionException for an unknown function or invalid arguments
     */
    public JsonNode invoke(String functionName, ObjectNode args) {
        if (functionName == null) {
            throw new ToolExecutionException("Function tool missing functionName in config");
        }
        return switch (functionName) {
            case "get_current_time" -> currentTime(args);
            case "format_date" -> formatDate(args);
            case "parse_json" -> parseJson(args);
            case "validate_email" -> validateEmail(args);
            case "generate_random_number" -> randomNumber(args);
            case "generate_uuid" -> objectMapper.createObjectNode().put("uuid", UUID.randomUUID().toString());
            case "encode_base64" -> encodeBase64(args);
            case "decode_base64" -> decodeBase64(args);
            case "hash_text" -> hashText(args);
            default -> throw new ToolExecutionException("Unknown function: " + functionName);
        };
    }

    private ObjectNode currentTime(ObjectNode args) {
        String timezone = args.path("timezone").isTextual() ? args.get("timezone").asText() : "UTC";
        ZoneId zone;
        try {
            zone = ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new ToolExecutionException("Invalid timezone: " + timezone, e);
        }
        Instant now = clock.instant();
        ObjectNode result = objectMapper.createObjectNode();
        result.put("timestamp", DateTimeFormatter.ISO_INSTANT.format(now));
        result.put("timezone", timezone);
        result.put("unix", now.getEpochSecond());
        result.put("formatted", US_DATE_TIME.format(now.atZone(zone)));
        return result;
    }

    private ObjectNode formatDate(ObjectNode args) {
        JsonNode input = args.get("date");
        String format = args.path("format").isTextual() ? args.get("format").asText() : "ISO";
        Instant date;
        if (input != null && input.isTextual()) {
            date = parseDate(input.asText());
        } else if (input != null && input.isNumber()) {
            date = Instant.ofEpochMilli(input.asLong());
        } else {
            date = clock.instant();
        }
        OffsetDateTime utc = date.atOffset(ZoneOffset.UTC);
        String formatted = switch (format) {
            case "UTC" -> DateTimeFormatter.RFC_1123_DATE_TIME.format(utc);
            case "locale" -> US_DATE_TIME.format(utc);
            case "date" -> US_DATE.format(utc);
            case "time" -> US_TIME.format(utc);
            default -> DateTimeFormatter.ISO_INSTANT.format(date);
        };
        ObjectNode result = objectMapper.createObjectNode();
        result.put("formatted", formatted);
        result.put("timestamp", DateTimeFormatter.ISO_INSTANT.format(date));
        return result;
    }

    /** Accepts ISO dates ({@code 2024-05-01}) and ISO date-times with or without an offset; no offset means UTC. */
    private static Instant parseDate(String text) {
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return DateTimeFormatter.ISO_DATE_TIME.parse(text, t -> t.isSupported(ChronoField.OFFSET_SECONDS)
                    ? OffsetDateTime.from(t).toInstant()
                    : LocalDateTime.from(t).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            throw new ToolExecutionException("Invalid date input", e);
        }
    }

    private ObjectNode parseJson(ObjectNode args) {
        String json = requireText(args, "json", "parseJson");
        ObjectNode result = objectMapper.createObjectNode();
        try {
            result.put("success", true);
            result.set("data", objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            result.removeAll();
            result.put("success", false);
            result.put("error", e.getOriginalMessage());
        }
        return result;
    }

    private ObjectNode validateEmail(ObjectNode args) {
        String email = requireText(args, "email", "validateEmail");
        boolean valid = EMAIL.matcher(email).matches();
        ObjectNode result = objectMapper.createObjectNode();
        result.put("email", email);
        result.put("isValid", valid);
        result.put("reason", valid ? "Valid email format" : "Invalid email format");
        return result;
    }

    private ObjectNode randomNumber(ObjectNode args) {
        long min = args.path("min").isNumber() ? args.get("min").asLong() : 0;
        long max = args.path("max").isNumber() ? args.get("max").asLong() : 100;
        if (max < min) {
            throw new ToolExecutionException("generateRandomNumber requires min <= max");
        }
        ObjectNode result = objectMapper.createObjectNode();
        result.put("number", ThreadLocalRandom.current().nextLong(min, max + 1));
        result.put("min", min);
        result.put("max", max);
        return result;
    }

    private ObjectNode encodeBase64(ObjectNode args) {
        String text = requireText(args, "text", "encodeBase64");
        ObjectNode result = objectMapper.createObjectNode();
        result.put("original", text);
        result.put("encoded", Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8)));
        return result;
    }

    private ObjectNode decodeBase64(ObjectNode args) {
        String encoded = requireText(args, "encoded", "decodeBase64");
        ObjectNode result = objectMapper.createObjectNode();
        result.put("encoded", encoded);
        try {
            result.put("decoded", new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            throw new ToolExecutionException("Invalid base64 string", e);
        }
        return result;
    }

    private ObjectNode hashText(ObjectNode args) {
        String text = requireText(args, "text", "hashText");
        String algorithm = args.path("algorithm").isTextual() ? args.get("algorithm").asText() : "sha256";
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance(javaAlgorithm(algorithm));
        } catch (NoSuchAlgorithmException e) {
            throw new ToolExecutionException("Hashing error: unsupported algorithm " + algorithm, e);
        }
        ObjectNode result = objectMapper.createObjectNode();
        result.put("text", text);
        result.put("algorithm", algorithm);
        result.put("hash", HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8))));
        return result;
    }

    /** Maps names like {@code sha256} or {@code md5} to JCA names. */
    static String javaAlgorithm(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.startsWith("sha") && !lower.contains("-") && lower.length() > 3) {
            String bits = lower.substring(3);
            return bits.equals("1") ? "SHA-1" : "SHA-" + bits;
        }
        return name.toUpperCase(Locale.ROOT);
    }

    private static String requireText(ObjectNode args, String field, String function) {
        JsonNode value = args.get(field);
        if (value == null || !value.isTextual()) {
            throw new ToolExecutionException(function + " requires '" + field + "' string argument");
        }
        return value.asText();
    }
}
