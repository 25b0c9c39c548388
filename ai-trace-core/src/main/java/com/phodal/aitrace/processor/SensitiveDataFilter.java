package com.phodal.aitrace.processor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.aitrace.model.ExportedSpan;
import com.phodal.aitrace.util.ObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Redacts sensitive values from span attributes, metadata, input, output and error info.
 *
 * <p>Object keys are normalized by lower-casing and removing every non-alphanumeric
 * character, then compared for equality with the normalized sensitive field names.
 * {@code api_key}, {@code Api-Key} and {@code apiKey} all match {@code apikey}, while
 * {@code promptTokens} does not match {@code token}.</p>
 *
 * <p>If a field cannot be filtered it is replaced with
 * {@code {"error": {"processor": "sensitive-data-filter"}}}; the original value is never
 * passed through.</p>
 */
public class SensitiveDataFilter implements SpanProcessor {
    private static final Logger log = LoggerFactory.getLogger(SensitiveDataFilter.class);

    public static final String NAME = "sensitive-data-filter";
    public static final String DEFAULT_REDACTION_TOKEN = "[REDACTED]";
    public static final String CIRCULAR_MARKER = "[Circular Reference]";
    public static final List<String> DEFAULT_SENSITIVE_FIELDS = List.of(
            "password", "token", "secret", "key", "apikey", "auth", "authorization",
            "bearer", "jwt", "credential", "clientsecret", "privatekey", "refresh", "ssn");

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]");
    private static final int PARTIAL_KEEP = 3;

    private final Set<String> sensitiveFields;
    private final String redactionToken;
    private final RedactionStyle redactionStyle;
    private final ObjectMapper objectMapper;

    public SensitiveDataFilter() {
        this(DEFAULT_SENSITIVE_FIELDS, DEFAULT_REDACTION_TOKEN, RedactionStyle.FULL);
    }

    public SensitiveDataFilter(Collection<String> sensitiveFields) {
        this(sensitiveFields, DEFAULT_REDACTION_TOKEN, RedactionStyle.FULL);
    }

    public SensitiveDataFilter(Collection<String> sensitiveFields, String redactionToken,
                               RedactionStyle redactionStyle) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String field : sensitiveFields) {
            normalized.add(normalizeKey(field));
        }
        this.sensitiveFields = Collections.unmodifiableSet(normalized);
        this.redactionToken = redactionToken != null ? redactionToken : DEFAULT_REDACTION_TOKEN;
        this.redactionStyle = redactionStyle != null ? redactionStyle : RedactionStyle.FULL;
        this.objectMapper = ObjectMappers.create();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ExportedSpan process(ExportedSpan span) {
        return span.withPayload(
                asMap(tryFilter(span.attributes(), span, "attributes")),
                asMap(tryFilter(span.metadata(), span, "metadata")),
                tryFilter(span.input(), span, "input"),
                tryFilter(span.output(), span, "output"),
                asMap(tryFilter(span.errorInfo(), span, "errorInfo"))
        );
    }

    /**
     * Lower-case the key and strip every character that is not a letter or digit.
     */
    public static String normalizeKey(String key) {
        return NON_ALPHANUMERIC.matcher(key.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    public boolean isSensitive(String key) {
        return sensitiveFields.contains(normalizeKey(key));
    }

    public Set<String> getSensitiveFields() {
        return sensitiveFields;
    }

    private Object tryFilter(Object value, ExportedSpan span, String field) {
        if (value == null) {
            return null;
        }
        try {
            return deepFilter(value, Collections.newSetFromMap(new IdentityHashMap<>()));
        } catch (RuntimeException e) {
            log.error("Failed to filter {} of span {}, replacing the field: {}", field, span.id(), e.getMessage());
            return Map.of("error", Map.of("processor", NAME));
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    private Object deepFilter(Object value, Set<Object> seen) {
        if (value == null || value instanceof Number || value instanceof Boolean || value instanceof Character
                || value instanceof Enum<?> || value instanceof TemporalAccessor || value instanceof Date
                || value instanceof UUID) {
            return value;
        }
        if (value instanceof String text) {
            return filterJsonString(text, seen);
        }
        if (value.getClass().isArray() && value.getClass().getComponentType().isPrimitive()) {
            return value;
        }
        if (!(value instanceof Map<?, ?>) && !(value instanceof Collection<?>) && !(value instanceof Object[])) {
            // Unknown objects are converted so that their properties are filtered too.
            // A failing conversion propagates and replaces the whole field.
            return deepFilter(objectMapper.convertValue(value, Object.class), seen);
        }
        if (!seen.add(value)) {
            return CIRCULAR_MARKER;
        }
        try {
            return filterContainer(value, seen);
        } finally {
            seen.remove(value);
        }
    }

    private Object filterContainer(Object value, Set<Object> seen) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> filtered = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                Object child = entry.getValue();
                if (isSensitive(key) && !isContainer(child)) {
                    filtered.put(key, redact(child));
                } else {
                    filtered.put(key, deepFilter(child, seen));
                }
            }
            return filtered;
        }
        Collection<?> items = value instanceof Object[] array ? Arrays.asList(array) : (Collection<?>) value;
        List<Object> filtered = new ArrayList<>(items.size());
        for (Object item : items) {
            filtered.add(deepFilter(item, seen));
        }
        return filtered;
    }

    /**
     * Strings that hold a JSON object or array are filtered structurally and re-encoded.
     * Anything that does not parse is returned unchanged.
     */
    private Object filterJsonString(String text, Set<Object> seen) {
        String trimmed = text.trim();
        boolean looksLikeJson = (trimmed.startsWith("{") && trimmed.endsWith("}"))
                || (trimmed.startsWith("[") && trimmed.endsWith("]"));
        if (!looksLikeJson) {
            return text;
        }
        Object parsed;
        try {
            parsed = objectMapper.readValue(trimmed, Object.class);
        } catch (JsonProcessingException e) {
            return text;
        }
        Object filtered = deepFilter(parsed, seen);
        if (filtered.equals(parsed)) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(filtered);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot re-encode filtered JSON string", e);
        }
    }

    private static boolean isContainer(Object value) {
        return value instanceof Map<?, ?> || value instanceof Collection<?> || value instanceof Object[];
    }

    private Object redact(Object value) {
        if (redactionStyle == RedactionStyle.PARTIAL && value instanceof String text
                && text.length() > PARTIAL_KEEP * 2) {
            return text.substring(0, PARTIAL_KEEP) + "..." + text.substring(text.length() - PARTIAL_KEEP);
        }
        return redactionToken;
    }
}
