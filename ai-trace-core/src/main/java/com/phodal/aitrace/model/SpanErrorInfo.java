package com.phodal.aitrace.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Error details attached to a span that failed.
 *
 * @param message human readable error message
 * @param id stable error identifier, if the failing component provides one
 * @param domain subsystem that raised the error (e.g. {@code AGENT}, {@code TOOL})
 * @param category {@code USER}, {@code SYSTEM} or {@code THIRD_PARTY}
 * @param details extra structured context
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SpanErrorInfo(
    String message,
    String id,
    String domain,
    String category,
    Map<String, Object> details
) {

    public static SpanErrorInfo of(String message) {
        return new SpanErrorInfo(message, null, null, null, null);
    }

    /**
     * Build error info from a throwable; the class name becomes the id.
     */
    public static SpanErrorInfo from(Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new SpanErrorInfo(message, error.getClass().getName(), null, null, null);
    }

    public Map<String, Object> toMap() {
        return Attributes.create()
                .put("message", message)
                .put("id", id)
                .put("domain", domain)
                .put("category", category)
                .put("details", details)
                .toMap();
    }
}
