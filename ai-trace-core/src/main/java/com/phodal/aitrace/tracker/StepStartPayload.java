package com.phodal.aitrace.tracker;

import java.util.List;
import java.util.Map;

/**
 * Data carried by a {@code step-start} chunk.
 *
 * @param request the provider request sent for this step
 * @param messageId id of the response message, if known
 * @param warnings provider warnings raised before the call
 */
public record StepStartPayload(Object request, String messageId, List<Object> warnings) {

    @SuppressWarnings("unchecked")
    public static StepStartPayload fromMap(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return null;
        }
        Object warnings = payload.get("warnings");
        Object messageId = payload.get("messageId");
        return new StepStartPayload(
                payload.get("request"),
                messageId != null ? messageId.toString() : null,
                warnings instanceof List<?> ? (List<Object>) warnings : null
        );
    }
}
