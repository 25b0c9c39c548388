package com.phodal.aitrace.server.exporter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Team and project read from the payload of a JWT access token. The signature is not verified;
 * the collector does that.
 */
public record AccessTokenClaims(String teamId, String projectId) {

    public static AccessTokenClaims decode(String token, ObjectMapper objectMapper) {
        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Access token is not a JWT (expected 3 parts, got " + parts.length + ")");
        }
        try {
            byte[] payload = Base64.getUrlDecoder().decode(parts[1]);
            JsonNode claims = objectMapper.readTree(new String(payload, StandardCharsets.UTF_8));
            return new AccessTokenClaims(text(claims, "teamId"), text(claims, "projectId"));
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Cannot decode access token payload: " + e.getMessage(), e);
        }
    }

    private static String text(JsonNode claims, String field) {
        JsonNode value = claims.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }
}
