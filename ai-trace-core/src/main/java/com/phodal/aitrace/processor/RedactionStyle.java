package com.phodal.aitrace.processor;

/**
 * How a sensitive value is masked.
 */
public enum RedactionStyle {
    /**
     * Replace the whole value with the redaction token.
     */
    FULL,

    /**
     * Keep the first and last three characters of strings longer than six characters.
     */
    PARTIAL
}
