package com.phodal.aitrace.exporter;

/**
 * Why a buffered exporter flushed.
 */
public enum FlushReason {
    SIZE,
    OVERFLOW,
    TIME,
    MANUAL,
    SHUTDOWN
}
