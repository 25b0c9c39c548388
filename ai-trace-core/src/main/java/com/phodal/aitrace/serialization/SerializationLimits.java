package com.phodal.aitrace.serialization;

/**
 * Bounds applied by {@link BoundedSerializer}.
 *
 * @param maxDepth nesting depth below which values are replaced with a depth marker
 * @param maxStringLength maximum characters of any string, marker included
 * @param maxArrayLength maximum items of any list or array, marker included
 * @param maxObjectKeys maximum entries of any map, marker included
 * @param maxTotalChars maximum length of the final JSON text
 */
public record SerializationLimits(
    int maxDepth,
    int maxStringLength,
    int maxArrayLength,
    int maxObjectKeys,
    int maxTotalChars
) {

    public static final SerializationLimits DEFAULT = new SerializationLimits(8, 1024, 50, 50, 200_000);

    public SerializationLimits {
        if (maxDepth < 1 || maxStringLength < 1 || maxArrayLength < 1 || maxObjectKeys < 1 || maxTotalChars < 1) {
            throw new IllegalArgumentException("Serialization limits must be positive: maxDepth=" + maxDepth
                    + ", maxStringLength=" + maxStringLength + ", maxArrayLength=" + maxArrayLength
                    + ", maxObjectKeys=" + maxObjectKeys + ", maxTotalChars=" + maxTotalChars);
        }
    }

    public SerializationLimits withMaxStringLength(int maxStringLength) {
        return new SerializationLimits(maxDepth, maxStringLength, maxArrayLength, maxObjectKeys, maxTotalChars);
    }

    public SerializationLimits withMaxTotalChars(int maxTotalChars) {
        return new SerializationLimits(maxDepth, maxStringLength, maxArrayLength, maxObjectKeys, maxTotalChars);
    }
}
