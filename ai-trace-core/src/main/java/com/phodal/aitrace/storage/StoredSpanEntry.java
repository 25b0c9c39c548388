package com.phodal.aitrace.storage;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One line of the JSONL span log: either a create or an update.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StoredSpanEntry(
    Operation op,
    CreateSpanRecord create,
    UpdateSpanRecord update
) {

    public enum Operation {
        CREATE,
        UPDATE
    }

    public static StoredSpanEntry create(CreateSpanRecord record) {
        return new StoredSpanEntry(Operation.CREATE, record, null);
    }

    public static StoredSpanEntry update(UpdateSpanRecord record) {
        return new StoredSpanEntry(Operation.UPDATE, null, record);
    }
}
