package com.phodal.aitrace.storage;

import java.io.IOException;
import java.util.List;

/**
 * Long-term store for spans.
 */
public interface TracingStorage {

    void createSpan(CreateSpanRecord record) throws IOException;

    void updateSpan(UpdateSpanRecord record) throws IOException;

    /**
     * Create several spans at once. Stores with a native bulk write should override this.
     */
    default void batchCreateSpans(List<CreateSpanRecord> records) throws IOException {
        for (CreateSpanRecord record : records) {
            createSpan(record);
        }
    }
}
