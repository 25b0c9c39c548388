package com.phodal.aitrace.exporter;

/**
 * Receives the outcome of batch uploads, e.g. to count dropped spans.
 */
public interface ExportErrorReporter {

    ExportErrorReporter NOOP = new ExportErrorReporter() {
        @Override
        public void onBatchDropped(String exporterName, int batchSize, Throwable error) {
        }
    };

    /**
     * A batch was dropped after all upload attempts failed.
     */
    void onBatchDropped(String exporterName, int batchSize, Throwable error);

    default void onBatchExported(String exporterName, int batchSize) {
    }
}
