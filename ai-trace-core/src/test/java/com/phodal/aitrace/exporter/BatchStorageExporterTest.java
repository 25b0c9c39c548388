package com.phodal.aitrace.exporter;

import com.phodal.aitrace.fixtures.ManualBatchScheduler;
import com.phodal.aitrace.fixtures.MutableClock;
import com.phodal.aitrace.fixtures.TestSpans;
import com.phodal.aitrace.storage.CreateSpanRecord;
import com.phodal.aitrace.storage.InMemoryTracingStorage;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchStorageExporterTest {

    private final MutableClock clock = new MutableClock();
    private final ManualBatchScheduler scheduler = new ManualBatchScheduler(clock);

    @Test
    void shouldInsertEndedSpansInBulk() {
        BulkRecordingStorage storage = new BulkRecordingStorage();
        BatchStorageExporter exporter = new BatchStorageExporter(storage, BatchConfig.of(2, 5000, 3),
                scheduler, clock, ExportErrorReporter.NOOP);

        exporter.exportEvent(TestSpans.started("a"));
        exporter.exportEvent(TestSpans.ended("a"));
        exporter.exportEvent(TestSpans.ended("b"));

        assertEquals(1, storage.batches.size());
        assertEquals(List.of("a", "b"), storage.batches.get(0).stream().map(CreateSpanRecord::spanId).toList());
        assertEquals(clock.instant(), storage.batches.get(0).get(0).createdAt());
        assertEquals(2, storage.size());
    }

    @Test
    void shouldRetryFailedBulkInsert() {
        BulkRecordingStorage storage = new BulkRecordingStorage();
        storage.failuresLeft = 2;
        BatchConfig config = BatchConfig.of(20, 5000, 3).withRetryDelayMs(100);
        BatchStorageExporter exporter = new BatchStorageExporter(storage, config, scheduler, clock, ExportErrorReporter.NOOP);
        exporter.exportEvent(TestSpans.ended("a"));
        exporter.flush();

        scheduler.advance(100);
        assertTrue(storage.batches.isEmpty(), "Second retry waits twice the base delay");

        scheduler.advance(200);
        assertEquals(1, storage.batches.size());
    }

    @Test
    void shouldFlushRemainingSpansOnShutdown() {
        BulkRecordingStorage storage = new BulkRecordingStorage();
        BatchStorageExporter exporter = new BatchStorageExporter(storage, BatchConfig.DEFAULT, scheduler, clock,
                ExportErrorReporter.NOOP);
        exporter.exportEvent(TestSpans.ended("a"));

        exporter.shutdown();

        assertEquals(1, storage.size());
    }

    @Test
    void shouldBeDisabledWithoutStorage() {
        BatchStorageExporter exporter = new BatchStorageExporter(null, BatchConfig.DEFAULT, scheduler, clock,
                ExportErrorReporter.NOOP);

        exporter.exportEvent(TestSpans.ended("a"));

        assertFalse(exporter.isEnabled());
        assertEquals(0, exporter.getBufferSize());
    }

    private static class BulkRecordingStorage extends InMemoryTracingStorage {
        private final List<List<CreateSpanRecord>> batches = new ArrayList<>();
        private int failuresLeft;

        @Override
        public void batchCreateSpans(List<CreateSpanRecord> records) throws IOException {
            if (failuresLeft > 0) {
                failuresLeft--;
                throw new IOException("database locked");
            }
            batches.add(List.copyOf(records));
            for (CreateSpanRecord record : records) {
                createSpan(record);
            }
        }
    }
}
