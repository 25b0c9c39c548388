package com.phodal.aitrace.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.aitrace.util.ObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Span storage backed by an append-only JSONL file.
 * Each line is a {@link StoredSpanEntry}; reading folds the updates into their spans.
 *
 * <p>Default storage path: {@code .ai-trace/spans.jsonl}</p>
 */
public class JsonlTracingStorage implements TracingStorage {
    private static final Logger log = LoggerFactory.getLogger(JsonlTracingStorage.class);

    public static final String DEFAULT_TRACE_DIR = ".ai-trace";
    public static final String DEFAULT_SPAN_FILE = "spans.jsonl";

    private final Path spanPath;
    private final ObjectMapper objectMapper;
    private final Object writeLock = new Object();

    private JsonlTracingStorage(Path spanPath) {
        this.spanPath = spanPath;
        this.objectMapper = ObjectMappers.create();
    }

    /**
     * Create a storage writing to {@code .ai-trace/spans.jsonl} under the workspace.
     */
    public static JsonlTracingStorage forWorkspace(Path workspacePath) {
        return new JsonlTracingStorage(workspacePath.resolve(DEFAULT_TRACE_DIR).resolve(DEFAULT_SPAN_FILE));
    }

    /**
     * Create a storage writing to a specific file.
     */
    public static JsonlTracingStorage forFile(Path filePath) {
        return new JsonlTracingStorage(filePath);
    }

    public Path getSpanPath() {
        return spanPath;
    }

    @Override
    public void createSpan(CreateSpanRecord record) throws IOException {
        append(List.of(StoredSpanEntry.create(record)));
    }

    @Override
    public void updateSpan(UpdateSpanRecord record) throws IOException {
        append(List.of(StoredSpanEntry.update(record)));
    }

    @Override
    public void batchCreateSpans(List<CreateSpanRecord> records) throws IOException {
        append(records.stream().map(StoredSpanEntry::create).toList());
    }

    private void append(List<StoredSpanEntry> entries) throws IOException {
        if (entries.isEmpty()) {
            return;
        }
        StringBuilder lines = new StringBuilder();
        for (StoredSpanEntry entry : entries) {
            lines.append(objectMapper.writeValueAsString(entry)).append(System.lineSeparator());
        }
        synchronized (writeLock) {
            ensureDirectoryExists();
            Files.writeString(
                spanPath,
                lines.toString(),
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND
            );
        }
        log.debug("Appended {} span entries to {}", entries.size(), spanPath);
    }

    private void ensureDirectoryExists() throws IOException {
        Path dir = spanPath.getParent();
        if (dir != null && !Files.exists(dir)) {
            Files.createDirectories(dir);
            log.info("Created trace directory: {}", dir);
        }
    }

    /**
     * Read all spans, with every update applied in file order.
     * Unparseable lines and updates of unknown spans are skipped with a warning.
     */
    public List<CreateSpanRecord> readSpans() throws IOException {
        if (!Files.exists(spanPath)) {
            return new ArrayList<>();
        }
        Map<String, CreateSpanRecord> spans = new LinkedHashMap<>();
        try (BufferedReader reader = Files.newBufferedReader(spanPath, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) continue;
                StoredSpanEntry entry;
                try {
                    entry = objectMapper.readValue(line, StoredSpanEntry.class);
                } catch (IOException e) {
                    log.warn("Failed to parse span entry at line {}: {}", lineNumber, e.getMessage());
                    continue;
                }
                if (entry.op() == StoredSpanEntry.Operation.CREATE && entry.create() != null) {
                    spans.put(entry.create().spanKey(), entry.create());
                } else if (entry.op() == StoredSpanEntry.Operation.UPDATE && entry.update() != null) {
                    UpdateSpanRecord update = entry.update();
                    CreateSpanRecord existing = spans.get(update.spanKey());
                    if (existing == null) {
                        log.warn("Update at line {} refers to unknown span {}", lineNumber, update.spanKey());
                        continue;
                    }
                    spans.put(update.spanKey(), existing.apply(update.updates()));
                }
            }
        }
        return new ArrayList<>(spans.values());
    }

    public List<CreateSpanRecord> readTrace(String traceId) throws IOException {
        return readSpans().stream()
            .filter(span -> span.traceId().equals(traceId))
            .toList();
    }

    public Optional<CreateSpanRecord> findSpan(String traceId, String spanId) throws IOException {
        return readSpans().stream()
            .filter(span -> span.traceId().equals(traceId) && span.spanId().equals(spanId))
            .findFirst();
    }

    /**
     * Get the number of entries (creates and updates) in the file.
     */
    public long getEntryCount() throws IOException {
        if (!Files.exists(spanPath)) {
            return 0;
        }
        try (Stream<String> lines = Files.lines(spanPath, StandardCharsets.UTF_8)) {
            return lines.filter(line -> !line.isBlank()).count();
        }
    }

    /**
     * Delete the span file (use with caution).
     */
    public void clear() throws IOException {
        synchronized (writeLock) {
            if (Files.exists(spanPath)) {
                Files.delete(spanPath);
                log.info("Cleared span store: {}", spanPath);
            }
        }
    }
}
