package io.forthic.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ExecutionLog {
    private static final ObjectMapper COMPACT_MAPPER = new ObjectMapper().findAndRegisterModules();
    private final Path logFile;

    public ExecutionLog(Path logFile) {
        this.logFile = logFile;
        try {
            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(logFile)) {
                try {
                    Files.createFile(logFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize execution log file: " + logFile, e);
        }
    }

    public Path file() {
        return logFile;
    }

    public synchronized void log(ExecutionEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("operation", event.operation());
        row.put("words", event.words());
        row.put("stack_depth", event.stackDepth());
        row.put("result", event.result());
        row.put("error_type", event.errorType());
        row.put("duration_ms", event.durationMs());
        String line = toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(logFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write execution log", e);
        }
    }

    private String toCompactJson(Map<String, Object> row) {
        try {
            return COMPACT_MAPPER.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize execution log row", e);
        }
    }

    public record ExecutionEvent(
            String operation,
            List<String> words,
            int stackDepth,
            String result,
            String errorType,
            long durationMs
    ) {
        public static ExecutionEvent ok(String operation, List<String> words, int stackDepth, long durationMs) {
            return new ExecutionEvent(operation, words, stackDepth, "ok", null, durationMs);
        }

        public static ExecutionEvent failed(String operation, List<String> words, int stackDepth, String errorType, long durationMs) {
            return new ExecutionEvent(operation, words, stackDepth, "error", errorType, durationMs);
        }
    }
}
