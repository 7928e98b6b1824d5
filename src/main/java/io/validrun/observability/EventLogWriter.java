package io.validrun.observability;

import io.validrun.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends diagnostic events to a run's events.jsonl.
 *
 * <p>Best effort only: statuses never depend on this file, so a failed write is logged and dropped.
 */
public final class EventLogWriter {
    private static final Logger log = LoggerFactory.getLogger(EventLogWriter.class);

    private final Path eventsFile;

    public EventLogWriter(Path eventsFile) {
        this.eventsFile = eventsFile;
    }

    public Path eventsFile() {
        return eventsFile;
    }

    public void info(String code, String message, Map<String, Object> data) {
        write("info", code, message, data);
    }

    public void warning(String code, String message, Map<String, Object> data) {
        write("warning", code, message, data);
    }

    public void error(String code, String message, Map<String, Object> data) {
        write("error", code, message, data);
    }

    private synchronized void write(String level, String code, String message, Map<String, Object> data) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("level", level);
        row.put("code", code);
        row.put("message", message);
        if (data != null && !data.isEmpty()) {
            row.put("data", data);
        }
        try {
            Files.writeString(eventsFile, Jsons.toCompactJson(row) + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException | RuntimeException e) {
            log.warn("Dropped event {} for {}: {}", code, eventsFile, e.getMessage());
        }
    }
}
