package io.validrun.storage;

import io.validrun.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Owner of the global index.jsonl. One instance per process, passed to whoever finalizes a run.
 * Appends are serialized and flushed line by line; the file is never rewritten.
 */
public final class RunIndexWriter implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(RunIndexWriter.class);

    private final Path indexFile;
    private final Object lock = new Object();
    private BufferedWriter writer;

    private RunIndexWriter(Path indexFile, BufferedWriter writer) {
        this.indexFile = indexFile;
        this.writer = writer;
    }

    public static RunIndexWriter open(Path indexFile) {
        try {
            Files.createDirectories(indexFile.toAbsolutePath().getParent());
            BufferedWriter writer = Files.newBufferedWriter(indexFile, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            return new RunIndexWriter(indexFile, writer);
        } catch (IOException e) {
            throw new RuntimeException("Failed to open run index: " + indexFile, e);
        }
    }

    public Path indexFile() {
        return indexFile;
    }

    public void append(IndexEntry entry) {
        String line = Jsons.toCompactJson(entry);
        synchronized (lock) {
            if (writer == null) {
                throw new IllegalStateException("Run index is closed: " + indexFile);
            }
            try {
                writer.write(line);
                writer.newLine();
                writer.flush();
            } catch (IOException e) {
                throw new RuntimeException("Failed to append run index entry for " + entry.runId(), e);
            }
        }
        log.debug("Indexed run {} with status {}", entry.runId(), entry.status());
    }

    public void flush() {
        synchronized (lock) {
            if (writer == null) {
                return;
            }
            try {
                writer.flush();
            } catch (IOException e) {
                throw new RuntimeException("Failed to flush run index: " + indexFile, e);
            }
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (writer == null) {
                return;
            }
            try {
                writer.close();
            } catch (IOException e) {
                throw new RuntimeException("Failed to close run index: " + indexFile, e);
            } finally {
                writer = null;
            }
        }
    }
}
