package io.validrun.runner;

import io.validrun.security.SecretRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Copies one process stream into a log file line by line, masking secret values as it goes.
 */
final class StreamPump implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(StreamPump.class);

    private final String streamName;
    private final InputStream input;
    private final Path target;
    private final SecretRedactor redactor;

    StreamPump(String streamName, InputStream input, Path target, SecretRedactor redactor) {
        this.streamName = streamName;
        this.input = input;
        this.target = target;
        this.redactor = redactor;
    }

    @Override
    public void run() {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
             BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8,
                     StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE)) {
            String line;
            while ((line = reader.readLine()) != null) {
                writer.write(redactor.redactText(line));
                writer.newLine();
                writer.flush();
            }
        } catch (IOException e) {
            // Closed underneath us during forced cleanup; what was read is already on disk.
            log.debug("{} pump for {} stopped: {}", streamName, target, e.getMessage());
        }
    }
}
