package io.validrun.storage;

import io.validrun.model.RunType;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Run ids look like {@code R-20260101120000-1a2b3c4d}; the prefix is R, S or P by run type.
 */
public final class RunIdFactory {
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);
    private static final int MAX_COLLISION_SUFFIX = 1000;

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public RunIdFactory() {
        this(Clock.systemUTC());
    }

    public RunIdFactory(Clock clock) {
        this.clock = clock;
    }

    public String newRunId(RunType type) {
        return type.runIdPrefix() + STAMP.format(clock.instant()) + "-" + String.format("%08x", random.nextInt());
    }

    /**
     * Creates a fresh folder for a new run id, appending {@code -1}, {@code -2}... on collision.
     * The returned id always equals the folder name.
     */
    public Allocation allocate(Path runsRoot, RunType type) {
        String base = newRunId(type);
        try {
            Files.createDirectories(runsRoot);
            for (int suffix = 0; suffix < MAX_COLLISION_SUFFIX; suffix++) {
                String runId = suffix == 0 ? base : base + "-" + suffix;
                Path folder = runsRoot.resolve(runId);
                try {
                    Files.createDirectory(folder);
                    return new Allocation(runId, folder);
                } catch (FileAlreadyExistsException ignored) {
                    // taken, try the next suffix
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to create run folder under " + runsRoot, e);
        }
        throw new IllegalStateException("Could not allocate a unique run folder for " + base);
    }

    public record Allocation(String runId, Path folder) {
    }
}
