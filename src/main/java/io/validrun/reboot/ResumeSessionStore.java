package io.validrun.reboot;

import io.validrun.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

public final class ResumeSessionStore {
    public static final String FILE_NAME = "session.json";

    private ResumeSessionStore() {
    }

    public static Path sessionFile(Path runFolder) {
        return runFolder.resolve(FILE_NAME);
    }

    public static void save(Path runFolder, ResumeSession session) {
        Jsons.writeAtomically(sessionFile(runFolder), session);
    }

    public static Optional<ResumeSession> load(Path runFolder) {
        Path file = sessionFile(runFolder);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Jsons.mapper().treeToValue(Jsons.readTree(file), ResumeSession.class));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read resume session: " + file, e);
        }
    }
}
