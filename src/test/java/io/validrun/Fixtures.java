package io.validrun;

import io.validrun.config.ValidRunConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

/**
 * Workspace layout shared by the tests: {@code assets/TestCases|TestSuites|TestPlans} and
 * {@code Runs} under one temp root, with {@code /bin/sh} standing in for the interpreter.
 */
public final class Fixtures {
    public static final String SCRIPT = "run.sh";

    private Fixtures() {
    }

    public static ValidRunConfig shellConfig(Path root) {
        return new ValidRunConfig(
                root.resolve("assets").resolve("TestCases"),
                root.resolve("assets").resolve("TestSuites"),
                root.resolve("assets").resolve("TestPlans"),
                root.resolve("Runs"),
                List.of("/bin/sh"),
                SCRIPT,
                Duration.ofSeconds(2),
                List.of()
        );
    }

    public static Path write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    /**
     * Case folder with a manifest and, when {@code script} is not null, a run.sh.
     */
    public static Path writeCase(ValidRunConfig config, String folder, String manifestJson, String script) throws IOException {
        Path dir = config.casesRoot().resolve(folder);
        write(dir.resolve("test.manifest.json"), manifestJson);
        if (script != null) {
            write(dir.resolve(SCRIPT), script);
        }
        return dir;
    }

    public static Path writeSuite(ValidRunConfig config, String folder, String manifestJson) throws IOException {
        return write(config.suitesRoot().resolve(folder).resolve("suite.manifest.json"), manifestJson);
    }

    public static Path writePlan(ValidRunConfig config, String folder, String manifestJson) throws IOException {
        return write(config.plansRoot().resolve(folder).resolve("plan.manifest.json"), manifestJson);
    }

    public static String caseManifest(String id, String version, String parametersJson) {
        return """
                {
                  "schemaVersion": "1.5.0",
                  "id": "%s",
                  "name": "%s",
                  "version": "%s",
                  "parameters": %s
                }
                """.formatted(id, id, version, parametersJson == null ? "[]" : parametersJson);
    }

    public static List<String> readLines(Path file) throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        return Files.readAllLines(file, StandardCharsets.UTF_8).stream().filter(l -> !l.isBlank()).toList();
    }

    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
