package io.validrun.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.validrun.model.SuiteControls;
import io.validrun.security.SecretRedactor;
import io.validrun.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Files of a suite or plan run.
 */
public final class GroupRunFolder {
    private final String runId;
    private final Path folder;

    private GroupRunFolder(String runId, Path folder) {
        this.runId = runId;
        this.folder = folder;
    }

    public static GroupRunFolder create(String runId, Path folder) {
        try {
            Files.createDirectories(folder);
        } catch (IOException e) {
            throw new RuntimeException("Failed to create group run folder: " + folder, e);
        }
        return new GroupRunFolder(runId, folder);
    }

    public static GroupRunFolder open(Path folder) {
        if (!Files.isDirectory(folder)) {
            throw new IllegalArgumentException("Run folder does not exist: " + folder);
        }
        return new GroupRunFolder(folder.getFileName().toString(), folder);
    }

    public String runId() {
        return runId;
    }

    public Path folder() {
        return folder;
    }

    public Path childrenFile() {
        return folder.resolve("children.jsonl");
    }

    public Path resultFile() {
        return folder.resolve("result.json");
    }

    public Path eventsFile() {
        return folder.resolve("events.jsonl");
    }

    public Path sessionFile() {
        return folder.resolve("session.json");
    }

    public void writeManifestSnapshot(Object manifest, Path manifestPath) {
        ObjectNode snapshot = Jsons.mapper().valueToTree(manifest);
        snapshot.putObject("source").put("manifestPath", manifestPath.toString());
        Jsons.writeAtomically(folder.resolve("manifest.json"), snapshot);
    }

    public void writeControls(SuiteControls controls) {
        Jsons.writeAtomically(folder.resolve("controls.json"), controls.resolved());
    }

    public void writeEnvironment(Map<String, String> environment, SecretRedactor redactor) {
        Jsons.writeAtomically(folder.resolve("environment.json"), Map.of("env", redactor.redactEnvironment(environment)));
    }

    public void writeRunRequest(JsonNode runRequest, SecretRedactor redactor) {
        if (runRequest == null || runRequest.isNull()) {
            return;
        }
        Jsons.writeAtomically(folder.resolve("runRequest.json"), redactor.redactJson(runRequest));
    }

    public synchronized void appendChild(ChildEntry entry) {
        try {
            Files.writeString(childrenFile(), Jsons.toCompactJson(entry) + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to append child entry to " + childrenFile(), e);
        }
    }

    public List<ChildEntry> readChildren() {
        List<ChildEntry> out = new ArrayList<>();
        if (!Files.exists(childrenFile())) {
            return out;
        }
        try {
            for (String line : Files.readAllLines(childrenFile(), StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    out.add(Jsons.mapper().readValue(line, ChildEntry.class));
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to read " + childrenFile(), e);
        }
        return out;
    }

    public void writeResult(GroupResult result) {
        Jsons.writeAtomically(resultFile(), result);
    }

    public GroupResult readResult() {
        try {
            return Jsons.mapper().treeToValue(Jsons.readTree(resultFile()), GroupResult.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read result of run " + runId, e);
        }
    }
}
