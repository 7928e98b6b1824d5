package io.validrun.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.validrun.config.ValidRunConfig;
import io.validrun.model.CaseManifest;
import io.validrun.model.RunStatus;
import io.validrun.resolve.ResolvedInputs;
import io.validrun.security.SecretRedactor;
import io.validrun.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Engine-owned files of one case run. The script may only write under {@code artifacts/} and
 * {@code control/}; nothing else it creates is read back.
 */
public final class CaseRunFolder {
    private final String runId;
    private final Path folder;

    private CaseRunFolder(String runId, Path folder) {
        this.runId = runId;
        this.folder = folder;
    }

    public static CaseRunFolder create(String runId, Path folder) {
        CaseRunFolder runFolder = new CaseRunFolder(runId, folder);
        try {
            Files.createDirectories(runFolder.artifactsDir());
            Files.createDirectories(runFolder.controlDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to create case run folder: " + folder, e);
        }
        return runFolder;
    }

    public static CaseRunFolder open(Path folder) {
        if (!Files.isDirectory(folder)) {
            throw new IllegalArgumentException("Run folder does not exist: " + folder);
        }
        return create(folder.getFileName().toString(), folder);
    }

    public String runId() {
        return runId;
    }

    public Path folder() {
        return folder;
    }

    public Path manifestFile() {
        return folder.resolve("manifest.json");
    }

    public Path paramsFile() {
        return folder.resolve("params.json");
    }

    public Path envFile() {
        return folder.resolve("env.json");
    }

    public Path resultFile() {
        return folder.resolve("result.json");
    }

    public Path stdoutLog() {
        return folder.resolve("stdout.log");
    }

    public Path stderrLog() {
        return folder.resolve("stderr.log");
    }

    public Path eventsFile() {
        return folder.resolve("events.jsonl");
    }

    public Path artifactsDir() {
        return folder.resolve("artifacts");
    }

    public Path controlDir() {
        return folder.resolve("control");
    }

    public Path sessionFile() {
        return folder.resolve("session.json");
    }

    public void writeManifestSnapshot(CaseManifest manifest, Path manifestPath, String ref) {
        ObjectNode snapshot = Jsons.mapper().valueToTree(manifest);
        ObjectNode source = snapshot.putObject("source");
        source.put("manifestPath", manifestPath.toString());
        if (ref != null) {
            source.put("ref", ref);
        }
        Jsons.writeAtomically(manifestFile(), snapshot);
    }

    public void writeParams(ResolvedInputs inputs) {
        Jsons.writeAtomically(paramsFile(), inputs.redactedJson());
    }

    public void writeEnvSnapshot(Map<String, String> environment, boolean elevated, SecretRedactor redactor) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("osName", System.getProperty("os.name"));
        snapshot.put("osVersion", System.getProperty("os.version"));
        snapshot.put("javaVersion", System.getProperty("java.version"));
        snapshot.put("runnerVersion", ValidRunConfig.RUNNER_VERSION);
        snapshot.put("isElevated", elevated);
        snapshot.put("env", redactor.redactEnvironment(environment));
        Jsons.writeAtomically(envFile(), snapshot);
    }

    /**
     * Writes result.json. A terminal result is never replaced; only a suspended
     * ({@code RebootRequired}) result may be superseded by its resumed outcome.
     */
    public void writeResult(CaseResult result) {
        if (Files.exists(resultFile())) {
            RunStatus existing = readResult().status();
            if (existing != RunStatus.REBOOT_REQUIRED) {
                throw new IllegalStateException("result.json of " + runId + " is final (" + existing.wireName() + ")");
            }
        }
        Jsons.writeAtomically(resultFile(), result);
    }

    public CaseResult readResult() {
        try {
            return Jsons.mapper().treeToValue(Jsons.readTree(resultFile()), CaseResult.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read result of run " + runId, e);
        }
    }

    public JsonNode readParams() {
        try {
            return Jsons.readTree(paramsFile());
        } catch (IOException e) {
            throw new RuntimeException("Failed to read params of run " + runId, e);
        }
    }
}
