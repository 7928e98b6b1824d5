package io.validrun.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import io.validrun.model.CaseManifest;
import io.validrun.model.PlanManifest;
import io.validrun.model.SuiteManifest;
import io.validrun.util.Jsons;

import java.io.IOException;
import java.nio.file.Path;

public final class ManifestLoader {
    public static final String CASE_MANIFEST = "test.manifest.json";
    public static final String SUITE_MANIFEST = "suite.manifest.json";
    public static final String PLAN_MANIFEST = "plan.manifest.json";

    private ManifestLoader() {
    }

    public static CaseManifest loadCase(Path file) throws IOException {
        CaseManifest manifest = bind(file, CaseManifest.class);
        requireIdentity(file, manifest.id(), manifest.version());
        return manifest;
    }

    public static SuiteManifest loadSuite(Path file) throws IOException {
        SuiteManifest manifest = bind(file, SuiteManifest.class);
        requireIdentity(file, manifest.id(), manifest.version());
        return manifest;
    }

    public static PlanManifest loadPlan(Path file) throws IOException {
        PlanManifest manifest = bind(file, PlanManifest.class);
        requireIdentity(file, manifest.id(), manifest.version());
        return manifest;
    }

    private static <T> T bind(Path file, Class<T> type) throws IOException {
        JsonNode root = Jsons.readTree(file);
        if (root == null || !root.isObject()) {
            throw new IOException("Manifest root must be a JSON object: " + file);
        }
        try {
            return Jsons.mapper().treeToValue(root, type);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid manifest " + file + ": " + e.getMessage(), e);
        }
    }

    private static void requireIdentity(Path file, String id, String version) throws IOException {
        if (id == null || id.isBlank() || version == null || version.isBlank()) {
            throw new IOException("Manifest is missing id or version: " + file);
        }
        if (id.contains("@") || version.contains("@")) {
            throw new IOException("Manifest id and version cannot contain '@': " + file);
        }
    }
}
