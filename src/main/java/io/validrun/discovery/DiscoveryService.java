package io.validrun.discovery;

import io.validrun.config.ValidRunConfig;
import io.validrun.model.CaseManifest;
import io.validrun.model.ErrorCodes;
import io.validrun.model.Identity;
import io.validrun.model.PlanManifest;
import io.validrun.model.SuiteManifest;
import io.validrun.model.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Scans the case, suite and plan roots and indexes every manifest by identity.
 */
public final class DiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryService.class);

    private final Path casesRoot;
    private final Path suitesRoot;
    private final Path plansRoot;

    public DiscoveryService(ValidRunConfig config) {
        this(config.casesRoot(), config.suitesRoot(), config.plansRoot());
    }

    public DiscoveryService(Path casesRoot, Path suitesRoot, Path plansRoot) {
        this.casesRoot = casesRoot;
        this.suitesRoot = suitesRoot;
        this.plansRoot = plansRoot;
    }

    public DiscoveryResult discover() {
        List<ValidationError> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<Identity, Discovered<CaseManifest>> cases = scan(
                "testCase", casesRoot, ManifestLoader.CASE_MANIFEST, ManifestLoader::loadCase,
                CaseManifest::identity, errors, warnings);
        Map<Identity, Discovered<SuiteManifest>> suites = scan(
                "suite", suitesRoot, ManifestLoader.SUITE_MANIFEST, ManifestLoader::loadSuite,
                SuiteManifest::identity, errors, warnings);
        Map<Identity, Discovered<PlanManifest>> plans = scan(
                "plan", plansRoot, ManifestLoader.PLAN_MANIFEST, ManifestLoader::loadPlan,
                PlanManifest::identity, errors, warnings);
        log.info("Discovered {} cases, {} suites, {} plans ({} errors, {} warnings)",
                cases.size(), suites.size(), plans.size(), errors.size(), warnings.size());
        return new DiscoveryResult(cases, suites, plans, errors, warnings);
    }

    private <T> Map<Identity, Discovered<T>> scan(
            String kind,
            Path root,
            String fileName,
            Loader<T> loader,
            Function<T, Identity> identityOf,
            List<ValidationError> errors,
            List<String> warnings
    ) {
        Map<Identity, Discovered<T>> found = new LinkedHashMap<>();
        Map<Identity, List<Path>> duplicates = new LinkedHashMap<>();
        for (Path file : manifestFiles(root, fileName, warnings)) {
            T manifest;
            try {
                manifest = loader.load(file);
            } catch (IOException | RuntimeException e) {
                String warning = "Skipping unparsable " + kind + " manifest " + file + ": " + e.getMessage();
                log.warn(warning);
                warnings.add(warning);
                continue;
            }
            Identity identity = identityOf.apply(manifest);
            Discovered<T> existing = found.get(identity);
            if (existing == null) {
                found.put(identity, new Discovered<>(manifest, file));
            } else {
                duplicates.computeIfAbsent(identity, k -> new ArrayList<>(List.of(existing.manifestPath()))).add(file);
            }
        }
        for (Map.Entry<Identity, List<Path>> entry : duplicates.entrySet()) {
            List<String> paths = entry.getValue().stream().map(Path::toString).toList();
            log.error("Duplicate {} identity {} at {}", kind, entry.getKey(), paths);
            Map<String, Object> details = new HashMap<>();
            details.put("entityType", kind);
            details.put("identity", entry.getKey().toString());
            details.put("conflictPaths", paths);
            errors.add(new ValidationError(
                    ErrorCodes.DISCOVERY_DUPLICATE_IDENTITY,
                    "Duplicate " + kind + " identity " + entry.getKey() + " found in " + paths.size() + " manifests",
                    details
            ));
        }
        return found;
    }

    private static List<Path> manifestFiles(Path root, String fileName, List<String> warnings) {
        if (root == null || !Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.walk(root)) {
            return stream
                    .filter(p -> p.getFileName() != null && p.getFileName().toString().equalsIgnoreCase(fileName))
                    .filter(Files::isRegularFile)
                    .sorted()
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            String warning = "Failed to scan " + root + ": " + e.getMessage();
            log.warn(warning);
            warnings.add(warning);
            return List.of();
        }
    }

    @FunctionalInterface
    private interface Loader<T> {
        T load(Path file) throws IOException;
    }
}
