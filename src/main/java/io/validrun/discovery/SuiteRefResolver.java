package io.validrun.discovery;

import io.validrun.model.CaseManifest;
import io.validrun.model.ErrorCodes;
import io.validrun.model.ValidationError;
import io.validrun.model.ValidationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Resolves a suite node's {@code ref} to a case folder under the cases root.
 *
 * <p>Containment is checked on the real path, so a symbolic link inside the root that points
 * outside of it is rejected even though the literal path looks contained.
 */
public final class SuiteRefResolver {
    private final Path casesRoot;

    public SuiteRefResolver(Path casesRoot) {
        this.casesRoot = casesRoot.toAbsolutePath().normalize();
    }

    public ResolvedCase resolve(String suiteIdentity, String nodeId, String ref) {
        if (ref == null || ref.isBlank()) {
            throw invalid(suiteIdentity, nodeId, ref, null, ErrorCodes.REF_NOT_FOUND, "ref is empty");
        }
        Path candidate;
        try {
            candidate = casesRoot.resolve(ref.trim()).normalize();
        } catch (InvalidPathException e) {
            throw invalid(suiteIdentity, nodeId, ref, null, ErrorCodes.REF_NOT_FOUND, "ref is not a valid path");
        }
        Path realRoot = realPathOrSelf(casesRoot);
        Path realCandidate = realPathOfNearestAncestor(candidate);
        if (!realCandidate.startsWith(realRoot)) {
            throw invalid(suiteIdentity, nodeId, ref, realCandidate, ErrorCodes.REF_OUT_OF_ROOT,
                    "ref resolves outside the cases root");
        }
        if (!Files.isDirectory(realCandidate)) {
            throw invalid(suiteIdentity, nodeId, ref, realCandidate, ErrorCodes.REF_NOT_FOUND,
                    "case folder does not exist");
        }
        Path manifestPath = realCandidate.resolve(ManifestLoader.CASE_MANIFEST);
        if (!Files.isRegularFile(manifestPath)) {
            throw invalid(suiteIdentity, nodeId, ref, realCandidate, ErrorCodes.REF_MISSING_MANIFEST,
                    "case folder has no " + ManifestLoader.CASE_MANIFEST);
        }
        try {
            return new ResolvedCase(ManifestLoader.loadCase(manifestPath), realCandidate, manifestPath);
        } catch (IOException | RuntimeException e) {
            throw invalid(suiteIdentity, nodeId, ref, realCandidate, ErrorCodes.REF_MISSING_MANIFEST,
                    "case manifest is unparsable: " + e.getMessage());
        }
    }

    private static Path realPathOrSelf(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            return path;
        }
    }

    /**
     * Real path of the deepest existing ancestor with the missing tail re-appended.
     */
    static Path realPathOfNearestAncestor(Path path) {
        Path existing = path;
        Path tail = null;
        while (existing != null && !Files.exists(existing)) {
            Path name = existing.getFileName();
            tail = tail == null ? name : name.resolve(tail);
            existing = existing.getParent();
        }
        if (existing == null) {
            return path;
        }
        Path real = realPathOrSelf(existing);
        return tail == null ? real : real.resolve(tail).normalize();
    }

    private static ValidationException invalid(
            String suiteIdentity,
            String nodeId,
            String ref,
            Path resolved,
            String reason,
            String message
    ) {
        return new ValidationException(ValidationError.of(
                ErrorCodes.SUITE_TEST_CASE_REF_INVALID,
                "Invalid test case ref '" + ref + "' in node " + nodeId + ": " + message,
                "reason", reason,
                "suite", suiteIdentity,
                "nodeId", nodeId,
                "ref", ref,
                "resolvedPath", resolved == null ? null : resolved.toString()
        ));
    }

    public record ResolvedCase(CaseManifest manifest, Path folder, Path manifestPath) {
    }
}
