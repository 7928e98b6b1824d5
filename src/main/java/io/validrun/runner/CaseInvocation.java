package io.validrun.runner;

import io.validrun.model.CaseManifest;
import io.validrun.model.Identity;
import io.validrun.resolve.ResolvedInputs;
import io.validrun.storage.CaseRunFolder;

import java.nio.file.Path;
import java.util.Map;

/**
 * Everything needed to execute one case once.
 *
 * @param environment layered plan/suite/request variables applied over the OS environment
 * @param phase       0 for a fresh run, the persisted next phase on resume
 * @param workingDir  optional sub-directory of the run folder to start the script in
 */
public record CaseInvocation(
        CaseRunFolder runFolder,
        CaseManifest manifest,
        Path caseFolder,
        Path manifestPath,
        String ref,
        String nodeId,
        ResolvedInputs inputs,
        Map<String, String> environment,
        int phase,
        Identity suite,
        Identity plan,
        String parentRunId,
        String workingDir
) {
    public CaseInvocation {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public boolean resumed() {
        return phase > 0;
    }
}
