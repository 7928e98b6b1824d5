package io.validrun.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.validrun.config.ValidRunConfig;
import io.validrun.discovery.DiscoveryResult;
import io.validrun.discovery.DiscoveryService;
import io.validrun.model.ErrorCodes;
import io.validrun.model.RunRequest;
import io.validrun.model.ValidationError;
import io.validrun.model.ValidationException;
import io.validrun.reboot.CommandRebootHandler;
import io.validrun.reboot.NoopRebootHandler;
import io.validrun.reboot.RebootHandler;
import io.validrun.reboot.RebootResumeController;
import io.validrun.runner.CancellationToken;
import io.validrun.runner.CaseRunner;
import io.validrun.security.SecretRedactor;
import io.validrun.storage.RunIdFactory;
import io.validrun.storage.RunIndexWriter;
import io.validrun.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for discovery, runs and resumes. Owns the run index for its lifetime.
 */
public final class RunEngine implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(RunEngine.class);

    private final ValidRunConfig config;
    private final Map<String, String> osEnvironment;
    private final ElevationCheck elevationCheck;
    private final CancellationToken cancellation;
    private final RebootResumeController rebootController;
    private final RunIdFactory runIds = new RunIdFactory();
    private RunIndexWriter index;

    public RunEngine(
            ValidRunConfig config,
            Map<String, String> osEnvironment,
            ElevationCheck elevationCheck,
            RebootHandler rebootHandler,
            CancellationToken cancellation
    ) {
        this.config = config;
        this.osEnvironment = osEnvironment == null ? Map.of() : Map.copyOf(osEnvironment);
        this.elevationCheck = elevationCheck;
        this.cancellation = cancellation;
        this.rebootController = new RebootResumeController(rebootHandler);
    }

    public static RunEngine create(ValidRunConfig config, CancellationToken cancellation) {
        RebootHandler handler = config.rebootCommand().isEmpty()
                ? new NoopRebootHandler()
                : new CommandRebootHandler(config.rebootCommand());
        return new RunEngine(config, System.getenv(), new SystemElevationCheck(), handler, cancellation);
    }

    public ValidRunConfig config() {
        return config;
    }

    public DiscoveryResult discover() {
        return new DiscoveryService(config).discover();
    }

    /**
     * Validates the whole request before anything executes, then walks the tree.
     *
     * @throws ValidationException when the request, the references or the inputs are invalid
     */
    public RunSummary run(RunRequest request) {
        ExecutionTree tree = new ExecutionPlanner(config, osEnvironment).plan(request, discover());
        boolean elevated = elevationCheck.isElevated();
        List<String> warnings = new ArrayList<>(PrivilegeChecker.check(tree, elevated));
        collectInputWarnings(tree, warnings);
        JsonNode requestJson = Jsons.mapper().valueToTree(request);
        log.info("Starting {} {}", request.runType().targetName(), request.targetIdentity());
        return walker(elevated).run(tree, requestJson, warnings);
    }

    /**
     * Continues a suspended run. A second resume of the same suspension aborts the run instead.
     */
    public RunSummary resume(String runId, String token) {
        if (runId == null || runId.isBlank() || !runId.equals(Path.of(runId).getFileName().toString())) {
            throw new ValidationException(ValidationError.of(
                    ErrorCodes.RESUME_SESSION_INVALID, "Invalid run id: " + runId, "runId", runId));
        }
        Path runFolder = config.runsRoot().resolve(runId);
        if (!Files.isDirectory(runFolder)) {
            throw new ValidationException(ValidationError.of(
                    ErrorCodes.RESUME_SESSION_INVALID, "Run folder not found: " + runFolder, "runId", runId));
        }
        RebootResumeController.Admission admission = rebootController.beginResume(runFolder, token);
        boolean elevated = elevationCheck.isElevated();
        if (!admission.admitted()) {
            return walker(elevated).abandon(admission.session(), admission.reason());
        }
        ExecutionTree tree;
        List<String> warnings;
        try {
            RunRequest request = requestForResume(admission.session().runRequest());
            tree = new ExecutionPlanner(config, osEnvironment).plan(request, discover());
            warnings = new ArrayList<>(PrivilegeChecker.check(tree, elevated));
        } catch (ValidationException e) {
            log.error("Resume of {} could not be planned: {}", runId, e.getMessage());
            return walker(elevated).failResume(admission.session(), "Resume failed: " + e.getMessage());
        }
        log.info("Resuming {} {} at phase {}", admission.session().runType().targetName(), admission.session().target(),
                admission.session().nextPhase());
        return walker(elevated).resume(tree, admission.session(), warnings);
    }

    /**
     * The persisted request is redacted; masked environment overrides fall back to the OS environment.
     */
    static RunRequest requestForResume(JsonNode persisted) {
        if (persisted == null || persisted.isNull()) {
            throw new ValidationException(ValidationError.of(
                    ErrorCodes.RESUME_SESSION_INVALID, "Resume session carries no run request"));
        }
        RunRequest request;
        try {
            request = Jsons.mapper().treeToValue(persisted, RunRequest.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException(ValidationError.of(
                    ErrorCodes.RESUME_SESSION_INVALID, "Persisted run request is unreadable: " + e.getOriginalMessage()));
        }
        Map<String, String> env = new LinkedHashMap<>();
        request.environmentOverrides().env().forEach((key, value) -> {
            if (!SecretRedactor.MASK.equals(value)) {
                env.put(key, value);
            }
        });
        return new RunRequest(request.suite(), request.testCase(), request.plan(), request.nodeOverrides(),
                request.caseInputs(), new RunRequest.EnvironmentOverrides(env));
    }

    private static void collectInputWarnings(ExecutionTree tree, List<String> warnings) {
        for (int i = 0; i < tree.size(); i++) {
            ExecutionTree.Node node = tree.node(i);
            if (node.inputs() != null) {
                for (String warning : node.inputs().warnings()) {
                    warnings.add(node.identity() + ": " + warning);
                }
            }
        }
    }

    private TreeWalker walker(boolean elevated) {
        RunIndexWriter writer = index();
        CaseRunner caseRunner = new CaseRunner(config, writer, cancellation, elevated);
        return new TreeWalker(config, caseRunner, writer, runIds, cancellation, rebootController);
    }

    private synchronized RunIndexWriter index() {
        if (index == null) {
            index = RunIndexWriter.open(config.indexFile());
        }
        return index;
    }

    @Override
    public synchronized void close() {
        if (index != null) {
            index.close();
            index = null;
        }
    }
}
