package io.validrun.runner;

import io.validrun.config.ValidRunConfig;
import io.validrun.model.CaseManifest;
import io.validrun.model.RunStatus;
import io.validrun.model.RunType;
import io.validrun.observability.EventLogWriter;
import io.validrun.observability.MdcContext;
import io.validrun.reboot.RebootRequest;
import io.validrun.reboot.RebootRequestReader;
import io.validrun.security.SecretRedactor;
import io.validrun.storage.CaseResult;
import io.validrun.storage.CaseRunFolder;
import io.validrun.storage.IndexEntry;
import io.validrun.storage.RunError;
import io.validrun.storage.RunIndexWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes a single case invocation and persists its authoritative result.
 */
public final class CaseRunner {
    private static final Logger log = LoggerFactory.getLogger(CaseRunner.class);

    private final ValidRunConfig config;
    private final ProcessSupervisor supervisor;
    private final RunIndexWriter index;
    private final CancellationToken cancellation;
    private final boolean elevated;

    public CaseRunner(ValidRunConfig config, RunIndexWriter index, CancellationToken cancellation, boolean elevated) {
        this.config = config;
        this.supervisor = new ProcessSupervisor(config.killGrace());
        this.index = index;
        this.cancellation = cancellation;
        this.elevated = elevated;
    }

    public CaseRunOutcome run(CaseInvocation invocation) {
        CaseRunFolder folder = invocation.runFolder();
        CaseManifest manifest = invocation.manifest();
        EventLogWriter events = new EventLogWriter(folder.eventsFile());
        SecretRedactor redactor = new SecretRedactor(invocation.inputs().secretValues());
        MdcContext.setCase(folder.runId(), invocation.nodeId(), invocation.phase());
        try {
            Instant originalStart = null;
            if (invocation.resumed()) {
                if (Files.exists(folder.resultFile())) {
                    originalStart = Instant.parse(folder.readResult().startTime());
                }
                events.info("case.resumed", "Resuming at phase " + invocation.phase(), Map.of("phase", invocation.phase()));
            } else {
                folder.writeManifestSnapshot(manifest, invocation.manifestPath(), invocation.ref());
                folder.writeParams(invocation.inputs());
                folder.writeEnvSnapshot(invocation.environment(), elevated, redactor);
                for (String warning : invocation.inputs().warnings()) {
                    events.warning("input.warning", warning, Map.of());
                }
            }
            RebootRequestReader.consume(folder.controlDir());

            Map<String, String> environment = new LinkedHashMap<>(invocation.environment());
            environment.putAll(InjectedEnvironment.build(invocation, config.assetsRoot(), config.modulesRoot()));
            long timeoutSec = manifest.timeoutSec() == null ? 0L : Math.max(0, manifest.timeoutSec());
            Duration timeout = timeoutSec == 0L ? null : Duration.ofSeconds(timeoutSec);

            Path script = invocation.caseFolder().resolve(config.scriptName());
            ProcessOutcome outcome;
            if (!Files.isRegularFile(script)) {
                outcome = ProcessOutcome.startFailed("script not found: " + script, Instant.now());
            } else {
                List<String> command = ArgumentBuilder.command(config.interpreter(), script, invocation.inputs());
                log.info("Running {} ({} parameters) phase {}", manifest.identity(),
                        invocation.inputs().all().size(), invocation.phase());
                events.info("process.start", "Starting interpreter", Map.of("phase", invocation.phase()));
                outcome = supervisor.run(command, workingDirectory(invocation), environment, folder.stdoutLog(), folder.stderrLog(),
                        timeout, cancellation, redactor);
            }

            StatusMapper.Derived derived = StatusMapper.derive(outcome, timeoutSec);
            RunStatus status = derived.status();
            RunError error = derived.error();
            RebootRequest reboot = null;
            if (status == RunStatus.PASSED) {
                RebootRequestReader.ReadResult request = RebootRequestReader.read(folder.controlDir());
                switch (request.status()) {
                    case VALID -> {
                        reboot = request.request();
                        status = RunStatus.REBOOT_REQUIRED;
                    }
                    case INVALID -> {
                        status = RunStatus.ERROR;
                        error = RunError.script("Invalid reboot request: " + request.error());
                        events.error("reboot.invalid", request.error(), Map.of());
                    }
                    default -> {
                    }
                }
            }

            Instant start = originalStart == null ? outcome.startTime() : originalStart;
            CaseResult result = new CaseResult(
                    CaseResult.SCHEMA_VERSION,
                    folder.runId(),
                    RunType.TEST_CASE,
                    invocation.nodeId(),
                    manifest.id(),
                    manifest.version(),
                    invocation.suite() == null ? null : invocation.suite().id(),
                    invocation.suite() == null ? null : invocation.suite().version(),
                    invocation.plan() == null ? null : invocation.plan().id(),
                    invocation.plan() == null ? null : invocation.plan().version(),
                    status,
                    start.toString(),
                    outcome.endTime().toString(),
                    outcome.exitCode(),
                    invocation.phase(),
                    invocation.inputs().redactedJson(),
                    error,
                    runnerInfo(),
                    reboot == null ? null : "Reboot requested: " + reboot.reason()
            );
            folder.writeResult(result);
            index.append(IndexEntry.of(result, invocation.parentRunId()));
            events.info("case.finished", "Case finished with " + status.wireName(), Map.of("status", status.wireName()));
            log.info("{} finished with {} (exit {})", manifest.identity(), status.wireName(), outcome.exitCode());
            return new CaseRunOutcome(result, reboot);
        } finally {
            MdcContext.clearCase();
        }
    }

    private static Path workingDirectory(CaseInvocation invocation) {
        Path root = invocation.runFolder().folder();
        if (invocation.workingDir() == null || invocation.workingDir().isBlank()) {
            return root;
        }
        Path dir = root.resolve(invocation.workingDir()).normalize();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Failed to create working directory " + dir, e);
        }
        return dir;
    }

    private Map<String, Object> runnerInfo() {
        Map<String, Object> runner = new LinkedHashMap<>();
        runner.put("version", ValidRunConfig.RUNNER_VERSION);
        runner.put("interpreter", config.interpreter().get(0));
        runner.put("isElevated", elevated);
        return runner;
    }
}
