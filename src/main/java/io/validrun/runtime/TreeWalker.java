package io.validrun.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.validrun.config.ValidRunConfig;
import io.validrun.model.ErrorCodes;
import io.validrun.model.Identity;
import io.validrun.model.RunStatus;
import io.validrun.model.RunType;
import io.validrun.model.SuiteControls;
import io.validrun.observability.EventLogWriter;
import io.validrun.observability.MdcContext;
import io.validrun.reboot.RebootRequest;
import io.validrun.reboot.RebootResumeController;
import io.validrun.reboot.ResumeSession;
import io.validrun.runner.CancellationToken;
import io.validrun.runner.CaseInvocation;
import io.validrun.runner.CaseRunOutcome;
import io.validrun.runner.CaseRunner;
import io.validrun.security.SecretRedactor;
import io.validrun.storage.CaseResult;
import io.validrun.storage.CaseRunFolder;
import io.validrun.storage.ChildEntry;
import io.validrun.storage.GroupResult;
import io.validrun.storage.GroupRunFolder;
import io.validrun.storage.IndexEntry;
import io.validrun.storage.RunError;
import io.validrun.storage.RunIdFactory;
import io.validrun.storage.RunIndexWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Walks an {@link ExecutionTree} sequentially and applies repeat, retry and continue-on-failure
 * controls. Node failures become statuses; they are never thrown through the walk.
 */
public final class TreeWalker {
    private static final Logger log = LoggerFactory.getLogger(TreeWalker.class);

    private final Path runsRoot;
    private final CaseRunner caseRunner;
    private final RunIndexWriter index;
    private final RunIdFactory runIds;
    private final CancellationToken cancellation;
    private final RebootResumeController rebootController;

    public TreeWalker(
            ValidRunConfig config,
            CaseRunner caseRunner,
            RunIndexWriter index,
            RunIdFactory runIds,
            CancellationToken cancellation,
            RebootResumeController rebootController
    ) {
        this.runsRoot = config.runsRoot();
        this.caseRunner = caseRunner;
        this.index = index;
        this.runIds = runIds;
        this.cancellation = cancellation;
        this.rebootController = rebootController;
    }

    public RunSummary run(ExecutionTree tree, JsonNode runRequest, List<String> warnings) {
        return walk(tree, runRequest, null, warnings);
    }

    public RunSummary resume(ExecutionTree tree, ResumeSession session, List<String> warnings) {
        return walk(tree, session.runRequest(), session, warnings);
    }

    private RunSummary walk(ExecutionTree tree, JsonNode runRequest, ResumeSession session, List<String> warnings) {
        try {
            return switch (tree.root().kind()) {
                case CASE -> runStandaloneCase(tree, runRequest, session, warnings);
                case SUITE -> runRootSuite(tree, runRequest, session, warnings);
                case PLAN -> runPlan(tree, runRequest, session, warnings);
            };
        } finally {
            MdcContext.clear();
        }
    }

    private RunSummary runStandaloneCase(ExecutionTree tree, JsonNode runRequest, ResumeSession session, List<String> warnings) {
        ExecutionTree.Node node = tree.root();
        CaseRunFolder folder;
        int phase;
        if (session == null) {
            RunIdFactory.Allocation allocation = runIds.allocate(runsRoot, RunType.TEST_CASE);
            folder = CaseRunFolder.create(allocation.runId(), allocation.folder());
            phase = 0;
        } else {
            folder = CaseRunFolder.open(runsRoot.resolve(session.caseRunId()));
            phase = session.nextPhase();
        }
        MdcContext.setRun(folder.runId());
        CaseRunOutcome outcome = caseRunner.run(invocation(node, folder, phase, null, null, null, null));
        CaseResult result = outcome.result();
        if (outcome.suspended()) {
            ResumeSession saved = suspend(folder.folder(), caseDraft(folder.runId(), node.identity(), runRequest, tree,
                    outcome.rebootRequest()));
            return summary(folder.runId(), RunType.TEST_CASE, node.identity(), result.status(), folder.folder(),
                    saved.resumeToken(), result.message(), warnings);
        }
        finish(folder.folder(), session);
        return summary(folder.runId(), RunType.TEST_CASE, node.identity(), result.status(), folder.folder(), null,
                result.error() == null ? null : result.error().message(), warnings);
    }

    private RunSummary runRootSuite(ExecutionTree tree, JsonNode runRequest, ResumeSession session, List<String> warnings) {
        ExecutionTree.Node node = tree.root();
        SuiteOutcome outcome = runSuite(tree, node.index(), null, null, session, runRequest);
        Path folder = runsRoot.resolve(outcome.result().runId());
        if (outcome.suspension() != null) {
            Suspension s = outcome.suspension();
            ResumeSession saved = suspend(folder, draft(outcome.result().runId(), RunType.TEST_SUITE, node.identity(),
                    runRequest, tree, s.request(), s.caseRunId(), null, null, s.suiteRunId(), s.suiteStartTime(),
                    s.iteration(), s.nodePosition(), s.attempt()));
            return summary(outcome.result().runId(), RunType.TEST_SUITE, node.identity(), RunStatus.REBOOT_REQUIRED,
                    folder, saved.resumeToken(), outcome.result().message(), warnings);
        }
        finish(folder, session);
        return summary(outcome.result().runId(), RunType.TEST_SUITE, node.identity(), outcome.result().status(),
                folder, null, outcome.result().message(), warnings);
    }

    private RunSummary runPlan(ExecutionTree tree, JsonNode runRequest, ResumeSession session, List<String> warnings) {
        ExecutionTree.Node plan = tree.root();
        GroupRunFolder folder;
        Instant start;
        if (session == null) {
            RunIdFactory.Allocation allocation = runIds.allocate(runsRoot, RunType.TEST_PLAN);
            folder = GroupRunFolder.create(allocation.runId(), allocation.folder());
            start = Instant.now();
            SecretRedactor redactor = redactorFor(tree);
            folder.writeManifestSnapshot(plan.plan(), plan.manifestPath());
            folder.writeControls(plan.controls());
            folder.writeEnvironment(plan.environment(), redactor);
            folder.writeRunRequest(runRequest, redactor);
        } else {
            folder = GroupRunFolder.open(runsRoot.resolve(session.runId()));
            start = Instant.parse(session.planStartTime());
        }
        MdcContext.setRun(folder.runId());
        EventLogWriter events = new EventLogWriter(folder.eventsFile());
        boolean continueOnFailure = plan.controls().effectiveContinueOnFailure();
        List<ExecutionTree.Node> suites = tree.children(plan.index());
        int startPosition = session == null ? 0 : session.suitePosition();
        boolean stop = false;
        for (int position = startPosition; position < suites.size(); position++) {
            ExecutionTree.Node suite = suites.get(position);
            if (stop || cancellation.isCancelled()) {
                folder.appendChild(new ChildEntry(null, RunType.TEST_SUITE, suite.nodeId(), suite.identity().toString(),
                        0, null, null, RunStatus.ABORTED, stop ? "Skipped after an earlier suite did not pass" : "Run cancelled"));
                continue;
            }
            ResumeSession suiteSession = session != null && position == startPosition ? session : null;
            SuiteOutcome outcome = runSuite(tree, suite.index(), folder.runId(), plan.identity(), suiteSession, null);
            MdcContext.setRun(folder.runId());
            if (outcome.suspension() != null) {
                Suspension s = outcome.suspension();
                GroupResult suspended = writeGroupResult(folder, RunType.TEST_PLAN, null, null, plan.identity(),
                        RunStatus.REBOOT_REQUIRED, start, "Suspended for reboot: " + s.request().reason());
                index.append(IndexEntry.of(suspended, null));
                ResumeSession saved = suspend(folder.folder(), draft(folder.runId(), RunType.TEST_PLAN, plan.identity(),
                        runRequest, tree, s.request(), s.caseRunId(), start.toString(), position, s.suiteRunId(),
                        s.suiteStartTime(), s.iteration(), s.nodePosition(), s.attempt()));
                return summary(folder.runId(), RunType.TEST_PLAN, plan.identity(), RunStatus.REBOOT_REQUIRED,
                        folder.folder(), saved.resumeToken(), suspended.message(), warnings);
            }
            RunStatus status = outcome.result().status();
            folder.appendChild(new ChildEntry(outcome.result().runId(), RunType.TEST_SUITE, suite.nodeId(),
                    suite.identity().toString(), 0, null, null, status, null));
            if (status != RunStatus.PASSED && !continueOnFailure) {
                log.info("Suite {} ended {}, aborting remaining suites of {}", suite.identity(), status.wireName(), plan.identity());
                events.info("plan.stop", "Remaining suites aborted", Map.of("suite", suite.identity().toString()));
                stop = true;
            }
        }
        RunStatus status = StatusAggregator.aggregate(childStatuses(folder), cancellation.isCancelled());
        GroupResult result = writeGroupResult(folder, RunType.TEST_PLAN, null, null, plan.identity(), status, start, null);
        index.append(IndexEntry.of(result, null));
        finish(folder.folder(), session);
        return summary(folder.runId(), RunType.TEST_PLAN, plan.identity(), status, folder.folder(), null, null, warnings);
    }

    private SuiteOutcome runSuite(
            ExecutionTree tree,
            int suiteIndex,
            String parentRunId,
            Identity planIdentity,
            ResumeSession session,
            JsonNode runRequest
    ) {
        ExecutionTree.Node suite = tree.node(suiteIndex);
        SuiteControls controls = suite.controls();
        GroupRunFolder folder;
        Instant start;
        if (session == null) {
            RunIdFactory.Allocation allocation = runIds.allocate(runsRoot, RunType.TEST_SUITE);
            folder = GroupRunFolder.create(allocation.runId(), allocation.folder());
            start = Instant.now();
            SecretRedactor redactor = redactorFor(tree);
            folder.writeManifestSnapshot(suite.suite(), suite.manifestPath());
            folder.writeControls(controls);
            folder.writeEnvironment(suite.environment(), redactor);
            folder.writeRunRequest(runRequest, redactor);
        } else {
            folder = GroupRunFolder.open(runsRoot.resolve(session.suiteRunId()));
            start = Instant.parse(session.suiteStartTime());
        }
        MdcContext.setRun(folder.runId());
        EventLogWriter events = new EventLogWriter(folder.eventsFile());
        if (session == null && controls.effectiveMaxParallel() > 1) {
            log.warn("maxParallel={} ignored for {}; suites run sequentially", controls.effectiveMaxParallel(), suite.identity());
            events.warning(ErrorCodes.CONTROLS_MAX_PARALLEL_IGNORED, "maxParallel is ignored; execution is sequential",
                    Map.of("maxParallel", controls.effectiveMaxParallel()));
        }

        List<ExecutionTree.Node> cases = tree.children(suiteIndex);
        int repeat = controls.effectiveRepeat();
        int maxAttempts = 1 + controls.effectiveRetryOnError();
        boolean continueOnFailure = controls.effectiveContinueOnFailure();
        int startIteration = session == null ? 0 : session.iteration();
        int startPosition = session == null ? 0 : session.nodePosition();
        boolean stop = false;
        for (int iteration = startIteration; iteration < repeat; iteration++) {
            int first = iteration == startIteration ? startPosition : 0;
            for (int position = first; position < cases.size(); position++) {
                ExecutionTree.Node node = cases.get(position);
                if (stop || cancellation.isCancelled()) {
                    folder.appendChild(new ChildEntry(null, RunType.TEST_CASE, node.nodeId(), node.identity().toString(),
                            iteration, null, null, RunStatus.ABORTED,
                            stop ? "Skipped after an earlier node did not pass" : "Run cancelled"));
                    continue;
                }
                boolean resumeHere = session != null && iteration == startIteration && position == startPosition;
                NodeRun run = runCaseNode(node, suite, folder, iteration, planIdentity, resumeHere ? session : null,
                        maxAttempts);
                if (run.request() != null) {
                    GroupResult suspended = writeGroupResult(folder, RunType.TEST_SUITE, suite.nodeId(), suite.identity(),
                            planIdentity, RunStatus.REBOOT_REQUIRED, start, "Suspended for reboot: " + run.request().reason());
                    index.append(IndexEntry.of(suspended, parentRunId));
                    return new SuiteOutcome(suspended, new Suspension(run.request(), run.caseRunId(), folder.runId(),
                            start.toString(), iteration, position, run.attempt()));
                }
                folder.appendChild(new ChildEntry(run.caseRunId(), RunType.TEST_CASE, node.nodeId(),
                        node.identity().toString(), iteration, run.attempt(), null, run.status(), null));
                if (run.status() != RunStatus.PASSED && !continueOnFailure) {
                    log.info("Node {} ended {}, aborting remaining nodes of {}", node.nodeId(), run.status().wireName(),
                            suite.identity());
                    events.info("suite.stop", "Remaining nodes aborted", Map.of("nodeId", node.nodeId()));
                    stop = true;
                }
            }
        }
        RunStatus status = StatusAggregator.aggregate(childStatuses(folder), cancellation.isCancelled());
        GroupResult result = writeGroupResult(folder, RunType.TEST_SUITE, suite.nodeId(), suite.identity(), planIdentity,
                status, start, null);
        index.append(IndexEntry.of(result, parentRunId));
        log.info("Suite {} finished with {}", suite.identity(), status.wireName());
        return new SuiteOutcome(result, null);
    }

    private NodeRun runCaseNode(
            ExecutionTree.Node node,
            ExecutionTree.Node suite,
            GroupRunFolder suiteFolder,
            int iteration,
            Identity planIdentity,
            ResumeSession session,
            int maxAttempts
    ) {
        int firstAttempt = session == null ? 1 : session.attempt();
        CaseRunOutcome last = null;
        String lastRunId = null;
        int attemptsUsed = firstAttempt;
        for (int attempt = firstAttempt; attempt <= maxAttempts; attempt++) {
            if (last != null) {
                // the previous attempt is superseded by this one
                suiteFolder.appendChild(new ChildEntry(lastRunId, RunType.TEST_CASE, node.nodeId(),
                        node.identity().toString(), iteration, attemptsUsed, Boolean.TRUE, last.result().status(), null));
            }
            attemptsUsed = attempt;
            CaseRunFolder folder;
            int phase;
            if (session != null && attempt == firstAttempt) {
                folder = CaseRunFolder.open(runsRoot.resolve(session.caseRunId()));
                phase = session.nextPhase();
            } else {
                RunIdFactory.Allocation allocation = runIds.allocate(runsRoot, RunType.TEST_CASE);
                folder = CaseRunFolder.create(allocation.runId(), allocation.folder());
                phase = 0;
            }
            last = caseRunner.run(invocation(node, folder, phase, suite.identity(), planIdentity, suiteFolder.runId(),
                    suite.workingDir()));
            lastRunId = folder.runId();
            if (last.suspended()) {
                return new NodeRun(lastRunId, attempt, last.result().status(), last.rebootRequest());
            }
            RunStatus status = last.result().status();
            if (!status.retryable() || cancellation.isCancelled() || attempt == maxAttempts) {
                break;
            }
            log.info("Node {} ended {}, retrying (attempt {} of {})", node.nodeId(), status.wireName(),
                    attempt + 1, maxAttempts);
        }
        return new NodeRun(lastRunId, attemptsUsed, last.result().status(), null);
    }

    /**
     * Closes a suspension that may not resume: every suspended result in the chain becomes Aborted.
     */
    public RunSummary abandon(ResumeSession session, String reason) {
        return closeSuspension(session, RunStatus.ABORTED, RunError.aborted(reason), reason);
    }

    /**
     * Closes an admitted resume that could not be planned: every suspended result in the chain becomes Error.
     */
    public RunSummary failResume(ResumeSession session, String message) {
        Path topFolder = runsRoot.resolve(session.runId());
        new EventLogWriter(topFolder.resolve("events.jsonl")).error(ErrorCodes.RESUME_FAILED, message, Map.of());
        RunSummary summary = closeSuspension(session, RunStatus.ERROR, RunError.runner(message), message);
        rebootController.abort(topFolder, session);
        return summary;
    }

    private RunSummary closeSuspension(ResumeSession session, RunStatus status, RunError error, String reason) {
        String now = Instant.now().toString();
        Path caseFolder = runsRoot.resolve(session.caseRunId());
        if (Files.exists(caseFolder.resolve("result.json"))) {
            CaseRunFolder folder = CaseRunFolder.open(caseFolder);
            CaseResult result = folder.readResult();
            if (result.status() == RunStatus.REBOOT_REQUIRED) {
                CaseResult closed = result.terminated(status, error, now, reason);
                folder.writeResult(closed);
                index.append(IndexEntry.of(closed, session.suiteRunId()));
            }
        }
        if (session.suiteRunId() != null) {
            String parent = session.runType() == RunType.TEST_PLAN ? session.runId() : null;
            closeGroup(runsRoot.resolve(session.suiteRunId()), status, now, reason, parent);
        }
        if (session.runType() == RunType.TEST_PLAN) {
            closeGroup(runsRoot.resolve(session.runId()), status, now, reason, null);
        }
        log.error("Run {} ended {}: {}", session.runId(), status.wireName(), reason);
        return new RunSummary(session.runId(), session.runType(), session.target(), status,
                runsRoot.resolve(session.runId()).toString(), null, reason, List.of());
    }

    private void closeGroup(Path folderPath, RunStatus status, String now, String reason, String parentRunId) {
        GroupRunFolder folder = GroupRunFolder.open(folderPath);
        GroupResult result = folder.readResult();
        if (result.status() == RunStatus.REBOOT_REQUIRED) {
            GroupResult closed = result.withStatus(status, now, reason);
            folder.writeResult(closed);
            index.append(IndexEntry.of(closed, parentRunId));
        }
    }

    private CaseInvocation invocation(
            ExecutionTree.Node node,
            CaseRunFolder folder,
            int phase,
            Identity suite,
            Identity plan,
            String parentRunId,
            String workingDir
    ) {
        return new CaseInvocation(folder, node.caseManifest(), node.caseFolder(), node.manifestPath(), node.ref(),
                node.nodeId(), node.inputs(), node.environment(), phase, suite, plan, parentRunId, workingDir);
    }

    private GroupResult writeGroupResult(
            GroupRunFolder folder,
            RunType type,
            String nodeId,
            Identity suite,
            Identity plan,
            RunStatus status,
            Instant start,
            String message
    ) {
        List<ChildEntry> children = folder.readChildren();
        List<RunStatus> statuses = children.stream().filter(ChildEntry::counted).map(ChildEntry::status).toList();
        List<String> childRunIds = new ArrayList<>();
        for (ChildEntry child : children) {
            if (child.runId() != null) {
                childRunIds.add(child.runId());
            }
        }
        GroupResult result = new GroupResult(
                CaseResult.SCHEMA_VERSION,
                folder.runId(),
                type,
                nodeId,
                suite == null ? null : suite.id(),
                suite == null ? null : suite.version(),
                plan == null ? null : plan.id(),
                plan == null ? null : plan.version(),
                status,
                start.toString(),
                Instant.now().toString(),
                StatusAggregator.counts(statuses),
                childRunIds,
                message
        );
        folder.writeResult(result);
        return result;
    }

    private static List<RunStatus> childStatuses(GroupRunFolder folder) {
        return folder.readChildren().stream().filter(ChildEntry::counted).map(ChildEntry::status).toList();
    }

    private ResumeSession draft(
            String runId,
            RunType type,
            Identity target,
            JsonNode runRequest,
            ExecutionTree tree,
            RebootRequest request,
            String caseRunId,
            String planStartTime,
            Integer suitePosition,
            String suiteRunId,
            String suiteStartTime,
            Integer iteration,
            Integer nodePosition,
            Integer attempt
    ) {
        JsonNode redactedRequest = runRequest == null ? null : redactorFor(tree).redactJson(runRequest);
        return new ResumeSession(runId, type, target.toString(), ResumeSession.State.PENDING_RESUME,
                request.nextPhase(), null, 0, caseRunId, planStartTime, suitePosition, suiteRunId, suiteStartTime,
                iteration, nodePosition, attempt, redactedRequest, request.reason(), request.delaySec(),
                Instant.now().toString());
    }

    private ResumeSession caseDraft(
            String caseRunId,
            Identity target,
            JsonNode runRequest,
            ExecutionTree tree,
            RebootRequest request
    ) {
        return draft(caseRunId, RunType.TEST_CASE, target, runRequest, tree, request, caseRunId,
                null, null, null, null, null, null, null);
    }

    private ResumeSession suspend(Path topFolder, ResumeSession draft) {
        RebootRequest request = new RebootRequest(draft.nextPhase(), draft.reason(), draft.delaySec());
        return rebootController.suspend(topFolder, draft, request);
    }

    private void finish(Path topFolder, ResumeSession session) {
        if (session != null) {
            rebootController.finalizeSession(topFolder, session);
        }
    }

    private static SecretRedactor redactorFor(ExecutionTree tree) {
        List<String> secrets = new ArrayList<>();
        for (int i = 0; i < tree.size(); i++) {
            ExecutionTree.Node node = tree.node(i);
            if (node.inputs() != null) {
                secrets.addAll(node.inputs().secretValues());
            }
        }
        return new SecretRedactor(secrets);
    }

    private static RunSummary summary(
            String runId,
            RunType type,
            Identity target,
            RunStatus status,
            Path folder,
            String token,
            String message,
            List<String> warnings
    ) {
        return new RunSummary(runId, type, target.toString(), status, folder.toString(), token, message, warnings);
    }

    private record NodeRun(String caseRunId, int attempt, RunStatus status, RebootRequest request) {
    }

    private record Suspension(
            RebootRequest request,
            String caseRunId,
            String suiteRunId,
            String suiteStartTime,
            int iteration,
            int nodePosition,
            int attempt
    ) {
    }

    private record SuiteOutcome(GroupResult result, Suspension suspension) {
    }
}
