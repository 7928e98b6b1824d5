package io.validrun.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.validrun.config.ValidRunConfig;
import io.validrun.discovery.Discovered;
import io.validrun.discovery.DiscoveryResult;
import io.validrun.discovery.SuiteRefResolver;
import io.validrun.model.CaseManifest;
import io.validrun.model.ErrorCodes;
import io.validrun.model.Identity;
import io.validrun.model.PlanManifest;
import io.validrun.model.RunRequest;
import io.validrun.model.SuiteControls;
import io.validrun.model.SuiteManifest;
import io.validrun.model.ValidationError;
import io.validrun.model.ValidationException;
import io.validrun.resolve.EnvironmentResolver;
import io.validrun.resolve.InputResolver;
import io.validrun.resolve.ResolvedInputs;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a run request into a fully validated {@link ExecutionTree}. Every reference, input and
 * environment problem is collected here, before any run folder exists.
 */
public final class ExecutionPlanner {
    private final ValidRunConfig config;
    private final Map<String, String> osEnvironment;

    public ExecutionPlanner(ValidRunConfig config, Map<String, String> osEnvironment) {
        this.config = config;
        this.osEnvironment = osEnvironment == null ? Map.of() : osEnvironment;
    }

    public ExecutionTree plan(RunRequest request, DiscoveryResult discovery) {
        request.validateShape();
        discovery.throwIfErrors();
        List<ValidationError> errors = new ArrayList<>();
        ExecutionTree tree = new ExecutionTree();
        Identity target = request.targetIdentity();
        Map<String, String> requestEnv = request.environmentOverrides().env();
        switch (request.runType()) {
            case TEST_CASE -> planCase(tree, discovery.requireCase(target), request, requestEnv, errors);
            case TEST_SUITE -> {
                Discovered<SuiteManifest> suite = discovery.requireSuite(target);
                planSuite(tree, ExecutionTree.NO_PARENT, null, suite, suite.manifest().controls(), Map.of(),
                        requestEnv, request.nodeOverrides(), null, errors);
            }
            case TEST_PLAN -> planPlan(tree, discovery.requirePlan(target), discovery, requestEnv, errors);
            default -> throw new IllegalStateException("Unsupported run type " + request.runType());
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        tree.computeEffectivePrivileges();
        return tree;
    }

    private void planCase(
            ExecutionTree tree,
            Discovered<CaseManifest> discovered,
            RunRequest request,
            Map<String, String> requestEnv,
            List<ValidationError> errors
    ) {
        Map<String, String> overlay = overlay(Map.of(), Map.of(), requestEnv, errors);
        if (overlay == null) {
            return;
        }
        ResolvedInputs inputs = resolveInputs(discovered.manifest(), Map.of(), request.caseInputs(), overlay, errors);
        if (inputs != null) {
            tree.addCase(ExecutionTree.NO_PARENT, null, discovered.manifest(), discovered.folder(),
                    discovered.manifestPath(), null, inputs, overlay);
        }
    }

    private void planPlan(
            ExecutionTree tree,
            Discovered<PlanManifest> discovered,
            DiscoveryResult discovery,
            Map<String, String> requestEnv,
            List<ValidationError> errors
    ) {
        PlanManifest plan = discovered.manifest();
        Map<String, String> planOverlay = overlay(plan.environment().env(), Map.of(), requestEnv, errors);
        int planIndex = tree.addPlan(plan.identity(), plan, discovered.manifestPath(), plan.controls(),
                planOverlay == null ? Map.of() : planOverlay);
        Set<String> seen = new HashSet<>();
        for (PlanManifest.Node entry : plan.suites()) {
            Optional<Identity> identity = Identity.tryParse(entry.ref());
            Discovered<SuiteManifest> suite = identity.map(discovery.suites()::get).orElse(null);
            if (suite == null) {
                errors.add(ValidationError.of(ErrorCodes.PLAN_SUITE_REF_NOT_FOUND,
                        "Plan " + plan.identity() + " references unknown suite '" + entry.ref() + "'",
                        "plan", plan.identity().toString(), "ref", entry.ref()));
                continue;
            }
            String nodeId = entry.effectiveNodeId();
            if (!seen.add(nodeId)) {
                errors.add(ValidationError.of(ErrorCodes.RUN_REQUEST_INVALID,
                        "Duplicate nodeId '" + nodeId + "' in plan " + plan.identity(), "nodeId", nodeId));
                continue;
            }
            SuiteControls controls = suite.manifest().controls().overriddenBy(entry.controls());
            planSuite(tree, planIndex, nodeId, suite, controls, plan.environment().env(), requestEnv, Map.of(),
                    plan.identity(), errors);
        }
    }

    private void planSuite(
            ExecutionTree tree,
            int parent,
            String nodeId,
            Discovered<SuiteManifest> discovered,
            SuiteControls controls,
            Map<String, String> planEnv,
            Map<String, String> requestEnv,
            Map<String, RunRequest.NodeOverride> nodeOverrides,
            Identity planIdentity,
            List<ValidationError> errors
    ) {
        SuiteManifest suite = discovered.manifest();
        String suiteId = suite.identity().toString();
        Map<String, String> overlay = overlay(planEnv, suite.environment().env(), requestEnv, errors);
        if (overlay == null) {
            overlay = Map.of();
        }
        checkWorkingDir(suite, errors);
        Set<String> nodeIds = new HashSet<>();
        for (SuiteManifest.Node node : suite.testCases()) {
            if (node.nodeId() == null || node.nodeId().isBlank() || !nodeIds.add(node.nodeId())) {
                errors.add(ValidationError.of(ErrorCodes.RUN_REQUEST_INVALID,
                        "Suite " + suiteId + " has a missing or duplicate nodeId '" + node.nodeId() + "'",
                        "suite", suiteId));
            }
        }
        for (String overrideId : nodeOverrides.keySet()) {
            if (!nodeIds.contains(overrideId)) {
                errors.add(ValidationError.of(ErrorCodes.RUN_REQUEST_UNKNOWN_NODE_ID,
                        "nodeOverrides names unknown node '" + overrideId + "' in suite " + suiteId,
                        "suite", suiteId, "nodeId", overrideId));
            }
        }
        int suiteIndex = tree.addSuite(parent, nodeId, suite.identity(), suite, discovered.manifestPath(), controls, overlay);
        SuiteRefResolver resolver = new SuiteRefResolver(config.casesRoot());
        for (SuiteManifest.Node node : suite.testCases()) {
            SuiteRefResolver.ResolvedCase resolved;
            try {
                resolved = resolver.resolve(suiteId, node.nodeId(), node.ref());
            } catch (ValidationException e) {
                errors.addAll(e.errors());
                continue;
            }
            RunRequest.NodeOverride override = nodeOverrides.get(node.nodeId());
            Map<String, JsonNode> overrideInputs = override == null ? Map.of() : override.inputs();
            ResolvedInputs inputs = resolveInputs(resolved.manifest(), node.inputs(), overrideInputs, overlay, errors);
            if (inputs != null) {
                tree.addCase(suiteIndex, node.nodeId(), resolved.manifest(), resolved.folder(),
                        resolved.manifestPath(), node.ref(), inputs, overlay);
            }
        }
    }

    private ResolvedInputs resolveInputs(
            CaseManifest manifest,
            Map<String, JsonNode> nodeInputs,
            Map<String, JsonNode> overrideInputs,
            Map<String, String> overlay,
            List<ValidationError> errors
    ) {
        Map<String, String> effective = new LinkedHashMap<>(osEnvironment);
        effective.putAll(overlay);
        try {
            return InputResolver.resolve(manifest, nodeInputs, overrideInputs, effective);
        } catch (ValidationException e) {
            errors.addAll(e.errors());
            return null;
        }
    }

    private static Map<String, String> overlay(
            Map<String, String> planEnv,
            Map<String, String> suiteEnv,
            Map<String, String> requestEnv,
            List<ValidationError> errors
    ) {
        try {
            return EnvironmentResolver.overridesOnly(planEnv, suiteEnv, requestEnv);
        } catch (ValidationException e) {
            errors.addAll(e.errors());
            return null;
        }
    }

    private static void checkWorkingDir(SuiteManifest suite, List<ValidationError> errors) {
        String workingDir = suite.environment().workingDir();
        if (workingDir == null || workingDir.isBlank()) {
            return;
        }
        Path base = Path.of("run").toAbsolutePath();
        boolean contained;
        try {
            Path relative = Path.of(workingDir);
            contained = !relative.isAbsolute() && base.resolve(relative).normalize().startsWith(base);
        } catch (InvalidPathException e) {
            contained = false;
        }
        if (!contained) {
            errors.add(ValidationError.of(ErrorCodes.WORKING_DIR_CONTAINMENT_FAILED,
                    "workingDir '" + workingDir + "' of suite " + suite.identity() + " must stay inside the run folder",
                    "suite", suite.identity().toString(), "workingDir", workingDir));
        }
    }
}
