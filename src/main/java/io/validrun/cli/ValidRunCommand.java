package io.validrun.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.validrun.config.ValidRunConfig;
import io.validrun.discovery.Discovered;
import io.validrun.discovery.DiscoveryResult;
import io.validrun.model.ErrorCodes;
import io.validrun.model.Identity;
import io.validrun.model.RunRequest;
import io.validrun.model.RunStatus;
import io.validrun.model.RunType;
import io.validrun.model.ValidationError;
import io.validrun.model.ValidationException;
import io.validrun.runner.CancellationToken;
import io.validrun.runtime.RunEngine;
import io.validrun.runtime.RunSummary;
import io.validrun.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "validrun",
        mixinStandardHelpOptions = true,
        description = "Discovers and runs validation test cases, suites and plans",
        subcommands = {
                ValidRunCommand.DiscoverCommand.class,
                ValidRunCommand.RunCommand.class,
                ValidRunCommand.ResumeCommand.class
        }
)
public final class ValidRunCommand implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ValidRunCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_ERROR = 2;

    PrintStream out = System.out;

    @Override
    public void run() {
        out.println("Use subcommands: discover | run | resume");
    }

    RunEngine engine(ValidRunConfig config, CancellationToken cancellation) {
        return RunEngine.create(config, cancellation);
    }

    static int exitCode(RunStatus status) {
        return switch (status) {
            case PASSED, REBOOT_REQUIRED -> EXIT_OK;
            case FAILED -> EXIT_FAILED;
            default -> EXIT_ERROR;
        };
    }

    int printError(RuntimeException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (e instanceof ValidationException) {
            body.put("errors", ((ValidationException) e).errors());
        } else {
            log.error("Command failed", e);
            body.put("errors", List.of(ValidationError.of(ErrorCodes.RUN_REQUEST_INVALID, e.getMessage())));
        }
        out.println(Jsons.toJson(body));
        return EXIT_ERROR;
    }

    int runWithCancellation(RootOptions options, EngineCall call) {
        ValidRunConfig config;
        try {
            config = options.config();
        } catch (RuntimeException e) {
            return printError(e);
        }
        // two kill grace periods plus room to persist the Aborted results
        Duration maxWait = config.killGrace().multipliedBy(4);
        try (ShutdownCancellation shutdown = ShutdownCancellation.install(new CancellationToken(), maxWait)) {
            try (RunEngine engine = engine(config, shutdown.token())) {
                RunSummary summary = call.apply(engine);
                out.println(Jsons.toJson(summary));
                return exitCode(summary.status());
            } catch (RuntimeException e) {
                return printError(e);
            }
        }
    }

    @FunctionalInterface
    interface EngineCall {
        RunSummary apply(RunEngine engine);
    }

    @Command(name = "discover", description = "List every case, suite and plan found under the roots")
    static final class DiscoverCommand implements Callable<Integer> {
        @ParentCommand
        ValidRunCommand parent;

        @Mixin
        RootOptions options;

        @Override
        public Integer call() {
            try (RunEngine engine = parent.engine(options.config(), new CancellationToken())) {
                DiscoveryResult result = engine.discover();
                parent.out.println(Jsons.toJson(summarize(engine.config(), result)));
                return result.hasErrors() ? EXIT_ERROR : EXIT_OK;
            } catch (RuntimeException e) {
                return parent.printError(e);
            }
        }

        static Map<String, Object> summarize(ValidRunConfig config, DiscoveryResult result) {
            Map<String, Object> roots = new LinkedHashMap<>();
            roots.put("casesRoot", config.casesRoot().toString());
            roots.put("suitesRoot", config.suitesRoot().toString());
            roots.put("plansRoot", config.plansRoot().toString());
            Map<String, Object> counts = new LinkedHashMap<>();
            counts.put("testCases", result.cases().size());
            counts.put("suites", result.suites().size());
            counts.put("plans", result.plans().size());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("roots", roots);
            body.put("counts", counts);
            body.put("testCases", entries(result.cases()));
            body.put("suites", entries(result.suites()));
            body.put("plans", entries(result.plans()));
            body.put("errors", result.errors());
            body.put("warnings", result.warnings());
            return body;
        }

        private static <T> List<Map<String, String>> entries(Map<Identity, Discovered<T>> found) {
            List<Map<String, String>> out = new ArrayList<>();
            found.entrySet().stream()
                    .sorted(Comparator.comparing(e -> e.getKey().toString()))
                    .forEach(e -> {
                        Map<String, String> row = new LinkedHashMap<>();
                        row.put("identity", e.getKey().toString());
                        row.put("manifestPath", e.getValue().manifestPath().toString());
                        out.add(row);
                    });
            return out;
        }
    }

    @Command(name = "run", description = "Run a test case, suite or plan")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        ValidRunCommand parent;

        @Mixin
        RootOptions options;

        @Option(names = {"--target"}, description = "testcase | suite | plan")
        String target;

        @Option(names = {"--id"}, description = "Target identity as id@version")
        String id;

        @Option(names = {"--inputs"}, description = "JSON inputs: name->value for a test case, nodeId->{inputs} for a suite")
        String inputs;

        @Option(names = {"--env"}, description = "JSON object of environment overrides")
        String env;

        @Option(names = {"--runRequest"}, description = "Path to a RunRequest JSON file; replaces --target/--id/--inputs/--env")
        String runRequest;

        @Override
        public Integer call() {
            RunRequest request;
            try {
                request = buildRequest();
            } catch (ValidationException | IllegalArgumentException e) {
                return parent.printError(e);
            }
            return parent.runWithCancellation(options, engine -> engine.run(request));
        }

        RunRequest buildRequest() {
            if (runRequest != null && !runRequest.isBlank()) {
                try {
                    JsonNode raw = Jsons.readTree(Path.of(runRequest));
                    return Jsons.mapper().treeToValue(raw, RunRequest.class);
                } catch (IOException e) {
                    throw new ValidationException(ValidationError.of(ErrorCodes.RUN_REQUEST_INVALID,
                            "Cannot read RunRequest file " + runRequest + ": " + e.getMessage(), "path", runRequest));
                }
            }
            if (target == null || id == null) {
                throw new ValidationException(ValidationError.of(ErrorCodes.RUN_REQUEST_INVALID,
                        "Either --runRequest or both --target and --id are required"));
            }
            RunType type = RunType.fromString(target);
            Map<String, String> envOverrides = env == null
                    ? Map.of()
                    : Jsons.mapper().convertValue(requireObject(env, "--env"), new TypeReference<Map<String, String>>() {
                    });
            switch (type) {
                case TEST_CASE -> {
                    Map<String, JsonNode> caseInputs = inputs == null
                            ? Map.of()
                            : Jsons.mapper().convertValue(requireObject(inputs, "--inputs"),
                            new TypeReference<Map<String, JsonNode>>() {
                            });
                    return RunRequest.forCase(id, caseInputs, envOverrides);
                }
                case TEST_SUITE -> {
                    Map<String, RunRequest.NodeOverride> overrides = inputs == null
                            ? Map.of()
                            : Jsons.mapper().convertValue(requireObject(inputs, "--inputs"),
                            new TypeReference<Map<String, RunRequest.NodeOverride>>() {
                            });
                    return RunRequest.forSuite(id, overrides, envOverrides);
                }
                default -> {
                    if (inputs != null) {
                        throw new ValidationException(ValidationError.of(ErrorCodes.RUN_REQUEST_PLAN_INPUT_OVERRIDE,
                                "A plan run cannot take --inputs", "plan", id));
                    }
                    return RunRequest.forPlan(id, envOverrides);
                }
            }
        }

        private static JsonNode requireObject(String raw, String option) {
            JsonNode node = Jsons.parse(raw);
            if (!node.isObject()) {
                throw new IllegalArgumentException(option + " must be a JSON object");
            }
            return node;
        }
    }

    @Command(name = "resume", description = "Continue a run suspended for a reboot")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        ValidRunCommand parent;

        @Mixin
        RootOptions options;

        @Option(names = {"--runId"}, required = true, description = "Top-level run id of the suspended run")
        String runId;

        @Option(names = {"--token"}, required = true, description = "Resume token from the suspension")
        String token;

        @Override
        public Integer call() {
            return parent.runWithCancellation(options, engine -> engine.resume(runId, token));
        }
    }

    /**
     * Root and runtime options shared by every subcommand.
     */
    static final class RootOptions {
        @Option(names = {"--casesRoot"}, description = "Root of test case folders (default: assets/TestCases)")
        String casesRoot;

        @Option(names = {"--suitesRoot"}, description = "Root of suite manifests (default: assets/TestSuites)")
        String suitesRoot;

        @Option(names = {"--plansRoot"}, description = "Root of plan manifests (default: assets/TestPlans)")
        String plansRoot;

        @Option(names = {"--runsRoot"}, description = "Root of run folders (default: Runs)")
        String runsRoot;

        @Option(names = {"--rebootCommand"},
                description = "Command run when a case requests a reboot; {delaySec}, {runId} and {token} are substituted")
        String rebootCommand;

        ValidRunConfig config() {
            ValidRunConfig config = ValidRunConfig.fromRoots(casesRoot, suitesRoot, plansRoot, runsRoot);
            if (rebootCommand != null && !rebootCommand.isBlank()) {
                config = config.withRebootCommand(Arrays.asList(rebootCommand.trim().split("\\s+")));
            }
            return config;
        }
    }
}
