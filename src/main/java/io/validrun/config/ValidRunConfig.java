package io.validrun.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

public final class ValidRunConfig {
    public static final String DEFAULT_CASES_ROOT = "assets/TestCases";
    public static final String DEFAULT_SUITES_ROOT = "assets/TestSuites";
    public static final String DEFAULT_PLANS_ROOT = "assets/TestPlans";
    public static final String DEFAULT_RUNS_ROOT = "Runs";
    public static final String DEFAULT_SCRIPT_NAME = "run.ps1";
    public static final String RUNNER_VERSION = "0.1.0";
    public static final List<String> DEFAULT_INTERPRETER = List.of(
            "pwsh", "-NoProfile", "-NonInteractive", "-ExecutionPolicy", "Bypass", "-File"
    );
    public static final Duration DEFAULT_KILL_GRACE = Duration.ofSeconds(5);
    public static final String INTERPRETER_PROPERTY = "validrun.interpreter";

    private final Path casesRoot;
    private final Path suitesRoot;
    private final Path plansRoot;
    private final Path runsRoot;
    private final List<String> interpreter;
    private final String scriptName;
    private final Duration killGrace;
    private final List<String> rebootCommand;

    public ValidRunConfig(
            Path casesRoot,
            Path suitesRoot,
            Path plansRoot,
            Path runsRoot,
            List<String> interpreter,
            String scriptName,
            Duration killGrace,
            List<String> rebootCommand
    ) {
        this.casesRoot = casesRoot;
        this.suitesRoot = suitesRoot;
        this.plansRoot = plansRoot;
        this.runsRoot = runsRoot;
        this.interpreter = List.copyOf(interpreter);
        this.scriptName = scriptName;
        this.killGrace = killGrace;
        this.rebootCommand = rebootCommand == null ? List.of() : List.copyOf(rebootCommand);
    }

    public static ValidRunConfig defaults() {
        return fromRoots(null, null, null, null);
    }

    public static ValidRunConfig fromRoots(String casesRoot, String suitesRoot, String plansRoot, String runsRoot) {
        return new ValidRunConfig(
                resolve(casesRoot, DEFAULT_CASES_ROOT),
                resolve(suitesRoot, DEFAULT_SUITES_ROOT),
                resolve(plansRoot, DEFAULT_PLANS_ROOT),
                resolve(runsRoot, DEFAULT_RUNS_ROOT),
                interpreterFromProperty(),
                DEFAULT_SCRIPT_NAME,
                DEFAULT_KILL_GRACE,
                List.of()
        );
    }

    private static Path resolve(String raw, String fallback) {
        Path resolved = raw == null || raw.isBlank() ? Paths.get(fallback) : Paths.get(raw.trim());
        return resolved.toAbsolutePath().normalize();
    }

    private static List<String> interpreterFromProperty() {
        String raw = System.getProperty(INTERPRETER_PROPERTY);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_INTERPRETER;
        }
        return Arrays.asList(raw.trim().split("\\s+"));
    }

    public ValidRunConfig withInterpreter(List<String> command, String script) {
        return new ValidRunConfig(casesRoot, suitesRoot, plansRoot, runsRoot, command, script, killGrace, rebootCommand);
    }

    public ValidRunConfig withKillGrace(Duration grace) {
        return new ValidRunConfig(casesRoot, suitesRoot, plansRoot, runsRoot, interpreter, scriptName, grace, rebootCommand);
    }

    public ValidRunConfig withRebootCommand(List<String> command) {
        return new ValidRunConfig(casesRoot, suitesRoot, plansRoot, runsRoot, interpreter, scriptName, killGrace, command);
    }

    public Path casesRoot() {
        return casesRoot;
    }

    public Path suitesRoot() {
        return suitesRoot;
    }

    public Path plansRoot() {
        return plansRoot;
    }

    public Path runsRoot() {
        return runsRoot;
    }

    public Path indexFile() {
        return runsRoot.resolve("index.jsonl");
    }

    /**
     * Parent of the three manifest roots, exported to scripts as the assets root.
     */
    public Path assetsRoot() {
        Path parent = casesRoot.getParent();
        return parent == null ? casesRoot : parent;
    }

    public Path modulesRoot() {
        return assetsRoot().resolve("PowerShell").resolve("Modules");
    }

    public List<String> interpreter() {
        return interpreter;
    }

    public String scriptName() {
        return scriptName;
    }

    public Duration killGrace() {
        return killGrace;
    }

    public List<String> rebootCommand() {
        return rebootCommand;
    }
}
