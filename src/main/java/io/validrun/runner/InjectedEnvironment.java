package io.validrun.runner;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Variables every leaf script receives.
 */
public final class InjectedEnvironment {
    public static final String TESTCASE_PATH = "VALIDRUN_TESTCASE_PATH";
    public static final String TESTCASE_NAME = "VALIDRUN_TESTCASE_NAME";
    public static final String TESTCASE_ID = "VALIDRUN_TESTCASE_ID";
    public static final String TESTCASE_VER = "VALIDRUN_TESTCASE_VER";
    public static final String RUN_ID = "VALIDRUN_RUN_ID";
    public static final String PHASE = "VALIDRUN_PHASE";
    public static final String CONTROL_DIR = "VALIDRUN_CONTROL_DIR";
    public static final String ASSETS_ROOT = "VALIDRUN_ASSETS_ROOT";
    public static final String MODULES_ROOT = "VALIDRUN_MODULES_ROOT";

    private InjectedEnvironment() {
    }

    public static Map<String, String> build(CaseInvocation invocation, Path assetsRoot, Path modulesRoot) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put(TESTCASE_PATH, invocation.caseFolder().toString());
        env.put(TESTCASE_NAME, invocation.manifest().name() == null ? invocation.manifest().id() : invocation.manifest().name());
        env.put(TESTCASE_ID, invocation.manifest().id());
        env.put(TESTCASE_VER, invocation.manifest().version());
        env.put(RUN_ID, invocation.runFolder().runId());
        env.put(PHASE, Integer.toString(invocation.phase()));
        env.put(CONTROL_DIR, invocation.runFolder().controlDir().toString());
        env.put(ASSETS_ROOT, assetsRoot.toString());
        env.put(MODULES_ROOT, modulesRoot.toString());
        return env;
    }
}
