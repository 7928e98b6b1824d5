package io.validrun.model;

public final class ErrorCodes {
    public static final String DISCOVERY_DUPLICATE_IDENTITY = "Discovery.DuplicateIdentity";
    public static final String SUITE_TEST_CASE_REF_INVALID = "Suite.TestCaseRef.Invalid";
    public static final String PLAN_SUITE_REF_NOT_FOUND = "Plan.SuiteRef.NotFound";

    public static final String RUN_REQUEST_IDENTITY_NOT_FOUND = "RunRequest.Identity.NotFound";
    public static final String RUN_REQUEST_IDENTITY_INVALID_FORMAT = "RunRequest.Identity.InvalidFormat";
    public static final String RUN_REQUEST_UNKNOWN_NODE_ID = "RunRequest.NodeOverrides.UnknownNodeId";
    public static final String RUN_REQUEST_PLAN_INPUT_OVERRIDE = "RunRequest.Plan.InputOverrideNotAllowed";
    public static final String RUN_REQUEST_INVALID = "RunRequest.Invalid";

    public static final String PARAMETER_UNKNOWN = "Parameter.Unknown";
    public static final String PARAMETER_REQUIRED = "Parameter.Required";
    public static final String PARAMETER_TYPE_INVALID = "Parameter.Type.Invalid";
    public static final String PARAMETER_ENUM_INVALID = "Parameter.Enum.Invalid";
    public static final String PARAMETER_RANGE_INVALID = "Parameter.Range.Invalid";
    public static final String PARAMETER_PATTERN_INVALID = "Parameter.Pattern.Invalid";
    public static final String ENVIRONMENT_KEY_EMPTY = "Environment.Key.Empty";

    public static final String ENV_REF_RESOLVE_FAILED = "EnvRef.ResolveFailed";
    public static final String ENV_REF_SECRET_ON_COMMAND_LINE = "EnvRef.SecretOnCommandLine";

    public static final String PRIVILEGE_REQUIRED = "Privilege.Required";
    public static final String WORKING_DIR_CONTAINMENT_FAILED = "WorkingDir.Containment.Failed";
    public static final String CONTROLS_MAX_PARALLEL_IGNORED = "Controls.MaxParallel.Ignored";

    public static final String RESUME_SESSION_INVALID = "Resume.Session.Invalid";
    public static final String RESUME_TOKEN_MISMATCH = "Resume.Token.Mismatch";
    public static final String RESUME_FAILED = "Resume.Failed";

    public static final String REF_OUT_OF_ROOT = "OutOfRoot";
    public static final String REF_NOT_FOUND = "NotFound";
    public static final String REF_MISSING_MANIFEST = "MissingManifest";

    private ErrorCodes() {
    }
}
