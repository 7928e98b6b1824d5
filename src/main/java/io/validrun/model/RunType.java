package io.validrun.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RunType {
    TEST_CASE("TestCase", "R-", "testcase"),
    TEST_SUITE("TestSuite", "S-", "suite"),
    TEST_PLAN("TestPlan", "P-", "plan");

    private final String wireName;
    private final String runIdPrefix;
    private final String target;

    RunType(String wireName, String runIdPrefix, String target) {
        this.wireName = wireName;
        this.runIdPrefix = runIdPrefix;
        this.target = target;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String runIdPrefix() {
        return runIdPrefix;
    }

    /**
     * Name used on the command line: testcase, suite or plan.
     */
    public String targetName() {
        return target;
    }

    @JsonCreator
    public static RunType fromString(String raw) {
        if (raw != null) {
            for (RunType value : values()) {
                String v = raw.trim();
                if (value.wireName.equalsIgnoreCase(v) || value.target.equalsIgnoreCase(v) || value.name().equalsIgnoreCase(v)) {
                    return value;
                }
            }
        }
        throw new IllegalArgumentException("Unknown run type: " + raw);
    }
}
