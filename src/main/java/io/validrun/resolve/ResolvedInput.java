package io.validrun.resolve;

public record ResolvedInput(String name, ParameterValue value, boolean secret, Source source) {
    public enum Source {
        DEFAULT,
        NODE,
        OVERRIDE
    }
}
