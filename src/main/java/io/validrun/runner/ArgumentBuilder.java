package io.validrun.runner;

import io.validrun.resolve.ParameterValue;
import io.validrun.resolve.ResolvedInput;
import io.validrun.resolve.ResolvedInputs;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the interpreter argv. Each parameter is its own {@code -Name} token followed by its
 * value token(s), so values containing whitespace are never re-split.
 */
public final class ArgumentBuilder {
    private ArgumentBuilder() {
    }

    public static List<String> command(List<String> interpreter, Path script, ResolvedInputs inputs) {
        List<String> command = new ArrayList<>(interpreter);
        command.add(script.toString());
        command.addAll(parameters(inputs));
        return command;
    }

    public static List<String> parameters(ResolvedInputs inputs) {
        List<String> args = new ArrayList<>();
        for (ResolvedInput input : inputs.all()) {
            ParameterValue value = input.value();
            String flag = "-" + input.name();
            switch (value.kind()) {
                case BOOLEAN -> args.add(flag + ":" + booleanLiteral(((ParameterValue.BoolValue) value).value()));
                case LIST -> {
                    // an empty array still passes its flag
                    args.add(flag);
                    for (ParameterValue item : ((ParameterValue.ListValue) value).items()) {
                        args.add(scalarToken(item));
                    }
                }
                default -> {
                    args.add(flag);
                    args.add(scalarToken(value));
                }
            }
        }
        return args;
    }

    private static String scalarToken(ParameterValue value) {
        if (value.kind() == ParameterValue.Kind.BOOLEAN) {
            return booleanLiteral(((ParameterValue.BoolValue) value).value());
        }
        return value.asText();
    }

    static String booleanLiteral(boolean value) {
        return value ? "$true" : "$false";
    }
}
