package io.validrun;

import io.validrun.cli.ValidRunCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new ValidRunCommand()).execute(args);
        System.exit(code);
    }
}
