package io.trialforge;

import io.trialforge.cli.TrialForgeCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new TrialForgeCommand()).execute(args);
        System.exit(code);
    }
}
