package io.deskflow;

import io.deskflow.cli.DeskFlowCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new DeskFlowCommand()).execute(args);
        System.exit(code);
    }
}
