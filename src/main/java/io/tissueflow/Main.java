package io.tissueflow;

import io.tissueflow.cli.TissueFlowCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = TissueFlowCommand.commandLine().execute(args);
        System.exit(code);
    }
}
