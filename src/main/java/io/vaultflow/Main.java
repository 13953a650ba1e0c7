package io.vaultflow;

import io.vaultflow.cli.VaultFlowCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = VaultFlowCommand.commandLine().execute(args);
        System.exit(code);
    }
}
