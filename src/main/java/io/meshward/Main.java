package io.meshward;

import io.meshward.cli.MeshWardCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new MeshWardCommand()).execute(args);
        System.exit(code);
    }
}
