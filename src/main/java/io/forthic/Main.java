package io.forthic;

import io.forthic.cli.ForthicCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new ForthicCommand()).execute(args);
        System.exit(code);
    }
}
