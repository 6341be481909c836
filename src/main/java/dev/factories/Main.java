package dev.factories;

import dev.factories.cli.FactoriesCli;

public class Main {
    public static void main(String[] args) {
        int exitCode = FactoriesCli.commandLine(new FactoriesCli()).execute(args);
        System.exit(exitCode);
    }
}
