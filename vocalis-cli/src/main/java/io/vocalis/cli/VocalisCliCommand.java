package io.vocalis.cli;

import picocli.CommandLine.Command;

@Command(name = "vocalis", mixinStandardHelpOptions = true, description = "Vocalis voice agent memory tooling")
public final class VocalisCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
