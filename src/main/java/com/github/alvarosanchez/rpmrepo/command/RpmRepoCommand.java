package com.github.alvarosanchez.rpmrepo.command;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Root Picocli command for the rpmrepo CLI.
 */
@Command(
    name = "rpmrepo",
    description = "Tracks upstream RPM releases and publishes them as a YUM/DNF repository.",
    mixinStandardHelpOptions = true,
    versionProvider = RpmRepoVersionProvider.class,
    subcommands = {
        CommandLine.HelpCommand.class,
        ProviderCommand.class,
        DiscoverCommand.class,
        ReleaseCommand.class,
        RepodataCommand.class
    }
)
public class RpmRepoCommand implements Runnable {

    /**
     * Prints root command usage when no subcommand is provided.
     */
    @Override
    public void run() {
        Cli.init();
        CommandLine.usage(this, System.out);
    }
}
