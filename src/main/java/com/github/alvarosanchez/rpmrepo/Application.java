package com.github.alvarosanchez.rpmrepo;

import com.github.alvarosanchez.rpmrepo.command.Cli;
import com.github.alvarosanchez.rpmrepo.command.RpmRepoCommand;
import io.micronaut.configuration.picocli.MicronautFactory;
import io.micronaut.context.ApplicationContext;
import picocli.CommandLine;

public final class Application {

    private Application() {
    }

    public static void main(String[] args) {
        Cli.init();
        try (ApplicationContext context = ApplicationContext.builder().start()) {
            int exitCode = new CommandLine(context.getBean(RpmRepoCommand.class), new MicronautFactory(context))
                .setUsageHelpAutoWidth(true)
                .execute(args);
            System.exit(exitCode);
        }
    }
}
