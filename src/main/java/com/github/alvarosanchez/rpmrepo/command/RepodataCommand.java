package com.github.alvarosanchez.rpmrepo.command;

import com.github.alvarosanchez.rpmrepo.repodata.RepositoryIndexBundle;
import com.github.alvarosanchez.rpmrepo.service.RepodataService;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Writes the repository index documents of a provider to a directory.
 */
@Command(
    name = "repodata",
    description = "Generate repomd.xml and the compressed index documents of a provider repository.",
    mixinStandardHelpOptions = true
)
public class RepodataCommand implements Callable<Integer> {

    private final RepodataService repodataService;

    @Inject
    RepodataCommand(RepodataService repodataService) {
        this.repodataService = repodataService;
    }

    @Parameters(index = "0", description = "Provider id.")
    private String providerId;

    @Option(names = {"-o", "--output"}, required = true, description = "Repository root; documents go to <output>/repodata.")
    private Path outputDir;

    /**
     * Generates and writes the documents.
     *
     * @return command exit code
     */
    @Override
    public Integer call() {
        try {
            RepositoryIndexBundle bundle = repodataService.write(providerId, outputDir);
            Cli.success(
                "Wrote repository metadata for `" + providerId + "` (revision " + bundle.revision() + ") to "
                    + outputDir.resolve("repodata") + "."
            );
            return 0;
        } catch (RuntimeException e) {
            Cli.error(e.getMessage());
            return 1;
        }
    }
}
