package cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Подкоманда {@code create-config}: записывает пример конфигурации ревью в YAML.
 *
 * <p>Файл содержит конфигурацию по умолчанию из {@link ConfigLoader#defaultConfig()}
 * и может быть передан обратно через {@code --config}.
 */
@Command(
    name = "create-config",
    description = "Create a sample configuration file with the default settings",
    mixinStandardHelpOptions = true
)
public class CreateConfigCommand implements Callable<Integer> {
    static final String DEFAULT_FILE_NAME = "code_review_config.yaml";

    @Spec
    private CommandSpec spec;

    @Parameters(
        arity = "0..1",
        paramLabel = "<file>",
        description = "Configuration file to create (default: " + DEFAULT_FILE_NAME + ")",
        defaultValue = DEFAULT_FILE_NAME
    )
    private Path file;

    @Option(
        names = {"--force"},
        description = "Overwrite the file if it already exists"
    )
    private boolean force;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            if (Files.exists(file) && !force) {
                err.println("ERROR: " + file + " already exists (use --force to overwrite)");
                return CodeReviewCli.EXIT_INVALID_INPUT;
            }
            new ConfigLoader().writeDefaultConfig(file);
            out.println("Sample configuration created: " + file);
            return CodeReviewCli.EXIT_OK;
        } catch (IOException e) {
            err.println("ERROR: Cannot write " + file + ": " + e.getMessage());
            return CodeReviewCli.EXIT_UNEXPECTED;
        } finally {
            out.flush();
            err.flush();
        }
    }
}
