package io.deal.generator;

import io.deal.generator.cli.GeneratorCommand;
import picocli.CommandLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        System.exit(run(new GeneratorCommand(), args));
    }

    /**
     * Parses the arguments into the command, logs the mode they select and runs it.
     *
     * @return the process exit code
     */
    static int run(GeneratorCommand command, String... args) {
        CommandLine cmd = new CommandLine(command)
            .setExecutionStrategy(parseResult -> {
                if (!parseResult.isUsageHelpRequested() && !parseResult.isVersionHelpRequested()) {
                    logger.info("Running protoc-gen-deal in {} mode", command.mode().description());
                }
                return new CommandLine.RunLast().execute(parseResult);
            });
        int exitCode = cmd.execute(args);

        logger.debug("Generator completed with exit code: {}", exitCode);
        return exitCode;
    }
}
