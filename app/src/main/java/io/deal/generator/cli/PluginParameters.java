package io.deal.generator.cli;

import io.deal.generator.exceptions.ContractGenerationException;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Options passed by protoc as the plugin parameter, e.g.
 * {@code --deal_out=contract-file=contract.json:gen}. The comma separated
 * {@code key=value} list is parsed with the same option names as the command line.
 */
@CommandLine.Command(name = "plugin-parameters")
public class PluginParameters {

    @CommandLine.Option(names = "--contract-file", description = "Path to your contract file")
    private Path contractFile;

    public Path getContractFile() {
        return contractFile;
    }

    public static PluginParameters parse(String parameter) throws ContractGenerationException {
        try {
            return CommandLine.populateCommand(new PluginParameters(), toArguments(parameter));
        } catch (CommandLine.ParameterException e) {
            throw new ContractGenerationException("Invalid plugin parameter '" + parameter + "': " + e.getMessage(), e);
        }
    }

    static String[] toArguments(String parameter) {
        List<String> arguments = new ArrayList<>();
        if (parameter == null || parameter.isBlank()) {
            return new String[0];
        }
        for (String option : parameter.split(",")) {
            String trimmed = option.trim();
            if (!trimmed.isEmpty()) {
                arguments.add("--" + trimmed);
            }
        }
        return arguments.toArray(new String[0]);
    }
}
