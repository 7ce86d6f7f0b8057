package io.deal.generator.cli;

import com.google.protobuf.DescriptorProtos.FileDescriptorSet;
import com.google.protobuf.Descriptors.FileDescriptor;
import com.google.protobuf.compiler.PluginProtos.CodeGeneratorRequest;
import com.google.protobuf.compiler.PluginProtos.CodeGeneratorResponse;
import io.deal.generator.ContractGenerator;
import io.deal.generator.GeneratedUnit;
import io.deal.generator.SchemaLoader;
import io.deal.generator.contract.Contract;
import io.deal.generator.contract.ContractLoader;
import io.deal.generator.exceptions.ContractGenerationException;
import io.deal.generator.exceptions.MissingOptionException;
import io.deal.generator.exceptions.SchemaLoadException;
import picocli.CommandLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Entry point of the generator.
 *
 * Without {@code --descriptor-set} it runs as a protoc plugin: a {@link CodeGeneratorRequest}
 * is read from standard input and a {@link CodeGeneratorResponse} written to standard output.
 * With {@code --descriptor-set} it reads a {@link FileDescriptorSet} (built with
 * {@code protoc --include_imports --descriptor_set_out}) and writes the units under
 * {@code --output-dir}.
 *
 * Exit code 0 on success, 1 on any generation error.
 */
@CommandLine.Command(
    name = "protoc-gen-deal",
    description = "Generate contract mock clients and contract tests for gRPC services",
    mixinStandardHelpOptions = true,
    version = "1.0.0-SNAPSHOT"
)
public class GeneratorCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(GeneratorCommand.class);

    /**
     * Where the schema comes from, decided by the presence of {@code --descriptor-set}.
     */
    public enum Mode {
        PLUGIN("protoc plugin"),
        DESCRIPTOR_SET("descriptor set");

        private final String description;

        Mode(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    @CommandLine.Option(
        names = "--contract-file",
        description = "Path to your contract file (can also be given as the protoc plugin parameter contract-file=<path>)"
    )
    private Path contractFile;

    @CommandLine.Option(
        names = "--descriptor-set",
        description = "Read the schema from this FileDescriptorSet instead of a protoc plugin request on stdin"
    )
    private Path descriptorSet;

    @CommandLine.Option(
        names = {"-o", "--output-dir"},
        description = "Output directory for generated sources (descriptor set mode only)"
    )
    private Path outputDirectory;

    @CommandLine.Option(
        names = "--file",
        description = "Proto file to generate (descriptor set mode, repeatable; default: every file in the set)"
    )
    private List<String> files;

    private final InputStream in;
    private final OutputStream out;

    public GeneratorCommand() {
        this(System.in, System.out);
    }

    public GeneratorCommand(InputStream in, OutputStream out) {
        this.in = in;
        this.out = out;
    }

    /**
     * Mode selected by the parsed options.
     */
    public Mode mode() {
        return descriptorSet == null ? Mode.PLUGIN : Mode.DESCRIPTOR_SET;
    }

    @Override
    public Integer call() {
        try {
            switch (mode()) {
                case PLUGIN -> runPlugin();
                case DESCRIPTOR_SET -> runStandalone();
            }
            return 0;
        } catch (ContractGenerationException e) {
            logger.error("Contract generation failed: {}", e.getMessage());
            logger.debug("Contract generation failure", e);
            return 1;
        } catch (IOException e) {
            logger.error("I/O error during contract generation", e);
            return 1;
        }
    }

    private void runPlugin() throws IOException, ContractGenerationException {
        CodeGeneratorRequest request = CodeGeneratorRequest.parseFrom(in);
        Path contractPath = contractFile != null
            ? contractFile
            : PluginParameters.parse(request.getParameter()).getContractFile();
        Contract contract = loadContract(contractPath);

        Map<String, FileDescriptor> linked = new SchemaLoader().load(request.getProtoFileList());
        List<FileDescriptor> filesToGenerate = select(linked, request.getFileToGenerateList());
        List<GeneratedUnit> units = new ContractGenerator().generate(filesToGenerate, linked.values(), contract);

        CodeGeneratorResponse.Builder response = CodeGeneratorResponse.newBuilder()
            .setSupportedFeatures(CodeGeneratorResponse.Feature.FEATURE_PROTO3_OPTIONAL_VALUE);
        for (GeneratedUnit unit : units) {
            response.addFile(CodeGeneratorResponse.File.newBuilder()
                .setName(unit.path())
                .setContent(unit.content()));
        }
        response.build().writeTo(out);
        out.flush();
    }

    private void runStandalone() throws IOException, ContractGenerationException {
        if (outputDirectory == null) {
            throw new MissingOptionException("'output-dir' option not provided");
        }
        Contract contract = loadContract(contractFile);

        FileDescriptorSet descriptors;
        try (InputStream descriptorIn = Files.newInputStream(descriptorSet)) {
            descriptors = FileDescriptorSet.parseFrom(descriptorIn);
        }

        Map<String, FileDescriptor> linked = new SchemaLoader().load(descriptors.getFileList());
        List<FileDescriptor> filesToGenerate = files == null || files.isEmpty()
            ? new ArrayList<>(linked.values())
            : select(linked, files);
        List<GeneratedUnit> units = new ContractGenerator().generate(filesToGenerate, linked.values(), contract);

        for (GeneratedUnit unit : units) {
            Path target = outputDirectory.resolve(unit.path());
            Files.createDirectories(target.getParent());
            Files.writeString(target, unit.content());
            logger.info("Wrote {}", target);
        }
    }

    private Contract loadContract(Path contractPath) throws ContractGenerationException {
        if (contractPath == null) {
            throw new MissingOptionException("'contract-file' option not provided");
        }
        return new ContractLoader().load(contractPath);
    }

    private List<FileDescriptor> select(Map<String, FileDescriptor> linked, List<String> names) throws SchemaLoadException {
        List<FileDescriptor> selected = new ArrayList<>();
        for (String name : names) {
            FileDescriptor file = linked.get(name);
            if (file == null) {
                throw new SchemaLoadException("File to generate " + name + " is not part of the schema");
            }
            selected.add(file);
        }
        return selected;
    }
}
