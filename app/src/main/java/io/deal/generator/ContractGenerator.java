package io.deal.generator;

import com.google.protobuf.Descriptors.FileDescriptor;
import com.google.protobuf.Descriptors.ServiceDescriptor;
import io.deal.generator.compile.CaseCompiler;
import io.deal.generator.compile.CompiledService;
import io.deal.generator.contract.Contract;
import io.deal.generator.contract.ServiceContract;
import io.deal.generator.emit.ContractFileEmitter;
import io.deal.generator.exceptions.ContractGenerationException;
import io.deal.generator.resolve.ValueResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Generates the contract units of a run.
 *
 * For every file to generate that declares at least one service present in the contract,
 * the contracted services are compiled and rendered into one unit. Services without a
 * contract are skipped, and so are files left without any contracted service.
 *
 * The run is sequential and fail-fast: the first contract error aborts it and nothing is
 * emitted.
 */
public class ContractGenerator {
    private static final Logger logger = LoggerFactory.getLogger(ContractGenerator.class);
    private final ContractFileEmitter emitter;

    public ContractGenerator() {
        this.emitter = new ContractFileEmitter();
    }

    /**
     * @param filesToGenerate files whose services get contract units
     * @param allFiles every linked file of the run, imports included
     * @param contract the parsed contract
     */
    public List<GeneratedUnit> generate(Collection<FileDescriptor> filesToGenerate,
                                        Collection<FileDescriptor> allFiles,
                                        Contract contract) throws ContractGenerationException {
        CaseCompiler compiler = new CaseCompiler(ValueResolver.forFiles(allFiles));
        List<GeneratedUnit> units = new ArrayList<>();
        Set<String> contractedServices = new HashSet<>();

        for (FileDescriptor file : filesToGenerate) {
            if (file.getServices().isEmpty()) {
                logger.debug("Skipping {}: no services", file.getName());
                continue;
            }

            List<CompiledService> services = new ArrayList<>();
            for (ServiceDescriptor service : file.getServices()) {
                Optional<ServiceContract> serviceContract = findServiceContract(contract, service);
                if (serviceContract.isEmpty()) {
                    logger.info("No contract for service {}, skipping it", service.getFullName());
                    continue;
                }

                logger.info("Compiling contract for service {}", service.getFullName());
                services.add(compiler.compileService(service, serviceContract.get()));
                contractedServices.add(service.getName());
                contractedServices.add(service.getFullName());
            }

            if (services.isEmpty()) {
                logger.debug("Skipping {}: no contracted services", file.getName());
                continue;
            }

            GeneratedUnit unit = emitter.emit(file, services);
            logger.info("Generated {} for {} service(s) of {}", unit.path(), services.size(), file.getName());
            units.add(unit);
        }

        for (String serviceName : contract.services().keySet()) {
            if (!contractedServices.contains(serviceName)) {
                logger.warn("Contract service {} is not declared in the files to generate", serviceName);
            }
        }
        return units;
    }

    private Optional<ServiceContract> findServiceContract(Contract contract, ServiceDescriptor service) {
        return contract.service(service.getName())
            .or(() -> contract.service(service.getFullName()));
    }
}
