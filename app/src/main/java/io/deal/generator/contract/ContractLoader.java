package io.deal.generator.contract;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.deal.generator.exceptions.MalformedContractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads contract documents of the shape
 * {@code {name, services: {<Service>: {<Method>: {successCases: [...], failureCases: [...]}}}}}.
 *
 * Only the shape is checked here. Request/response values stay untyped JSON until the
 * case compiler resolves them against the schema.
 */
public class ContractLoader {
    private static final Logger logger = LoggerFactory.getLogger(ContractLoader.class);
    private final ObjectMapper objectMapper;

    public ContractLoader() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(JsonParser.Feature.STRICT_DUPLICATE_DETECTION, true);
    }

    public Contract load(Path contractFile) throws MalformedContractException {
        logger.info("Loading contract file: {}", contractFile);
        try (InputStream in = Files.newInputStream(contractFile)) {
            return load(in, contractFile.toString());
        } catch (IOException e) {
            throw new MalformedContractException("Failed to read contract file " + contractFile + ": " + e.getMessage(), e);
        }
    }

    public Contract load(InputStream in, String sourceName) throws MalformedContractException {
        Contract contract;
        try {
            contract = objectMapper.readValue(in, Contract.class);
        } catch (JsonProcessingException e) {
            throw new MalformedContractException(
                "Contract " + sourceName + " is not a valid contract: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedContractException("Failed to read contract " + sourceName + ": " + e.getMessage(), e);
        }

        if (contract == null) {
            throw new MalformedContractException("Contract " + sourceName + " is empty");
        }

        logger.debug("Loaded contract '{}' with {} services", contract.name(), contract.services().size());
        return contract;
    }
}
