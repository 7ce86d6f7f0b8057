package io.deal.generator.exceptions;

/**
 * Base class of every error that aborts a generation run.
 */
public class ContractGenerationException extends Exception {
    public ContractGenerationException(String message) {
        super(message);
    }

    public ContractGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
