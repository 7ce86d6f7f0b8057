package io.deal.generator.exceptions;

/**
 * A required generator option was not provided.
 */
public class MissingOptionException extends ContractGenerationException {
    public MissingOptionException(String message) {
        super(message);
    }

    public MissingOptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
