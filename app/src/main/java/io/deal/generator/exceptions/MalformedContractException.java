package io.deal.generator.exceptions;

/**
 * The contract document cannot be read into the contract shape.
 */
public class MalformedContractException extends ContractGenerationException {
    public MalformedContractException(String message) {
        super(message);
    }

    public MalformedContractException(String message, Throwable cause) {
        super(message, cause);
    }
}
