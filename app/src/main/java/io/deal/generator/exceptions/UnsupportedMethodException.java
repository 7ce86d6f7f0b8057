package io.deal.generator.exceptions;

/**
 * The contract declares cases for a method the generated clients cannot express,
 * such as a streaming method.
 */
public class UnsupportedMethodException extends ContractGenerationException {
    public UnsupportedMethodException(String message) {
        super(message);
    }
}
