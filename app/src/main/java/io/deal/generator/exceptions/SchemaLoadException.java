package io.deal.generator.exceptions;

/**
 * The descriptors handed to the generator do not form a valid schema.
 */
public class SchemaLoadException extends ContractGenerationException {
    public SchemaLoadException(String message) {
        super(message);
    }

    public SchemaLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
