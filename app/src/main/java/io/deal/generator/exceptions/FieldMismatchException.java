package io.deal.generator.exceptions;

/**
 * A populated field has no descriptor in the schema message type: the contract and the
 * schema have drifted apart.
 */
public class FieldMismatchException extends ContractGenerationException {
    private final String fieldName;
    private final String messageType;

    public FieldMismatchException(String message, String fieldName, String messageType) {
        super(message);
        this.fieldName = fieldName;
        this.messageType = messageType;
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getMessageType() {
        return messageType;
    }
}
