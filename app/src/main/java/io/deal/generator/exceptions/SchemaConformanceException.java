package io.deal.generator.exceptions;

public class SchemaConformanceException extends ContractGenerationException {
    private final String messageType;

    public SchemaConformanceException(String message, String messageType) {
        super(message);
        this.messageType = messageType;
    }

    public SchemaConformanceException(String message, String messageType, Throwable cause) {
        super(message, cause);
        this.messageType = messageType;
    }

    public String getMessageType() {
        return messageType;
    }
}
