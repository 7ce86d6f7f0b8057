package io.deal.generator.exceptions;

public class InvalidErrorCodeException extends ContractGenerationException {
    private final String errorCode;

    public InvalidErrorCodeException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
