package io.deal.generator.contract;

import io.deal.generator.exceptions.InvalidErrorCodeException;
import io.grpc.Status;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of status codes a failure case may name, spelled the way contracts write them.
 *
 * {@code OK} is deliberately absent: a failure case must fail.
 */
public enum ErrorCode {
    CANCELED("Canceled", Status.Code.CANCELLED),
    UNKNOWN("Unknown", Status.Code.UNKNOWN),
    INVALID_ARGUMENT("InvalidArgument", Status.Code.INVALID_ARGUMENT),
    DEADLINE_EXCEEDED("DeadlineExceeded", Status.Code.DEADLINE_EXCEEDED),
    NOT_FOUND("NotFound", Status.Code.NOT_FOUND),
    ALREADY_EXISTS("AlreadyExists", Status.Code.ALREADY_EXISTS),
    PERMISSION_DENIED("PermissionDenied", Status.Code.PERMISSION_DENIED),
    RESOURCE_EXHAUSTED("ResourceExhausted", Status.Code.RESOURCE_EXHAUSTED),
    FAILED_PRECONDITION("FailedPrecondition", Status.Code.FAILED_PRECONDITION),
    ABORTED("Aborted", Status.Code.ABORTED),
    OUT_OF_RANGE("OutOfRange", Status.Code.OUT_OF_RANGE),
    UNIMPLEMENTED("Unimplemented", Status.Code.UNIMPLEMENTED),
    INTERNAL("Internal", Status.Code.INTERNAL),
    UNAVAILABLE("Unavailable", Status.Code.UNAVAILABLE),
    DATA_LOSS("DataLoss", Status.Code.DATA_LOSS),
    UNAUTHENTICATED("Unauthenticated", Status.Code.UNAUTHENTICATED);

    private static final Map<String, ErrorCode> BY_CONTRACT_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(ErrorCode::contractName, Function.identity()));

    private final String contractName;
    private final Status.Code statusCode;

    ErrorCode(String contractName, Status.Code statusCode) {
        this.contractName = contractName;
        this.statusCode = statusCode;
    }

    public String contractName() {
        return contractName;
    }

    public Status.Code statusCode() {
        return statusCode;
    }

    /**
     * Full text of the {@code StatusRuntimeException} a server raises for this code and
     * description, e.g. {@code "NOT_FOUND: item NotFound"}.
     */
    public String errorText(String description) {
        return statusCode + ": " + description;
    }

    /**
     * Validates a contract code name.
     *
     * @param code the name as written in the contract
     * @param location where the code appears, for the error message
     * @throws InvalidErrorCodeException if the name is not one of the known codes
     */
    public static ErrorCode parse(String code, String location) throws InvalidErrorCodeException {
        ErrorCode errorCode = code == null ? null : BY_CONTRACT_NAME.get(code);
        if (errorCode == null) {
            throw new InvalidErrorCodeException(
                String.format("invalid error code: %s (%s)", code, location), code);
        }
        return errorCode;
    }
}
