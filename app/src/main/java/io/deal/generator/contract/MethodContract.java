package io.deal.generator.contract;

import java.util.List;

/**
 * Ordered success and failure cases of one method. Authoring order decides which case wins
 * when several requests are equal: success cases first, then failure cases.
 */
public record MethodContract(
    List<SuccessCase> successCases,
    List<FailureCase> failureCases
) {
    public static final MethodContract EMPTY = new MethodContract(List.of(), List.of());

    public MethodContract {
        successCases = successCases == null ? List.of() : List.copyOf(successCases);
        failureCases = failureCases == null ? List.of() : List.copyOf(failureCases);
    }

    public int caseCount() {
        return successCases.size() + failureCases.size();
    }

    public boolean isEmpty() {
        return caseCount() == 0;
    }
}
