package io.deal.generator.contract;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Method contracts of one service keyed by the proto method name. In the contract document
 * the service value is the method object itself.
 */
public record ServiceContract(Map<String, MethodContract> methods) {
    public ServiceContract {
        methods = methods == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(methods));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ServiceContract fromJson(Map<String, MethodContract> methods) {
        return new ServiceContract(methods);
    }

    /**
     * A method without an entry still gets generated, answering every call with the
     * default outcome.
     */
    public MethodContract method(String methodName) {
        return Optional.ofNullable(methods.get(methodName)).orElse(MethodContract.EMPTY);
    }
}
