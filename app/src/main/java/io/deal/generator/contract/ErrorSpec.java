package io.deal.generator.contract;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * @param code status code name as written in the contract, e.g. {@code NotFound}
 * @param message literal status description
 */
public record ErrorSpec(
    @JsonAlias("errorCode") String code,
    String message
) {
}
