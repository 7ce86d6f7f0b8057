package io.deal.generator.contract;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * @param description human-readable case name, used for test names and comments
 * @param request JSON value of the method input type
 * @param error the status the server must fail with
 */
public record FailureCase(
    String description,
    JsonNode request,
    ErrorSpec error
) {
}
