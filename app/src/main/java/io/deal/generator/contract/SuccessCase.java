package io.deal.generator.contract;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * @param description human-readable case name, used for test names and comments
 * @param request JSON value of the method input type
 * @param response JSON value of the method output type
 */
public record SuccessCase(
    String description,
    JsonNode request,
    JsonNode response
) {
}
