package io.deal.generator.contract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A parsed contract document.
 *
 * Services are kept in document order. A service missing from the contract has no contract:
 * the generator skips it.
 *
 * @param name free-form contract name
 * @param services service contracts keyed by the proto service name
 */
public record Contract(
    String name,
    Map<String, ServiceContract> services
) {
    public Contract {
        services = services == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(services));
    }

    public Optional<ServiceContract> service(String serviceName) {
        return Optional.ofNullable(services.get(serviceName));
    }
}
