package io.deal.generator.compile;

import com.google.protobuf.Descriptors.ServiceDescriptor;

import java.util.List;

/**
 * Dispatch tables of every method of a contracted service, in schema declaration order.
 * Methods the contract does not mention have an empty table.
 */
public record CompiledService(
    ServiceDescriptor service,
    List<DispatchSpec> methods
) {
    public CompiledService {
        methods = List.copyOf(methods);
    }

    /** Methods the generated clients implement. */
    public List<DispatchSpec> unaryMethods() {
        return methods.stream().filter(DispatchSpec::isUnary).toList();
    }

    /** Methods with at least one contract case, which get a conformance test. */
    public List<DispatchSpec> contractedMethods() {
        return unaryMethods().stream().filter(spec -> !spec.isEmpty()).toList();
    }
}
