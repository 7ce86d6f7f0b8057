package io.deal.generator.compile;

import com.google.protobuf.Descriptors.MethodDescriptor;
import com.google.protobuf.Descriptors.ServiceDescriptor;
import com.google.protobuf.DynamicMessage;
import io.deal.generator.contract.ErrorCode;
import io.deal.generator.contract.ErrorSpec;
import io.deal.generator.contract.FailureCase;
import io.deal.generator.contract.MethodContract;
import io.deal.generator.contract.ServiceContract;
import io.deal.generator.contract.SuccessCase;
import io.deal.generator.exceptions.ContractGenerationException;
import io.deal.generator.exceptions.UnsupportedMethodException;
import io.deal.generator.resolve.ResolvedMessage;
import io.deal.generator.resolve.ValueResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles method contracts into {@link DispatchSpec}s.
 *
 * Every request and response is resolved against the method types and every failure code is
 * validated. The first problem aborts compilation.
 */
public class CaseCompiler {
    private static final Logger logger = LoggerFactory.getLogger(CaseCompiler.class);
    private final ValueResolver resolver;

    public CaseCompiler(ValueResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Compiles every method of {@code service}, in schema order.
     */
    public CompiledService compileService(ServiceDescriptor service, ServiceContract contract)
            throws ContractGenerationException {
        for (String methodName : contract.methods().keySet()) {
            if (service.findMethodByName(methodName) == null) {
                logger.warn("Contract method {}/{} is not declared in the schema, ignoring it",
                    service.getName(), methodName);
            }
        }

        List<DispatchSpec> methods = new ArrayList<>();
        for (MethodDescriptor method : service.getMethods()) {
            methods.add(compile(method, contract.method(method.getName())));
        }
        return new CompiledService(service, methods);
    }

    public DispatchSpec compile(MethodDescriptor method, MethodContract contract) throws ContractGenerationException {
        String methodName = method.getService().getName() + "/" + method.getName();

        if (method.isClientStreaming() || method.isServerStreaming()) {
            if (!contract.isEmpty()) {
                throw new UnsupportedMethodException(
                    "Streaming method " + methodName + " cannot have contract cases");
            }
            logger.debug("Skipping streaming method {}", methodName);
            return new DispatchSpec(method, List.of());
        }

        List<DispatchEntry> entries = new ArrayList<>();

        List<SuccessCase> successCases = contract.successCases();
        for (int i = 0; i < successCases.size(); i++) {
            SuccessCase successCase = successCases.get(i);
            String description = describe(successCase.description(), "success", i);
            String location = String.format("%s success case '%s'", methodName, description);

            ResolvedMessage request = resolver.resolve(successCase.request(), method.getInputType(), location + " request");
            ResolvedMessage response = resolver.resolve(successCase.response(), method.getOutputType(), location + " response");
            entries.add(new DispatchEntry(description, request, new Outcome.Respond(response)));
        }

        List<FailureCase> failureCases = contract.failureCases();
        for (int i = 0; i < failureCases.size(); i++) {
            FailureCase failureCase = failureCases.get(i);
            String description = describe(failureCase.description(), "failure", i);
            String location = String.format("%s failure case '%s'", methodName, description);

            ResolvedMessage request = resolver.resolve(failureCase.request(), method.getInputType(), location + " request");
            ErrorSpec error = failureCase.error();
            ErrorCode code = ErrorCode.parse(error == null ? null : error.code(), location);
            String message = error.message() == null ? "" : error.message();
            entries.add(new DispatchEntry(description, request, new Outcome.Fail(code, message)));
        }

        warnShadowedEntries(methodName, entries);
        logger.debug("Compiled {} with {} success and {} failure cases",
            methodName, successCases.size(), failureCases.size());
        return new DispatchSpec(method, entries);
    }

    private String describe(String description, String kind, int index) {
        if (description == null || description.isBlank()) {
            return kind + " case #" + (index + 1);
        }
        return description;
    }

    private void warnShadowedEntries(String methodName, List<DispatchEntry> entries) {
        List<DynamicMessage> requests = entries.stream()
            .map(entry -> entry.request().toMessage())
            .toList();

        for (int later = 1; later < requests.size(); later++) {
            for (int earlier = 0; earlier < later; earlier++) {
                if (requests.get(earlier).equals(requests.get(later))) {
                    logger.warn("{}: case '{}' is shadowed by earlier case '{}' with an equal request",
                        methodName, entries.get(later).description(), entries.get(earlier).description());
                    break;
                }
            }
        }
    }
}
