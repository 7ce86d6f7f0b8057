package io.deal.generator.emit;

import com.google.protobuf.Descriptors.MethodDescriptor;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.TypeSpec;
import io.deal.generator.compile.CompiledService;
import io.deal.generator.compile.DispatchEntry;
import io.deal.generator.compile.DispatchSpec;
import io.deal.generator.compile.Outcome;
import io.grpc.Status;

import javax.lang.model.element.Modifier;

/**
 * Emits {@code <Service>ContractClient}: a stand-in for the blocking stub that answers every
 * call from the contract, without a server.
 *
 * Each method compares the request with the case requests in dispatch order using
 * {@code equals} and answers the first match: the case response, or a
 * {@code StatusRuntimeException} carrying the case status. A request matching no case is
 * answered with the output default instance and no error.
 */
final class MockClientEmitter {
    private final LiteralRenderer literals;

    MockClientEmitter(LiteralRenderer literals) {
        this.literals = literals;
    }

    static String className(CompiledService service) {
        return service.service().getName() + "ContractClient";
    }

    TypeSpec emit(CompiledService service) {
        TypeSpec.Builder type = TypeSpec.classBuilder(className(service))
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
            .addJavadoc("Contract mock of {@code $L} answering calls from the contract cases.\n",
                service.service().getFullName())
            .addJavadoc("\n<p><b>A request matching no contract case is answered with the default response\n")
            .addJavadoc("instance and no error.</b> A missing contract case therefore looks like an empty\n")
            .addJavadoc("successful response; assert on the response content in consumer tests.\n");

        for (DispatchSpec spec : service.unaryMethods()) {
            type.addMethod(method(spec));
        }
        return type.build();
    }

    private MethodSpec method(DispatchSpec spec) {
        MethodDescriptor method = spec.method();
        ClassName input = JavaNames.messageClass(method.getInputType());
        ClassName output = JavaNames.messageClass(method.getOutputType());

        MethodSpec.Builder builder = MethodSpec.methodBuilder(JavaNames.stubMethodName(method))
            .addModifiers(Modifier.PUBLIC)
            .returns(output)
            .addParameter(input, "request")
            .addJavadoc("Answers {@code $L} from $L contract case(s).\n", method.getName(), spec.entries().size())
            .addJavadoc("Unmatched requests get {@link $T#getDefaultInstance()}.\n", output);

        for (DispatchEntry entry : spec.entries()) {
            builder.beginControlFlow("if ($L.equals(request))", literals.message(entry.request()))
                .addComment("Description: $L", singleLine(entry.description()));

            if (entry.isSuccess()) {
                builder.addStatement("return $L", literals.message(entry.response()));
            } else {
                Outcome.Fail failure = entry.failure();
                builder.addStatement("throw $T.$L.withDescription($S).asRuntimeException()",
                    Status.class, failure.code().statusCode().name(), failure.message());
            }
            builder.endControlFlow();
        }

        return builder.addStatement("return $T.getDefaultInstance()", output).build();
    }

    private static String singleLine(String text) {
        return text.replaceAll("\\s+", " ").trim();
    }
}
