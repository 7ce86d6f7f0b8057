package io.deal.generator.emit;

import com.google.protobuf.Descriptors.MethodDescriptor;
import com.google.protobuf.Descriptors.ServiceDescriptor;
import com.squareup.javapoet.AnnotationSpec;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeSpec;
import io.deal.generator.compile.CompiledService;
import io.deal.generator.compile.DispatchEntry;
import io.deal.generator.compile.DispatchSpec;
import io.deal.runtime.ContractTestBase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DynamicContainer;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

import javax.lang.model.element.Modifier;
import java.util.List;
import java.util.stream.Stream;

/**
 * Emits {@code <Service>ContractTest}: an abstract JUnit 5 class that checks a live server
 * implementation against the contract.
 *
 * Every method with contract cases gets a {@code @TestFactory} returning a "Success Cases"
 * and a "Failure Cases" container with one dynamic test per case, in contract order. Server
 * and channel lifecycle come from {@link ContractTestBase}.
 */
final class ConformanceHarnessEmitter {
    private final LiteralRenderer literals;

    ConformanceHarnessEmitter(LiteralRenderer literals) {
        this.literals = literals;
    }

    static String className(CompiledService service) {
        return service.service().getName() + "ContractTest";
    }

    TypeSpec emit(CompiledService service) {
        TypeSpec.Builder type = TypeSpec.classBuilder(className(service))
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT, Modifier.STATIC)
            .superclass(ContractTestBase.class)
            .addJavadoc("Contract test of {@code $L} implementations.\n", service.service().getFullName())
            .addJavadoc("\n<p>Extend it in a test source set and return the implementation under test from\n")
            .addJavadoc("{@code createService()}. Success cases must answer an equal response; failure cases\n")
            .addJavadoc("must fail with exactly the contract error text.\n");

        for (DispatchSpec spec : service.contractedMethods()) {
            type.addMethod(testFactory(service.service(), spec));
        }
        return type.build();
    }

    private MethodSpec testFactory(ServiceDescriptor service, DispatchSpec spec) {
        MethodDescriptor method = spec.method();
        String stubMethod = JavaNames.stubMethodName(method);

        List<CodeBlock> successTests = spec.successEntries().stream()
            .map(entry -> successTest(stubMethod, entry))
            .toList();
        List<CodeBlock> failureTests = spec.failureEntries().stream()
            .map(entry -> failureTest(stubMethod, entry))
            .toList();

        return MethodSpec.methodBuilder(stubMethod + "Contract")
            .addAnnotation(TestFactory.class)
            .addAnnotation(AnnotationSpec.builder(DisplayName.class)
                .addMember("value", "$S", "Contract test for '" + method.getName() + "' method")
                .build())
            .addModifiers(Modifier.PUBLIC)
            .returns(ParameterizedTypeName.get(ClassName.get(Stream.class), ClassName.get(DynamicContainer.class)))
            .addStatement("$T client = $T.newBlockingStub(channel())",
                JavaNames.blockingStubClass(service), JavaNames.grpcClass(service))
            .addStatement("return $T.of($>\n$L,\n$L$<)", Stream.class,
                container("Success Cases", successTests), container("Failure Cases", failureTests))
            .build();
    }

    private CodeBlock container(String name, List<CodeBlock> tests) {
        return CodeBlock.of("$T.dynamicContainer($S, $T.of($>$L$<))",
            DynamicContainer.class, name, Stream.class, CodeBlock.join(tests, ","));
    }

    private CodeBlock successTest(String stubMethod, DispatchEntry entry) {
        return CodeBlock.of("\n$T.dynamicTest($S, () -> harness().expectResponse(client::$L,$>\n$L,\n$L$<))",
            DynamicTest.class, entry.description(), stubMethod,
            literals.message(entry.request()), literals.message(entry.response()));
    }

    private CodeBlock failureTest(String stubMethod, DispatchEntry entry) {
        return CodeBlock.of("\n$T.dynamicTest($S, () -> harness().expectError(client::$L,$>\n$L,\n$S$<))",
            DynamicTest.class, entry.description(), stubMethod,
            literals.message(entry.request()), entry.failure().errorText());
    }
}
