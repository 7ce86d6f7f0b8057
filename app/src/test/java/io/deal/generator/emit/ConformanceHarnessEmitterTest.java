package io.deal.generator.emit;

import io.deal.generator.TestSchemas;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConformanceHarnessEmitterTest {

    private final ConformanceHarnessEmitter emitter = new ConformanceHarnessEmitter(new LiteralRenderer());

    @Test
    @DisplayName("Should emit an abstract contract test on top of the runtime base class")
    void shouldEmitAbstractTest() {
        String test = emitter.emit(TestSchemas.compiledMyService()).toString();

        assertThat(test)
            .contains("public abstract static class MyServiceContractTest extends io.deal.runtime.ContractTestBase")
            .contains("@org.junit.jupiter.api.TestFactory")
            .contains("@org.junit.jupiter.api.DisplayName(\"Contract test for 'MyMethod' method\")")
            .contains("public java.util.stream.Stream<org.junit.jupiter.api.DynamicContainer> myMethodContract()")
            .contains("io.deal.example.MyServiceGrpc.MyServiceBlockingStub client = io.deal.example.MyServiceGrpc.newBlockingStub(channel());");
    }

    @Test
    @DisplayName("Should emit one dynamic test per case in success and failure containers")
    void shouldEmitCases() {
        String test = emitter.emit(TestSchemas.compiledMyService()).toString();

        assertThat(test)
            .contains("org.junit.jupiter.api.DynamicContainer.dynamicContainer(\"Success Cases\"")
            .contains("org.junit.jupiter.api.DynamicContainer.dynamicContainer(\"Failure Cases\"")
            .contains("org.junit.jupiter.api.DynamicTest.dynamicTest(\"value found\", () -> harness().expectResponse(client::myMethod,")
            .contains("org.junit.jupiter.api.DynamicTest.dynamicTest(\"value not found\", () -> harness().expectError(client::myMethod,")
            .contains("\"NOT_FOUND: ANOTHER_VALUE NotFound\"");
        assertThat(test.indexOf("Success Cases")).isLessThan(test.indexOf("Failure Cases"));
    }

    @Test
    @DisplayName("Should emit tests only for methods with contract cases")
    void shouldSkipUncontractedMethods() {
        String test = emitter.emit(TestSchemas.compiledCatalogService()).toString();

        assertThat(test)
            .contains("getItemContract()")
            .contains("\"PERMISSION_DENIED: no access to secret\"")
            .contains("\"NOT_FOUND: item missing not found\"")
            .doesNotContain("pingContract")
            .doesNotContain("watchItemsContract");
    }
}
