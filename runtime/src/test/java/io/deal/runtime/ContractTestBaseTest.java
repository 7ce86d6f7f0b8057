package io.deal.runtime;

import com.google.protobuf.StringValue;
import io.grpc.BindableService;
import io.grpc.CallOptions;
import io.grpc.stub.ClientCalls;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DynamicContainer;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;
import org.junit.platform.testkit.engine.EngineTestKit;

import java.util.function.Function;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.platform.engine.discovery.DiscoverySelectors.selectClass;

class ContractTestBaseTest {

    @Test
    @DisplayName("Should run each contract case as its own dynamic test against a live server")
    void shouldRunContractCases() {
        SampleContract.lastHarness = null;

        EngineTestKit.engine("junit-jupiter")
            .selectors(selectClass(SampleContract.class))
            .execute()
            .testEvents()
            .assertStatistics(stats -> stats.started(3).succeeded(2).failed(1));

        assertThat(SampleContract.lastHarness).isNotNull();
        assertThat(SampleContract.lastHarness.isClosed()).isTrue();
    }

    @Test
    @DisplayName("Should refuse harness access before the server is started")
    void shouldRequireRunningServer() {
        SampleContract contract = new SampleContract();

        assertThatThrownBy(contract::harness)
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("Contract server is not running");
    }

    /**
     * Shaped like a generated contract test subclass; run only through the test kit above.
     */
    static class SampleContract extends ContractTestBase {
        static volatile ContractHarness lastHarness;

        @Override
        protected BindableService createService() {
            return new LookupService();
        }

        @Override
        @AfterAll
        protected void stopContractServer() {
            ContractHarness running = harness();
            super.stopContractServer();
            lastHarness = running;
        }

        @TestFactory
        Stream<DynamicContainer> lookupContract() {
            Function<StringValue, StringValue> client = request ->
                ClientCalls.blockingUnaryCall(channel(), LookupService.LOOKUP, CallOptions.DEFAULT, request);
            return Stream.of(
                DynamicContainer.dynamicContainer("Success Cases", Stream.of(
                    DynamicTest.dynamicTest("value found",
                        () -> harness().expectResponse(client, StringValue.of("VALUE"), StringValue.of("42"))))),
                DynamicContainer.dynamicContainer("Failure Cases", Stream.of(
                    DynamicTest.dynamicTest("value not found",
                        () -> harness().expectError(client, StringValue.of("ANOTHER_VALUE"), "NOT_FOUND: ANOTHER_VALUE NotFound")),
                    DynamicTest.dynamicTest("reworded error",
                        () -> harness().expectError(client, StringValue.of("ANOTHER_VALUE"), "NOT_FOUND: another wording")))));
        }
    }
}
