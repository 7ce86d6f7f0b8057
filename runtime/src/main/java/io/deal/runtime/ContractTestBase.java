package io.deal.runtime;

import io.grpc.BindableService;
import io.grpc.Channel;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.TestInstance;

import java.io.IOException;

/**
 * Base class of every generated {@code <Service>ContractTest}.
 *
 * One {@link ContractHarness} is started before the first contract case of the class and
 * closed after the last one, whatever the outcome of the individual cases.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class ContractTestBase {
    private ContractHarness harness;

    /**
     * Supplies the server implementation the contract is checked against.
     */
    protected abstract BindableService createService();

    @BeforeAll
    protected void startContractServer() throws IOException {
        harness = ContractHarness.start(createService());
    }

    @AfterAll
    protected void stopContractServer() {
        if (harness != null) {
            harness.close();
        }
    }

    protected ContractHarness harness() {
        if (harness == null) {
            throw new IllegalStateException("Contract server is not running");
        }
        return harness;
    }

    protected Channel channel() {
        return harness().channel();
    }
}
