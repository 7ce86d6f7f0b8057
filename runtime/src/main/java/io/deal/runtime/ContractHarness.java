package io.deal.runtime;

import io.grpc.BindableService;
import io.grpc.Context;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Live in-process gRPC server and client channel used by generated contract tests.
 *
 * The server runs on gRPC's own executor, so every contract call crosses a real transport
 * boundary. Both ends cap inbound messages at {@link #BUFFER_SIZE}; a payload larger than
 * that surfaces as a transport error instead of being truncated.
 *
 * Calls run inside a cancellable {@link Context} that is cancelled by {@link #close()},
 * together with the channel and the server. Close the harness on every exit path.
 */
public final class ContractHarness implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ContractHarness.class);

    /** Maximum inbound message size for both server and channel (1 MiB). */
    public static final int BUFFER_SIZE = 1024 * 1024;

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final String serverName;
    private final Server server;
    private final ManagedChannel channel;
    private final Context.CancellableContext context;

    private ContractHarness(String serverName, Server server, ManagedChannel channel) {
        this.serverName = serverName;
        this.server = server;
        this.channel = channel;
        this.context = Context.current().withCancellation();
    }

    /**
     * Starts {@code service} on a fresh in-process server and opens a channel to it.
     *
     * @param service the server implementation under test
     * @return a running harness
     * @throws IOException if the server cannot be started
     */
    public static ContractHarness start(BindableService service) throws IOException {
        String serverName = InProcessServerBuilder.generateName();
        Server server = InProcessServerBuilder.forName(serverName)
            .maxInboundMessageSize(BUFFER_SIZE)
            .addService(service)
            .build()
            .start();

        ManagedChannel channel = InProcessChannelBuilder.forName(serverName)
            .maxInboundMessageSize(BUFFER_SIZE)
            .build();

        logger.debug("Started contract server {}", serverName);
        return new ContractHarness(serverName, server, channel);
    }

    public ManagedChannel channel() {
        return channel;
    }

    public boolean isClosed() {
        return server.isShutdown() && channel.isShutdown();
    }

    /**
     * Calls the server and asserts the response equals {@code expected}.
     * Any error returned by the server fails the assertion.
     */
    public <ReqT, RespT> void expectResponse(Function<ReqT, RespT> call, ReqT request, RespT expected) {
        RespT response = invokeExpectingSuccess(call, request);
        assertEquals(expected, response,
            () -> "expected response: " + expected + ", given response: " + response);
    }

    /**
     * Calls the server and asserts it fails with exactly {@code expectedError} as the full
     * error message text (for example {@code "NOT_FOUND: item NotFound"}).
     */
    public <ReqT, RespT> void expectError(Function<ReqT, RespT> call, ReqT request, String expectedError) {
        RespT response;
        try {
            response = invoke(call, request);
        } catch (StatusRuntimeException e) {
            assertEquals(expectedError, e.getMessage(),
                () -> "expected error: " + expectedError + ", given error: " + e.getMessage());
            return;
        }

        fail("an error was expected but no one was returned, given response: " + response);
    }

    private <ReqT, RespT> RespT invokeExpectingSuccess(Function<ReqT, RespT> call, ReqT request) {
        try {
            return invoke(call, request);
        } catch (StatusRuntimeException e) {
            return fail("unexpected error happened: " + e.getMessage(), e);
        }
    }

    private <ReqT, RespT> RespT invoke(Function<ReqT, RespT> call, ReqT request) {
        try {
            return context.call(() -> call.apply(request));
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Contract call failed", e);
        }
    }

    @Override
    public void close() {
        context.cancel(null);
        channel.shutdownNow();
        server.shutdownNow();
        try {
            channel.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            server.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while stopping contract server {}", serverName);
        }
        logger.debug("Stopped contract server {}", serverName);
    }
}
