package io.deal.runtime;

import com.google.protobuf.StringValue;
import io.grpc.BindableService;
import io.grpc.MethodDescriptor;
import io.grpc.ServerServiceDefinition;
import io.grpc.Status;
import io.grpc.protobuf.ProtoUtils;
import io.grpc.stub.ServerCalls;
import io.grpc.stub.StreamObserver;

/**
 * Hand-wired unary service standing in for a protoc generated implementation:
 * {@code "VALUE"} answers {@code "42"}, {@code "ANOTHER_VALUE"} fails with NOT_FOUND and
 * anything else is echoed back.
 */
class LookupService implements BindableService {
    static final String SERVICE_NAME = "deal.test.LookupService";

    static final MethodDescriptor<StringValue, StringValue> LOOKUP =
        MethodDescriptor.<StringValue, StringValue>newBuilder()
            .setType(MethodDescriptor.MethodType.UNARY)
            .setFullMethodName(MethodDescriptor.generateFullMethodName(SERVICE_NAME, "Lookup"))
            .setRequestMarshaller(ProtoUtils.marshaller(StringValue.getDefaultInstance()))
            .setResponseMarshaller(ProtoUtils.marshaller(StringValue.getDefaultInstance()))
            .build();

    private final String notFoundMessage;

    LookupService() {
        this("ANOTHER_VALUE NotFound");
    }

    LookupService(String notFoundMessage) {
        this.notFoundMessage = notFoundMessage;
    }

    @Override
    public ServerServiceDefinition bindService() {
        return ServerServiceDefinition.builder(SERVICE_NAME)
            .addMethod(LOOKUP, ServerCalls.asyncUnaryCall(this::lookup))
            .build();
    }

    private void lookup(StringValue request, StreamObserver<StringValue> responseObserver) {
        switch (request.getValue()) {
            case "VALUE" -> {
                responseObserver.onNext(StringValue.of("42"));
                responseObserver.onCompleted();
            }
            case "ANOTHER_VALUE" -> responseObserver.onError(
                Status.NOT_FOUND.withDescription(notFoundMessage).asRuntimeException());
            default -> {
                responseObserver.onNext(request);
                responseObserver.onCompleted();
            }
        }
    }
}
