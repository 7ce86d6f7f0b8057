package io.deal.generator.compile;

import com.google.protobuf.Descriptors.MethodDescriptor;
import com.google.protobuf.DynamicMessage;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;

import java.util.List;

/**
 * Ordered match table of one method: success entries in contract order, then failure entries
 * in contract order. The first entry whose request equals the call wins; when none does the
 * call gets {@link Outcome.Fallback}.
 *
 * Emitters render this table; {@link #dispatch(Message)} evaluates it directly with the same
 * semantics the generated mock client has.
 */
public record DispatchSpec(
    MethodDescriptor method,
    List<DispatchEntry> entries
) {
    public DispatchSpec {
        entries = List.copyOf(entries);
    }

    public boolean isUnary() {
        return !method.isClientStreaming() && !method.isServerStreaming();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<DispatchEntry> successEntries() {
        return entries.stream().filter(DispatchEntry::isSuccess).toList();
    }

    public List<DispatchEntry> failureEntries() {
        return entries.stream().filter(DispatchEntry::isFailure).toList();
    }

    /**
     * Answers a call the way the generated mock client does.
     *
     * @param request a message of the method input type
     */
    public Outcome dispatch(Message request) {
        DynamicMessage actual = asInputMessage(request);
        for (DispatchEntry entry : entries) {
            if (entry.request().toMessage().equals(actual)) {
                return entry.outcome();
            }
        }
        return new Outcome.Fallback(method.getOutputType());
    }

    private DynamicMessage asInputMessage(Message request) {
        if (request.getDescriptorForType() != method.getInputType()) {
            throw new IllegalArgumentException(String.format("Expected a %s request but got %s",
                method.getInputType().getFullName(), request.getDescriptorForType().getFullName()));
        }
        try {
            return DynamicMessage.parseFrom(method.getInputType(), request.toByteString());
        } catch (InvalidProtocolBufferException e) {
            throw new IllegalArgumentException("Request cannot be read as " + method.getInputType().getFullName(), e);
        }
    }
}
