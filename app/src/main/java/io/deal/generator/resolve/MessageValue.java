package io.deal.generator.resolve;

import com.google.protobuf.Descriptors.FieldDescriptor;

public record MessageValue(ResolvedMessage message) implements FieldValue {

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMessage(this);
    }

    @Override
    public Object toProtoValue(FieldDescriptor field) {
        return message.toMessage();
    }
}
