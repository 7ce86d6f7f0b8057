package io.deal.generator.resolve;

import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.Descriptors.FieldDescriptor.JavaType;

/**
 * A number, boolean, string or bytes value. {@code value} holds the protobuf Java
 * representation: {@code Integer}, {@code Long}, {@code Float}, {@code Double},
 * {@code Boolean}, {@code String} or {@code ByteString}.
 */
public record ScalarValue(JavaType javaType, Object value) implements FieldValue {

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitScalar(this);
    }

    @Override
    public Object toProtoValue(FieldDescriptor field) {
        return value;
    }
}
