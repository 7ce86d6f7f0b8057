package io.deal.generator.resolve;

import com.google.protobuf.Descriptors.FieldDescriptor;

/**
 * Value of one populated field, over the closed set of protobuf value kinds.
 *
 * The resolver produces these and the emitters consume them through {@link Visitor}, so
 * neither side inspects runtime types.
 */
public sealed interface FieldValue permits ScalarValue, EnumValue, MessageValue, RepeatedValue, MapValue {

    <R> R accept(Visitor<R> visitor);

    /**
     * Converts back to the representation {@code DynamicMessage.Builder#setField} expects for
     * {@code field}.
     */
    Object toProtoValue(FieldDescriptor field);

    /**
     * True for an open-enum number without a declared constant, which generated code can
     * only set through the {@code ...Value} accessors.
     */
    default boolean isUnrecognizedEnum() {
        return false;
    }

    interface Visitor<R> {
        R visitScalar(ScalarValue value);

        R visitEnum(EnumValue value);

        R visitMessage(MessageValue value);

        R visitRepeated(RepeatedValue value);

        R visitMap(MapValue value);
    }
}
