package io.deal.generator.resolve;

import com.google.protobuf.Descriptors.EnumValueDescriptor;
import com.google.protobuf.Descriptors.FieldDescriptor;

public record EnumValue(EnumValueDescriptor value) implements FieldValue {

    @Override
    public boolean isUnrecognizedEnum() {
        return value.getType().findValueByNumber(value.getNumber()) == null;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitEnum(this);
    }

    @Override
    public Object toProtoValue(FieldDescriptor field) {
        return value;
    }
}
