package io.deal.generator.resolve;

import com.google.protobuf.Descriptors.FieldDescriptor;

import java.util.List;

/**
 * Elements of a repeated (non-map) field in wire order. Elements are never repeated values.
 */
public record RepeatedValue(List<FieldValue> elements) implements FieldValue {
    public RepeatedValue {
        elements = List.copyOf(elements);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRepeated(this);
    }

    @Override
    public Object toProtoValue(FieldDescriptor field) {
        return elements.stream()
            .map(element -> element.toProtoValue(field))
            .toList();
    }
}
