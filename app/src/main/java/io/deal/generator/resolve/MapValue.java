package io.deal.generator.resolve;

import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.DynamicMessage;

import java.util.List;

/**
 * Entries of a map field in the order the decoder produced them.
 */
public record MapValue(List<Entry> entries) implements FieldValue {
    public MapValue {
        entries = List.copyOf(entries);
    }

    public record Entry(FieldValue key, FieldValue value) {
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMap(this);
    }

    @Override
    public Object toProtoValue(FieldDescriptor field) {
        Descriptor entryType = field.getMessageType();
        FieldDescriptor keyField = entryType.findFieldByNumber(1);
        FieldDescriptor valueField = entryType.findFieldByNumber(2);
        return entries.stream()
            .map(entry -> DynamicMessage.newBuilder(entryType)
                .setField(keyField, entry.key().toProtoValue(keyField))
                .setField(valueField, entry.value().toProtoValue(valueField))
                .build())
            .toList();
    }
}
