package io.deal.generator.resolve;

import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.DynamicMessage;

import java.util.List;

/**
 * A contract JSON value validated against its message type.
 *
 * Only populated fields are present, in ascending field number. Unpopulated fields keep
 * their protobuf defaults.
 *
 * @param type the schema message type
 * @param fields populated fields in traversal order
 */
public record ResolvedMessage(
    Descriptor type,
    List<ResolvedField> fields
) {
    public ResolvedMessage {
        fields = List.copyOf(fields);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * Rebuilds the message from the resolved fields. The result equals the message the
     * contract JSON decodes to.
     */
    public DynamicMessage toMessage() {
        DynamicMessage.Builder builder = DynamicMessage.newBuilder(type);
        for (ResolvedField field : fields) {
            builder.setField(field.descriptor(), field.value().toProtoValue(field.descriptor()));
        }
        return builder.build();
    }
}
