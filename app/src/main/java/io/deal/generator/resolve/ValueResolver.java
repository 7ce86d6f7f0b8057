package io.deal.generator.resolve;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Descriptors.EnumValueDescriptor;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.Descriptors.FileDescriptor;
import com.google.protobuf.DynamicMessage;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.util.JsonFormat;
import io.deal.generator.exceptions.FieldMismatchException;
import io.deal.generator.exceptions.SchemaConformanceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns untyped contract JSON into {@link ResolvedMessage}s of a given schema type.
 *
 * Resolution happens in two steps:
 * 1. Schema-aware decode with protobuf {@link JsonFormat} into a {@link DynamicMessage}.
 *    This enforces field names and value types; unknown JSON fields are rejected.
 * 2. Walk of the populated fields in ascending field number, pairing each one with the
 *    schema descriptor of the same number. A number the schema does not know means the
 *    contract and the schema have drifted.
 *
 * The number to descriptor table of each message type is built once and reused for every
 * case of the run.
 */
public class ValueResolver {
    private static final Logger logger = LoggerFactory.getLogger(ValueResolver.class);

    private final JsonFormat.Parser parser;
    /** Field tables keyed by message type identity */
    private final Map<Descriptor, Map<Integer, FieldDescriptor>> fieldTables = new HashMap<>();

    public ValueResolver() {
        this(JsonFormat.TypeRegistry.getEmptyTypeRegistry());
    }

    public ValueResolver(JsonFormat.TypeRegistry typeRegistry) {
        this.parser = JsonFormat.parser().usingTypeRegistry(typeRegistry);
    }

    /**
     * Creates a resolver that can decode {@code google.protobuf.Any} values packing any
     * message type declared in {@code files} or their imports.
     */
    public static ValueResolver forFiles(Collection<FileDescriptor> files) {
        JsonFormat.TypeRegistry.Builder registry = JsonFormat.TypeRegistry.newBuilder();
        for (FileDescriptor file : files) {
            registry.add(file.getMessageTypes());
        }
        return new ValueResolver(registry.build());
    }

    /**
     * Resolves a contract value against a message type.
     *
     * @param value the contract JSON value
     * @param type the schema message type the value must conform to
     * @param location where the value sits in the contract, for error messages
     * @throws SchemaConformanceException if the value does not decode as {@code type}
     * @throws FieldMismatchException if a populated field is unknown to {@code type}
     */
    public ResolvedMessage resolve(JsonNode value, Descriptor type, String location)
            throws SchemaConformanceException, FieldMismatchException {
        DynamicMessage decoded = decode(value, type, location);
        return collect(decoded, type, location);
    }

    private DynamicMessage decode(JsonNode value, Descriptor type, String location) throws SchemaConformanceException {
        if (value == null || value.isNull() || value.isMissingNode()) {
            throw new SchemaConformanceException(
                String.format("%s: missing value for message %s", location, type.getFullName()),
                type.getFullName());
        }

        DynamicMessage.Builder builder = DynamicMessage.newBuilder(type);
        try {
            parser.merge(value.toString(), builder);
        } catch (InvalidProtocolBufferException e) {
            throw new SchemaConformanceException(
                String.format("%s: value does not conform to message %s: %s", location, type.getFullName(), e.getMessage()),
                type.getFullName(), e);
        }
        return builder.build();
    }

    /**
     * Pairs every populated field of {@code decoded} with the descriptor of the same number
     * in {@code schemaType}.
     */
    ResolvedMessage collect(Message decoded, Descriptor schemaType, String location) throws FieldMismatchException {
        Map<Integer, FieldDescriptor> fieldTable = fieldTable(schemaType);
        List<ResolvedField> fields = new ArrayList<>();

        for (Map.Entry<FieldDescriptor, Object> entry : decoded.getAllFields().entrySet()) {
            FieldDescriptor populated = entry.getKey();
            FieldDescriptor field = fieldTable.get(populated.getNumber());
            if (field == null) {
                throw new FieldMismatchException(
                    String.format("%s: field not found %s while inspecting message %s",
                        location, populated.getName(), schemaType.getName()),
                    populated.getName(), schemaType.getFullName());
            }

            fields.add(new ResolvedField(field, toFieldValue(field, entry.getValue(), location)));
        }

        return new ResolvedMessage(schemaType, fields);
    }

    private FieldValue toFieldValue(FieldDescriptor field, Object raw, String location) throws FieldMismatchException {
        if (field.isMapField()) {
            FieldDescriptor keyField = field.getMessageType().findFieldByNumber(1);
            FieldDescriptor valueField = field.getMessageType().findFieldByNumber(2);
            List<MapValue.Entry> entries = new ArrayList<>();
            for (Object element : (List<?>) raw) {
                Message entry = (Message) element;
                entries.add(new MapValue.Entry(
                    singleValue(keyField, entry.getField(keyField), location),
                    singleValue(valueField, entry.getField(valueField), location)));
            }
            return new MapValue(entries);
        }

        if (field.isRepeated()) {
            List<FieldValue> elements = new ArrayList<>();
            for (Object element : (List<?>) raw) {
                elements.add(singleValue(field, element, location));
            }
            return new RepeatedValue(elements);
        }

        return singleValue(field, raw, location);
    }

    private FieldValue singleValue(FieldDescriptor field, Object raw, String location) throws FieldMismatchException {
        return switch (field.getJavaType()) {
            case ENUM -> new EnumValue((EnumValueDescriptor) raw);
            case MESSAGE -> new MessageValue(
                collect((Message) raw, field.getMessageType(), location + "." + field.getName()));
            default -> new ScalarValue(field.getJavaType(), raw);
        };
    }

    private Map<Integer, FieldDescriptor> fieldTable(Descriptor type) {
        return fieldTables.computeIfAbsent(type, key -> {
            logger.debug("Building field table for message {}", key.getFullName());
            return key.getFields().stream()
                .collect(Collectors.toMap(FieldDescriptor::getNumber, Function.identity()));
        });
    }

    int cachedTypeCount() {
        return fieldTables.size();
    }
}
