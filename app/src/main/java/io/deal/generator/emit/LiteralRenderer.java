package io.deal.generator.emit;

import com.google.protobuf.ByteString;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import io.deal.generator.resolve.EnumValue;
import io.deal.generator.resolve.FieldValue;
import io.deal.generator.resolve.MapValue;
import io.deal.generator.resolve.MessageValue;
import io.deal.generator.resolve.RepeatedValue;
import io.deal.generator.resolve.ResolvedField;
import io.deal.generator.resolve.ResolvedMessage;
import io.deal.generator.resolve.ScalarValue;

import java.util.Base64;

/**
 * Renders resolved messages as Java builder expressions over the protoc generated classes,
 * for example {@code MyRequest.newBuilder().setRequestField("VALUE").build()}.
 *
 * Fields are set in traversal order; an empty message renders as its default instance.
 */
final class LiteralRenderer {

    CodeBlock message(ResolvedMessage message) {
        ClassName type = JavaNames.messageClass(message.type());
        if (message.isEmpty()) {
            return CodeBlock.of("$T.getDefaultInstance()", type);
        }

        CodeBlock.Builder code = CodeBlock.builder().add("$T.newBuilder()$>", type);
        for (ResolvedField field : message.fields()) {
            field.value().accept(new FieldSetter(field.descriptor(), code));
        }
        return code.add("\n.build()$<").build();
    }

    /**
     * Appends the builder calls populating one field.
     */
    private final class FieldSetter implements FieldValue.Visitor<Void> {
        private final String accessor;
        private final CodeBlock.Builder code;

        FieldSetter(FieldDescriptor field, CodeBlock.Builder code) {
            this.accessor = JavaNames.accessorName(field);
            this.code = code;
        }

        @Override
        public Void visitScalar(ScalarValue value) {
            return set(value);
        }

        @Override
        public Void visitEnum(EnumValue value) {
            return set(value);
        }

        @Override
        public Void visitMessage(MessageValue value) {
            return set(value);
        }

        @Override
        public Void visitRepeated(RepeatedValue value) {
            for (FieldValue element : value.elements()) {
                code.add("\n.add$L($L)", accessor + valueSuffix(element), expression(element));
            }
            return null;
        }

        @Override
        public Void visitMap(MapValue value) {
            for (MapValue.Entry entry : value.entries()) {
                code.add("\n.put$L($L, $L)", accessor + valueSuffix(entry.value()),
                    expression(entry.key()), expression(entry.value()));
            }
            return null;
        }

        private Void set(FieldValue value) {
            code.add("\n.set$L($L)", accessor + valueSuffix(value), expression(value));
            return null;
        }

        private String valueSuffix(FieldValue value) {
            return value.isUnrecognizedEnum() ? "Value" : "";
        }
    }

    CodeBlock expression(FieldValue value) {
        return value.accept(new ValueExpression());
    }

    /**
     * Java expression of a single (non-repeated) value.
     */
    private final class ValueExpression implements FieldValue.Visitor<CodeBlock> {

        @Override
        public CodeBlock visitScalar(ScalarValue value) {
            Object raw = value.value();
            return switch (value.javaType()) {
                case INT, BOOLEAN -> CodeBlock.of("$L", raw);
                case LONG -> CodeBlock.of("$LL", raw);
                case FLOAT -> floatLiteral((Float) raw);
                case DOUBLE -> doubleLiteral((Double) raw);
                case STRING -> CodeBlock.of("$S", raw);
                case BYTE_STRING -> bytesLiteral((ByteString) raw);
                default -> throw new IllegalStateException("Not a scalar type: " + value.javaType());
            };
        }

        @Override
        public CodeBlock visitEnum(EnumValue value) {
            if (value.isUnrecognizedEnum()) {
                return CodeBlock.of("$L", value.value().getNumber());
            }
            return CodeBlock.of("$T.$L", JavaNames.enumClass(value.value().getType()), value.value().getName());
        }

        @Override
        public CodeBlock visitMessage(MessageValue value) {
            return message(value.message());
        }

        @Override
        public CodeBlock visitRepeated(RepeatedValue value) {
            throw new IllegalStateException("Repeated values have no single expression");
        }

        @Override
        public CodeBlock visitMap(MapValue value) {
            throw new IllegalStateException("Map values have no single expression");
        }
    }

    private static CodeBlock floatLiteral(float value) {
        if (Float.isNaN(value)) {
            return CodeBlock.of("$T.NaN", Float.class);
        }
        if (Float.isInfinite(value)) {
            return CodeBlock.of(value > 0 ? "$T.POSITIVE_INFINITY" : "$T.NEGATIVE_INFINITY", Float.class);
        }
        return CodeBlock.of("$Lf", Float.toString(value));
    }

    private static CodeBlock doubleLiteral(double value) {
        if (Double.isNaN(value)) {
            return CodeBlock.of("$T.NaN", Double.class);
        }
        if (Double.isInfinite(value)) {
            return CodeBlock.of(value > 0 ? "$T.POSITIVE_INFINITY" : "$T.NEGATIVE_INFINITY", Double.class);
        }
        return CodeBlock.of("$L", Double.toString(value));
    }

    private static CodeBlock bytesLiteral(ByteString value) {
        if (value.isEmpty()) {
            return CodeBlock.of("$T.EMPTY", ByteString.class);
        }
        return CodeBlock.of("$T.copyFrom($T.getDecoder().decode($S))",
            ByteString.class, Base64.class, Base64.getEncoder().encodeToString(value.toByteArray()));
    }
}
