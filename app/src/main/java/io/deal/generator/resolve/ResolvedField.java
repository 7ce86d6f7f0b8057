package io.deal.generator.resolve;

import com.google.protobuf.Descriptors.FieldDescriptor;

public record ResolvedField(FieldDescriptor descriptor, FieldValue value) {
}
