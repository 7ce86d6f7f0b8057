package io.deal.generator.emit;

import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Descriptors.EnumDescriptor;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.Descriptors.FileDescriptor;
import com.google.protobuf.Descriptors.MethodDescriptor;
import com.google.protobuf.Descriptors.ServiceDescriptor;
import com.google.protobuf.DescriptorProtos.FileOptions;
import com.squareup.javapoet.ClassName;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Java names of the classes protoc and the grpc-java plugin generate for a schema.
 *
 * Follows the rules of the protoc Java generator: {@code java_package} (falling back to the
 * proto package), {@code java_multiple_files}, and the outer class named by
 * {@code java_outer_classname} or derived from the file name, suffixed with
 * {@code OuterClass} when it collides with a type declared in the file.
 */
final class JavaNames {
    private static final Set<String> JAVA_KEYWORDS = Set.of(
        "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
        "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
        "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
        "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
        "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
        "volatile", "while", "true", "false", "null");

    // Accessor names taken by Object, MessageLite and MessageOrBuilder.
    private static final Set<String> RESERVED_ACCESSOR_NAMES = Set.of(
        "Class", "DefaultInstanceForType", "ParserForType", "SerializedSize", "AllFields",
        "DescriptorForType", "InitializationErrorString", "UnknownFields", "CachedSize");

    private JavaNames() {
    }

    static String javaPackage(FileDescriptor file) {
        FileOptions options = file.getOptions();
        if (options.hasJavaPackage()) {
            return options.getJavaPackage();
        }
        return file.getPackage();
    }

    static String outerClassName(FileDescriptor file) {
        FileOptions options = file.getOptions();
        if (options.hasJavaOuterClassname()) {
            return options.getJavaOuterClassname();
        }

        String baseName = file.getName();
        int slash = baseName.lastIndexOf('/');
        if (slash >= 0) {
            baseName = baseName.substring(slash + 1);
        }
        if (baseName.endsWith(".protodevel")) {
            baseName = baseName.substring(0, baseName.length() - ".protodevel".length());
        } else if (baseName.endsWith(".proto")) {
            baseName = baseName.substring(0, baseName.length() - ".proto".length());
        }

        String className = underscoresToCamelCase(baseName, true);
        if (declaresType(file, className)) {
            className += "OuterClass";
        }
        return className;
    }

    static ClassName messageClass(Descriptor type) {
        Deque<String> names = new ArrayDeque<>();
        for (Descriptor current = type; current != null; current = current.getContainingType()) {
            names.addFirst(current.getName());
        }
        return className(type.getFile(), List.copyOf(names));
    }

    static ClassName enumClass(EnumDescriptor type) {
        Deque<String> names = new ArrayDeque<>();
        names.addFirst(type.getName());
        for (Descriptor current = type.getContainingType(); current != null; current = current.getContainingType()) {
            names.addFirst(current.getName());
        }
        return className(type.getFile(), List.copyOf(names));
    }

    static ClassName grpcClass(ServiceDescriptor service) {
        return ClassName.get(javaPackage(service.getFile()), service.getName() + "Grpc");
    }

    static ClassName blockingStubClass(ServiceDescriptor service) {
        return grpcClass(service).nestedClass(service.getName() + "BlockingStub");
    }

    /**
     * Stub method name the grpc-java plugin derives from a method name.
     */
    static String stubMethodName(MethodDescriptor method) {
        String name = method.getName();
        StringBuilder result = new StringBuilder();
        result.append(Character.toLowerCase(name.charAt(0)));
        boolean afterUnderscore = false;
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '_') {
                afterUnderscore = true;
            } else {
                result.append(afterUnderscore ? Character.toUpperCase(c) : c);
                afterUnderscore = false;
            }
        }
        String methodName = result.toString();
        return JAVA_KEYWORDS.contains(methodName) ? methodName + "_" : methodName;
    }

    /**
     * Capitalized field name used in builder accessors, e.g. {@code request_field} becomes
     * {@code RequestField} in {@code setRequestField}.
     *
     * Names that would shadow a method of the generated message base classes get a trailing
     * {@code _} ({@code class} becomes {@code Class_}). When a repeated field and a singular field
     * of the same message would generate the same {@code getXCount()} or {@code getXList()}
     * accessor, or two fields capitalize to the same name, each of them gets its field number
     * appended ({@code items} and {@code items_count} become {@code Items3} and {@code ItemsCount2}).
     */
    static String accessorName(FieldDescriptor field) {
        String name = capitalizedFieldName(field);
        if (hasConflictingAccessors(field, name)) {
            return name + field.getNumber();
        }
        return name;
    }

    private static String capitalizedFieldName(FieldDescriptor field) {
        String fieldName = field.getType() == FieldDescriptor.Type.GROUP
            ? field.getMessageType().getName()
            : field.getName();
        String name = underscoresToCamelCase(fieldName, true);
        return RESERVED_ACCESSOR_NAMES.contains(name) ? name + "_" : name;
    }

    private static boolean hasConflictingAccessors(FieldDescriptor field, String name) {
        for (FieldDescriptor other : field.getContainingType().getFields()) {
            if (other == field) {
                continue;
            }
            String otherName = capitalizedFieldName(other);
            if (name.equals(otherName)
                || conflictsOneWay(field, name, other, otherName)
                || conflictsOneWay(other, otherName, field, name)) {
                return true;
            }
        }
        return false;
    }

    private static boolean conflictsOneWay(FieldDescriptor repeated, String repeatedName,
                                           FieldDescriptor singular, String singularName) {
        if (!repeated.isRepeated() || singular.isRepeated()) {
            return false;
        }
        return singularName.equals(repeatedName + "Count") || singularName.equals(repeatedName + "List");
    }

    static String underscoresToCamelCase(String input, boolean capitalizeFirst) {
        StringBuilder result = new StringBuilder();
        boolean capitalizeNext = capitalizeFirst;
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (c >= 'a' && c <= 'z') {
                result.append(capitalizeNext ? Character.toUpperCase(c) : c);
                capitalizeNext = false;
            } else if (c >= 'A' && c <= 'Z') {
                result.append(i == 0 && !capitalizeNext ? Character.toLowerCase(c) : c);
                capitalizeNext = false;
            } else if (c >= '0' && c <= '9') {
                result.append(c);
                capitalizeNext = true;
            } else {
                capitalizeNext = true;
            }
        }
        return result.toString();
    }

    private static ClassName className(FileDescriptor file, List<String> names) {
        String packageName = javaPackage(file);
        if (file.getOptions().getJavaMultipleFiles()) {
            return ClassName.get(packageName, names.get(0), names.subList(1, names.size()).toArray(new String[0]));
        }
        return ClassName.get(packageName, outerClassName(file), names.toArray(new String[0]));
    }

    private static boolean declaresType(FileDescriptor file, String name) {
        for (EnumDescriptor enumType : file.getEnumTypes()) {
            if (enumType.getName().equals(name)) {
                return true;
            }
        }
        for (ServiceDescriptor service : file.getServices()) {
            if (service.getName().equals(name)) {
                return true;
            }
        }
        for (Descriptor message : file.getMessageTypes()) {
            if (declaresType(message, name)) {
                return true;
            }
        }
        return false;
    }

    private static boolean declaresType(Descriptor message, String name) {
        if (message.getName().equals(name)) {
            return true;
        }
        for (EnumDescriptor enumType : message.getEnumTypes()) {
            if (enumType.getName().equals(name)) {
                return true;
            }
        }
        for (Descriptor nested : message.getNestedTypes()) {
            if (declaresType(nested, name)) {
                return true;
            }
        }
        return false;
    }
}
