package io.deal.generator.emit;

import com.google.protobuf.Descriptors.FileDescriptor;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.TypeSpec;
import io.deal.generator.GeneratedUnit;
import io.deal.generator.compile.CompiledService;

import javax.lang.model.element.Modifier;
import java.util.List;

/**
 * Renders the contract unit of one proto file: {@code <OuterClass>Contracts} in the file's
 * Java package, holding a mock client and a contract test per contracted service.
 */
public class ContractFileEmitter {
    static final String PLUGIN_NAME = "protoc-gen-deal";

    private final MockClientEmitter mockClientEmitter;
    private final ConformanceHarnessEmitter harnessEmitter;

    public ContractFileEmitter() {
        LiteralRenderer literals = new LiteralRenderer();
        this.mockClientEmitter = new MockClientEmitter(literals);
        this.harnessEmitter = new ConformanceHarnessEmitter(literals);
    }

    public static String className(FileDescriptor file) {
        return JavaNames.outerClassName(file) + "Contracts";
    }

    public GeneratedUnit emit(FileDescriptor file, List<CompiledService> services) {
        String packageName = JavaNames.javaPackage(file);
        String className = className(file);

        TypeSpec.Builder type = TypeSpec.classBuilder(className)
            .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
            .addJavadoc("Contract mock clients and contract tests for services of {@code $L}.\n", file.getName())
            .addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PRIVATE).build());

        for (CompiledService service : services) {
            type.addType(mockClientEmitter.emit(service));
            type.addType(harnessEmitter.emit(service));
        }

        JavaFile javaFile = JavaFile.builder(packageName, type.build())
            .addFileComment("Code generated by $L. DO NOT EDIT.\n", PLUGIN_NAME)
            .addFileComment("source: $L", file.getName())
            .skipJavaLangImports(true)
            .indent("    ")
            .build();

        String directory = packageName.isEmpty() ? "" : packageName.replace('.', '/') + "/";
        return new GeneratedUnit(directory + className + ".java", javaFile.toString());
    }
}
