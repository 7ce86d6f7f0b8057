package io.deal.generator;

import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.Descriptors.DescriptorValidationException;
import com.google.protobuf.Descriptors.FileDescriptor;
import io.deal.generator.exceptions.SchemaLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Links the {@link FileDescriptorProto}s handed over by protoc (or read from a descriptor set)
 * into {@link FileDescriptor}s.
 *
 * Files are linked dependencies first regardless of input order. Every import must be
 * present in the input.
 */
public class SchemaLoader {
    private static final Logger logger = LoggerFactory.getLogger(SchemaLoader.class);

    /**
     * @return linked files keyed by proto file name, in input order
     * @throws SchemaLoadException if an import is missing or a file does not link
     */
    public Map<String, FileDescriptor> load(List<FileDescriptorProto> protos) throws SchemaLoadException {
        Map<String, FileDescriptorProto> protosByName = new LinkedHashMap<>();
        for (FileDescriptorProto proto : protos) {
            protosByName.put(proto.getName(), proto);
        }

        Map<String, FileDescriptor> linked = new LinkedHashMap<>();
        for (String name : protosByName.keySet()) {
            link(name, protosByName, linked, new HashSet<>());
        }

        Map<String, FileDescriptor> result = new LinkedHashMap<>();
        for (String name : protosByName.keySet()) {
            result.put(name, linked.get(name));
        }
        logger.debug("Linked {} proto files", result.size());
        return result;
    }

    private FileDescriptor link(String name, Map<String, FileDescriptorProto> protosByName,
                                Map<String, FileDescriptor> linked, Set<String> inProgress) throws SchemaLoadException {
        FileDescriptor existing = linked.get(name);
        if (existing != null) {
            return existing;
        }

        FileDescriptorProto proto = protosByName.get(name);
        if (proto == null) {
            throw new SchemaLoadException("Proto file " + name + " is imported but was not provided");
        }
        if (!inProgress.add(name)) {
            throw new SchemaLoadException("Proto file " + name + " imports itself");
        }

        FileDescriptor[] dependencies = new FileDescriptor[proto.getDependencyCount()];
        for (int i = 0; i < dependencies.length; i++) {
            dependencies[i] = link(proto.getDependency(i), protosByName, linked, inProgress);
        }

        try {
            FileDescriptor file = FileDescriptor.buildFrom(proto, dependencies);
            linked.put(name, file);
            inProgress.remove(name);
            return file;
        } catch (DescriptorValidationException e) {
            throw new SchemaLoadException("Proto file " + name + " is invalid: " + e.getMessage(), e);
        }
    }
}
