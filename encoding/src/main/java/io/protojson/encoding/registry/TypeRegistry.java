package io.protojson.encoding.registry;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.protobuf.AnyProto;
import com.google.protobuf.ApiProto;
import com.google.protobuf.DescriptorProtos;
import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.Descriptors.FileDescriptor;
import com.google.protobuf.DurationProto;
import com.google.protobuf.DynamicMessage;
import com.google.protobuf.EmptyProto;
import com.google.protobuf.ExtensionRegistry;
import com.google.protobuf.FieldMaskProto;
import com.google.protobuf.SourceContextProto;
import com.google.protobuf.StructProto;
import com.google.protobuf.TimestampProto;
import com.google.protobuf.TypeProto;
import com.google.protobuf.WrappersProto;

/**
 * Immutable {@link TypeResolver} built from message and file descriptors.
 *
 * <pre>{@code
 * final TypeRegistry registry = TypeRegistry.newBuilder().add(MyProto.getDescriptor()).build();
 * }</pre>
 */
public final class TypeRegistry implements TypeResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(TypeRegistry.class);
    private static final TypeRegistry EMPTY = newBuilder().build();
    private final Map<String, Descriptor> messages;
    private final Map<String, FieldDescriptor> extensions;
    private final Map<String, Map<Integer, FieldDescriptor>> extensionsByNumber;
    private final ExtensionRegistry extensionRegistry;

    private TypeRegistry(final Builder builder) {
        messages = Map.copyOf(builder.messages);
        extensions = Map.copyOf(builder.extensions);
        final Map<String, Map<Integer, FieldDescriptor>> byNumber = new HashMap<>();
        final ExtensionRegistry registry = ExtensionRegistry.newInstance();
        for (final FieldDescriptor extension : extensions.values()) {
            byNumber.computeIfAbsent(extension.getContainingType().getFullName(), k -> new HashMap<>()).put(extension.getNumber(), extension);
            if (extension.getJavaType() == FieldDescriptor.JavaType.MESSAGE) {
                registry.add(extension, DynamicMessage.getDefaultInstance(extension.getMessageType()));
            } else {
                registry.add(extension);
            }
        }
        byNumber.replaceAll((k, v) -> Map.copyOf(v));
        extensionsByNumber = Map.copyOf(byNumber);
        extensionRegistry = registry.getUnmodifiable();
    }

    /**
     * @return the process-wide default registry containing the {@code google.protobuf} well-known types
     */
    public static TypeRegistry global() {
        return GlobalHolder.INSTANCE;
    }

    public static TypeRegistry empty() {
        return EMPTY;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public Descriptor findMessageByName(final @NotNull String fullName) {
        return messages.get(fullName);
    }

    @Override
    public FieldDescriptor findExtensionByName(final @NotNull String fullName) {
        return extensions.get(fullName);
    }

    @Override
    public FieldDescriptor findExtensionByNumber(final @NotNull String containingType, final int number) {
        return extensionsByNumber.getOrDefault(containingType, Map.of()).get(number);
    }

    @Override
    public ExtensionRegistry getExtensionRegistry() {
        return extensionRegistry;
    }

    public int getMessageCount() {
        return messages.size();
    }

    public int getExtensionCount() {
        return extensions.size();
    }

    @Override
    public String toString() {
        return "TypeRegistry{messages=" + messages.size() + ", extensions=" + extensions.size() + '}';
    }

    public static final class Builder {
        private final Map<String, Descriptor> messages = new HashMap<>();
        private final Map<String, FieldDescriptor> extensions = new HashMap<>();

        private Builder() {
            // use TypeRegistry.newBuilder()
        }

        /**
         * Adds the message types including their nested types and the extensions declared in their scope.
         *
         * @param descriptors message types
         * @return this builder
         */
        public Builder add(final @NotNull Descriptor... descriptors) {
            for (final Descriptor descriptor : descriptors) {
                addMessage(descriptor);
            }
            return this;
        }

        /**
         * Adds all message types and extensions declared in the given files. Dependencies are not added.
         *
         * @param files file descriptors
         * @return this builder
         */
        public Builder add(final @NotNull FileDescriptor... files) {
            for (final FileDescriptor file : files) {
                file.getMessageTypes().forEach(this::addMessage);
                addExtensions(file.getExtensions());
            }
            return this;
        }

        public Builder addExtension(final @NotNull FieldDescriptor extension) {
            if (!extension.isExtension()) {
                throw new IllegalArgumentException(extension.getFullName() + " is not an extension");
            }
            putIfAbsent(extensions, extension.getFullName(), extension, "extension");
            return this;
        }

        public TypeRegistry build() {
            final TypeRegistry registry = new TypeRegistry(this);
            LOGGER.atDebug().addArgument(registry).log("built {}");
            return registry;
        }

        private void addMessage(final Descriptor descriptor) {
            if (!putIfAbsent(messages, descriptor.getFullName(), descriptor, "message")) {
                return;
            }
            descriptor.getNestedTypes().forEach(this::addMessage);
            addExtensions(descriptor.getExtensions());
        }

        private void addExtensions(final List<FieldDescriptor> fileOrScopeExtensions) {
            fileOrScopeExtensions.forEach(this::addExtension);
        }

        private static <T> boolean putIfAbsent(final Map<String, T> map, final String name, final T value, final String kind) {
            final T existing = map.putIfAbsent(name, value);
            if (existing == null) {
                return true;
            }
            if (!Objects.equals(existing, value)) {
                LOGGER.atWarn().addArgument(kind).addArgument(name).log("ignoring conflicting {} registration of '{}'");
            }
            return false;
        }
    }

    private static final class GlobalHolder {
        private static final Collection<FileDescriptor> WELL_KNOWN_FILES = List.of(AnyProto.getDescriptor(), ApiProto.getDescriptor(), DurationProto.getDescriptor(),
                EmptyProto.getDescriptor(), FieldMaskProto.getDescriptor(), SourceContextProto.getDescriptor(), StructProto.getDescriptor(), TimestampProto.getDescriptor(),
                TypeProto.getDescriptor(), WrappersProto.getDescriptor(), DescriptorProtos.getDescriptor());
        private static final TypeRegistry INSTANCE = newBuilder().add(WELL_KNOWN_FILES.toArray(new FileDescriptor[0])).build();
    }
}
