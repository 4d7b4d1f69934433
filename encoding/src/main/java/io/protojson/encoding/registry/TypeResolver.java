package io.protojson.encoding.registry;

import org.jetbrains.annotations.NotNull;

import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.ExtensionRegistry;

/**
 * Read-only look-up of message types and extensions by name. Implementations must be safe for concurrent use.
 */
public interface TypeResolver {
    /**
     * @param fullName full message type name, e.g. {@code google.protobuf.Duration}
     * @return the descriptor or {@code null} if unknown
     */
    Descriptor findMessageByName(@NotNull String fullName);

    /**
     * Resolves a type URL as used by {@code google.protobuf.Any}: the type name is the part after the last '/'.
     *
     * @param typeUrl e.g. {@code type.googleapis.com/google.protobuf.Duration}
     * @return the descriptor or {@code null} if unknown
     */
    default Descriptor findMessageByUrl(final @NotNull String typeUrl) {
        return findMessageByName(typeUrl.substring(typeUrl.lastIndexOf('/') + 1));
    }

    /**
     * @param fullName full extension name, e.g. {@code my.pkg.Scope.ext_field}
     * @return the extension or {@code null} if unknown
     */
    FieldDescriptor findExtensionByName(@NotNull String fullName);

    /**
     * @param containingType full name of the extended message type
     * @param number extension field number
     * @return the extension or {@code null} if unknown
     */
    FieldDescriptor findExtensionByNumber(@NotNull String containingType, int number);

    /**
     * @return all known extensions, for decoding binary payloads
     */
    ExtensionRegistry getExtensionRegistry();
}
