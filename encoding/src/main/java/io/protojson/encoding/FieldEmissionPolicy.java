package io.protojson.encoding;

import java.util.ArrayList;
import java.util.List;

import org.jetbrains.annotations.NotNull;

import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.MessageOrBuilder;

/**
 * Decides which declared fields of a message are written, under which name and with which value.
 */
final class FieldEmissionPolicy {
    private final EncoderOptions options;

    FieldEmissionPolicy(final @NotNull EncoderOptions options) {
        this.options = options;
    }

    /**
     * @param message the message to be inspected
     * @return emitted declared fields in schema declaration order; extensions are not included
     */
    List<EmittedField> select(final @NotNull MessageOrBuilder message) {
        final List<FieldDescriptor> fields = message.getDescriptorForType().getFields();
        final List<EmittedField> emitted = new ArrayList<>(fields.size());
        for (final FieldDescriptor field : fields) {
            Object value = message.getField(field);
            if (!isPopulated(message, field)) {
                // oneof members (incl. proto3 'optional') carry explicit presence and are never filled in
                if (!options.isEmitUnpopulated() || field.getContainingOneof() != null) {
                    continue;
                }
                if (rendersUnpopulatedAsNull(field)) {
                    value = null;
                }
            }
            emitted.add(new EmittedField(getFieldName(field), field, value));
        }
        return emitted;
    }

    /**
     * @param field declared field
     * @return the JSON name, or the declared name if {@link EncoderOptions#isUseProtoNames()}; group fields are always
     *         named after their group type
     */
    String getFieldName(final @NotNull FieldDescriptor field) {
        if (field.getType() == FieldDescriptor.Type.GROUP) {
            return field.getMessageType().getName();
        }
        return options.isUseProtoNames() ? field.getName() : field.getJsonName();
    }

    static boolean isPopulated(final @NotNull MessageOrBuilder message, final @NotNull FieldDescriptor field) {
        if (field.isRepeated()) {
            return message.getRepeatedFieldCount(field) > 0;
        }
        return message.hasField(field);
    }

    /**
     * Singular message fields and singular scalars with explicit presence (proto2 semantics) have no meaningful zero
     * value and are rendered as {@code null}; proto3 scalars render their zero value, lists and maps an empty container.
     *
     * @param field unpopulated field
     * @return {@code true} if the field is to be rendered as JSON {@code null}
     */
    static boolean rendersUnpopulatedAsNull(final @NotNull FieldDescriptor field) {
        if (field.isRepeated()) {
            return false;
        }
        return field.getJavaType() == FieldDescriptor.JavaType.MESSAGE || field.hasPresence();
    }

    static final class EmittedField {
        private final String name;
        private final FieldDescriptor descriptor;
        private final Object value;

        EmittedField(final String name, final FieldDescriptor descriptor, final Object value) {
            this.name = name;
            this.descriptor = descriptor;
            this.value = value;
        }

        String getName() {
            return name;
        }

        FieldDescriptor getDescriptor() {
            return descriptor;
        }

        /**
         * @return the value to be rendered, {@code null} for an explicit JSON null
         */
        Object getValue() {
            return value;
        }
    }
}
