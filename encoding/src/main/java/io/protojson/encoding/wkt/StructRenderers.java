package io.protojson.encoding.wkt;

import org.jetbrains.annotations.NotNull;

import io.protojson.encoding.CustomTypeRenderer;
import io.protojson.encoding.InvalidValueException;
import io.protojson.encoding.MessageEncoder;

import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.Descriptors.OneofDescriptor;
import com.google.protobuf.Message;

/**
 * Renderers for the dynamically typed JSON value types {@code google.protobuf.Struct}, {@code google.protobuf.ListValue}
 * and {@code google.protobuf.Value}, as well as {@code google.protobuf.Empty}.
 */
final class StructRenderers {
    private static final int NUMBER_VALUE = 2;

    static final CustomTypeRenderer EMPTY = (encoder, message) -> {
        encoder.getWriter().startObject();
        encoder.getWriter().endObject();
    };
    /** the 'fields' map, with sorted keys */
    static final CustomTypeRenderer STRUCT = StructRenderers::renderFirstField;
    /** the 'values' list */
    static final CustomTypeRenderer LIST_VALUE = StructRenderers::renderFirstField;
    static final CustomTypeRenderer VALUE = StructRenderers::renderValue;

    private StructRenderers() {
        // utility class
    }

    private static void renderFirstField(final MessageEncoder encoder, final Message message) {
        final FieldDescriptor field = message.getDescriptorForType().findFieldByNumber(1);
        encoder.writeValue(message.getField(field), field);
    }

    private static void renderValue(final @NotNull MessageEncoder encoder, final @NotNull Message message) {
        final Descriptor descriptor = message.getDescriptorForType();
        final OneofDescriptor kind = descriptor.getOneofs().get(0);
        final FieldDescriptor field = message.getOneofFieldDescriptor(kind);
        if (field == null) {
            throw new InvalidValueException(descriptor.getFullName() + ": none of the oneof fields is set");
        }
        final Object value = message.getField(field);
        if (field.getNumber() == NUMBER_VALUE) {
            final double number = (Double) value;
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                throw new InvalidValueException(field.getFullName() + ": invalid " + number + " value");
            }
        }
        encoder.writeSingular(value, field);
    }
}
