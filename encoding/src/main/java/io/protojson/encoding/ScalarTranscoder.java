package io.protojson.encoding;

import java.util.Base64;

import org.jetbrains.annotations.NotNull;

import io.protojson.json.JsonTokenWriter;

import com.google.protobuf.ByteString;
import com.google.protobuf.Descriptors.EnumValueDescriptor;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.Message;

/**
 * Renders one singular value according to its field kind.
 *
 * <p>
 * 64-bit integers are written as JSON strings since JSON numbers are commonly parsed as IEEE doubles and lose precision
 * beyond 53 bits.
 */
final class ScalarTranscoder {
    private static final Base64.Encoder BASE64 = Base64.getEncoder();
    private final MessageEncoder encoder;
    private final JsonTokenWriter writer;

    ScalarTranscoder(final @NotNull MessageEncoder encoder) {
        this.encoder = encoder;
        this.writer = encoder.getWriter();
    }

    /**
     * @param value boxed value as provided by protobuf reflection, {@code null} renders as JSON {@code null}
     * @param field descriptor of the field (or list element/map value) holding the value
     * @throws IllegalStateException if the field kind is unknown
     */
    void writeSingular(final Object value, final @NotNull FieldDescriptor field) {
        if (value == null) {
            writer.writeNull();
            return;
        }

        switch (field.getType()) {
        case BOOL:
            writer.writeBool((Boolean) value);
            break;
        case STRING:
            writer.writeString((String) value);
            break;
        case INT32:
        case SINT32:
        case SFIXED32:
            writer.writeInt((Integer) value);
            break;
        case UINT32:
        case FIXED32:
            writer.writeUint(Integer.toUnsignedLong((Integer) value));
            break;
        case INT64:
        case SINT64:
        case SFIXED64:
            writer.writeString(Long.toString((Long) value));
            break;
        case UINT64:
        case FIXED64:
            writer.writeString(Long.toUnsignedString((Long) value));
            break;
        case FLOAT:
            writer.writeFloat((Float) value, 32);
            break;
        case DOUBLE:
            writer.writeFloat((Double) value, 64);
            break;
        case BYTES:
            writer.writeString(BASE64.encodeToString(((ByteString) value).toByteArray()));
            break;
        case ENUM:
            writeEnum((EnumValueDescriptor) value, field);
            break;
        case MESSAGE:
        case GROUP:
            encoder.writeMessage((Message) value);
            break;
        default:
            throw new IllegalStateException(field.getFullName() + " has unknown kind: " + field.getType());
        }
    }

    private void writeEnum(final EnumValueDescriptor value, final FieldDescriptor field) {
        if (ProtoJsonConstants.NULL_VALUE_ENUM.equals(field.getEnumType().getFullName())) {
            writer.writeNull();
            return;
        }
        // unknown numbers of open enums have no symbolic name
        final EnumValueDescriptor known = field.getEnumType().findValueByNumber(value.getNumber());
        if (encoder.getOptions().isUseEnumNumbers() || known == null) {
            writer.writeInt(value.getNumber());
        } else {
            writer.writeString(known.getName());
        }
    }
}
