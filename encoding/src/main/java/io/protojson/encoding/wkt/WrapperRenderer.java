package io.protojson.encoding.wkt;

import org.jetbrains.annotations.NotNull;

import io.protojson.encoding.CustomTypeRenderer;
import io.protojson.encoding.MessageEncoder;

import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.Message;

/**
 * Wrapper types ({@code google.protobuf.Int64Value} etc.) render as their single {@code value} field.
 */
final class WrapperRenderer implements CustomTypeRenderer {
    static final WrapperRenderer INSTANCE = new WrapperRenderer();

    private WrapperRenderer() {
    }

    @Override
    public void render(final @NotNull MessageEncoder encoder, final @NotNull Message message) {
        final FieldDescriptor value = message.getDescriptorForType().findFieldByNumber(1);
        encoder.writeSingular(message.getField(value), value);
    }
}
