package io.protojson.encoding;

import org.jetbrains.annotations.NotNull;

import com.google.protobuf.Message;

/**
 * Renders a message type whose JSON mapping differs from the generic object-of-fields form. The renderer replaces the
 * complete value of the message, i.e. it may write a scalar, a string, an array or an object.
 */
@FunctionalInterface
public interface CustomTypeRenderer {
    /**
     * @param encoder the active encoder providing the token writer and recursion into nested values
     * @param message the message to be rendered
     * @throws ProtoJsonException if the message has no valid JSON representation
     */
    void render(@NotNull MessageEncoder encoder, @NotNull Message message);
}
