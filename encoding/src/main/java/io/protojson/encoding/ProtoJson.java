package io.protojson.encoding;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.protojson.json.JsonWriterException;

import com.google.protobuf.Message;

/**
 * Encodes protocol buffer messages into their canonical JSON mapping.
 *
 * <pre>{@code
 * final EncodeResult result = ProtoJson.encodeWith(EncoderOptions.newBuilder().setIndent("  ").build(), message);
 * final String json = new String(result.getOrThrow(), StandardCharsets.UTF_8);
 * }</pre>
 *
 * Encoding is a pure function of the message content and the options: map entries and extensions are sorted, so that
 * equal messages produce byte-identical output. Concurrent calls are independent of each other.
 */
public final class ProtoJson {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProtoJson.class);

    private ProtoJson() {
        // utility class
    }

    /**
     * @param message the message to be encoded
     * @return the result of the encoding using {@link EncoderOptions#defaults()}
     * @see #encodeWith(EncoderOptions, Message)
     */
    public static EncodeResult encode(final @NotNull Message message) {
        return encodeWith(EncoderOptions.defaults(), message);
    }

    /**
     * Encodes the message. Recoverable errors are reported through the returned {@link EncodeResult}:
     * <ul>
     * <li>{@link UnsupportedSchemaException}, {@link InvalidValueException}, {@link RecursionLimitException} and
     * {@link JsonWriterException} abort the encoding, no bytes are returned;</li>
     * <li>{@link IncompleteMessageException} is reported after the encoding if {@link EncoderOptions#isAllowPartial()}
     * is not set and required fields are missing; the produced bytes are returned nevertheless.</li>
     * </ul>
     *
     * @param options encoder configuration
     * @param message the message to be encoded
     * @return the encoded JSON and/or the error
     * @throws IllegalStateException if the message schema contains a field of unknown kind
     */
    public static EncodeResult encodeWith(final @NotNull EncoderOptions options, final @NotNull Message message) {
        final MessageEncoder encoder = new MessageEncoder(options);
        try {
            encoder.writeMessage(message);
        } catch (ProtoJsonException | JsonWriterException e) {
            LOGGER.atDebug().addArgument(message.getDescriptorForType().getFullName()).addArgument(e.getMessage()).log("could not encode '{}': {}");
            return EncodeResult.failure(e);
        }

        final byte[] bytes = encoder.getBytes();
        if (options.isAllowPartial() || message.isInitialized()) {
            return EncodeResult.success(bytes);
        }
        final IncompleteMessageException incomplete = new IncompleteMessageException(message.getDescriptorForType().getFullName(), message.findInitializationErrors());
        LOGGER.atDebug().addArgument(incomplete.getMessage()).log("encoded incomplete message - {}");
        return EncodeResult.incomplete(bytes, incomplete);
    }
}
