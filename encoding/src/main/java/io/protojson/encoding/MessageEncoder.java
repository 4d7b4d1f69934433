package io.protojson.encoding;

import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.protojson.json.JsonTokenWriter;

import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.Message;

/**
 * Per-call traversal state of one encode operation: owns the token writer and dispatches each message either to a
 * registered {@link CustomTypeRenderer} or to the generic object-of-fields rendering.
 *
 * <p>
 * Instances are single-threaded and not reusable across documents. Custom renderers use the {@code write*} methods to
 * recurse into nested values.
 */
public class MessageEncoder {
    private static final Logger LOGGER = LoggerFactory.getLogger(MessageEncoder.class);
    private final EncoderOptions options;
    private final JsonTokenWriter writer;
    private final FieldEmissionPolicy emissionPolicy;
    private final ScalarTranscoder scalarTranscoder;
    private final CollectionTranscoder collectionTranscoder;
    private final ExtensionRenderer extensionRenderer;
    private int depth;

    public MessageEncoder(final @NotNull EncoderOptions options) {
        this.options = options;
        this.writer = new JsonTokenWriter(options.getIndent());
        this.emissionPolicy = new FieldEmissionPolicy(options);
        this.scalarTranscoder = new ScalarTranscoder(this);
        this.collectionTranscoder = new CollectionTranscoder(this);
        this.extensionRenderer = new ExtensionRenderer(this);
    }

    public EncoderOptions getOptions() {
        return options;
    }

    public JsonTokenWriter getWriter() {
        return writer;
    }

    /**
     * @return UTF-8 encoded copy of the JSON text written so far
     */
    public byte[] getBytes() {
        return writer.getBytes();
    }

    /**
     * Writes a complete message value: the output of a matching custom renderer, or a JSON object with the message's
     * fields.
     *
     * @param message the message to be written
     * @throws RecursionLimitException if the message is nested deeper than {@link EncoderOptions#getMaxRecursionDepth()}
     */
    public void writeMessage(final @NotNull Message message) {
        final Descriptor descriptor = message.getDescriptorForType();
        if (++depth > options.getMaxRecursionDepth()) {
            throw new RecursionLimitException(descriptor.getFullName() + ": exceeded maximum recursion depth of " + options.getMaxRecursionDepth());
        }
        try {
            final CustomTypeRenderer customRenderer = options.getCustomTypes().find(descriptor.getFullName());
            if (customRenderer != null) {
                LOGGER.atTrace().addArgument(descriptor.getFullName()).log("custom rendering of '{}'");
                customRenderer.render(this, message);
                return;
            }
            writer.startObject();
            writeFields(message);
            writer.endObject();
        } finally {
            depth--;
        }
    }

    /**
     * Writes the name/value pairs of all emitted declared fields followed by the extensions into the currently open
     * JSON object.
     *
     * @param message the message whose fields are written
     * @throws UnsupportedSchemaException for message-set messages unless {@link EncoderOptions#isAllowMessageSet()}
     */
    public void writeFields(final @NotNull Message message) {
        final Descriptor descriptor = message.getDescriptorForType();
        if (!options.isAllowMessageSet() && isMessageSet(descriptor)) {
            throw new UnsupportedSchemaException(descriptor.getFullName() + ": no support for proto1 MessageSets");
        }

        for (final FieldEmissionPolicy.EmittedField field : emissionPolicy.select(message)) {
            writer.writeName(field.getName());
            writeValue(field.getValue(), field.getDescriptor());
        }
        extensionRenderer.writeExtensions(message);
    }

    /**
     * @param value field value as returned by {@link Message#getField(FieldDescriptor)}, {@code null} renders as JSON
     *        {@code null}
     * @param field the field descriptor that selects list, map or singular rendering
     */
    public void writeValue(final Object value, final @NotNull FieldDescriptor field) {
        if (value == null) {
            writer.writeNull();
        } else if (field.isMapField()) {
            collectionTranscoder.writeMap((List<?>) value, field);
        } else if (field.isRepeated()) {
            collectionTranscoder.writeList((List<?>) value, field);
        } else {
            scalarTranscoder.writeSingular(value, field);
        }
    }

    /**
     * @param value a single (non-list) value of the given field, {@code null} renders as JSON {@code null}
     * @param field the field descriptor that selects the rendering
     */
    public void writeSingular(final Object value, final @NotNull FieldDescriptor field) {
        scalarTranscoder.writeSingular(value, field);
    }

    static boolean isMessageSet(final Descriptor descriptor) {
        return descriptor.getOptions().getMessageSetWireFormat();
    }
}
