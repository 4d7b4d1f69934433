package io.protojson.encoding.wkt;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.protojson.encoding.CustomTypeRenderer;
import io.protojson.encoding.InvalidValueException;
import io.protojson.encoding.MessageEncoder;
import io.protojson.encoding.registry.TypeResolver;
import io.protojson.json.JsonTokenWriter;

import com.google.protobuf.ByteString;
import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.DynamicMessage;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;

/**
 * {@code google.protobuf.Any} renders as object with an {@code "@type"} member followed by either the members of the
 * embedded message or, for custom-rendered embedded types, a single {@code "value"} member:
 *
 * <pre>
 * {"@type":"type.googleapis.com/my.pkg.Person","name":"Ada"}
 * {"@type":"type.googleapis.com/google.protobuf.Duration","value":"1.5s"}
 * </pre>
 *
 * The embedded type is looked up via {@link io.protojson.encoding.EncoderOptions#getResolver()}.
 */
final class AnyRenderer implements CustomTypeRenderer {
    static final AnyRenderer INSTANCE = new AnyRenderer();
    static final String TYPE_FIELD = "@type";
    static final String VALUE_FIELD = "value";
    private static final Logger LOGGER = LoggerFactory.getLogger(AnyRenderer.class);

    private AnyRenderer() {
    }

    @Override
    public void render(final @NotNull MessageEncoder encoder, final @NotNull Message message) {
        final Descriptor descriptor = message.getDescriptorForType();
        final FieldDescriptor typeUrlField = descriptor.findFieldByNumber(1);
        final FieldDescriptor valueField = descriptor.findFieldByNumber(2);
        final JsonTokenWriter writer = encoder.getWriter();

        writer.startObject();
        if (!message.hasField(typeUrlField)) {
            if (message.hasField(valueField)) {
                throw new InvalidValueException(descriptor.getFullName() + ": type_url is not set");
            }
            writer.endObject();
            return;
        }

        final String typeUrl = (String) message.getField(typeUrlField);
        writer.writeName(TYPE_FIELD);
        writer.writeString(typeUrl);

        final Message embedded = unpack(encoder.getOptions().getResolver(), descriptor, typeUrl, (ByteString) message.getField(valueField));
        if (encoder.getOptions().getCustomTypes().isCustomType(embedded.getDescriptorForType().getFullName())) {
            writer.writeName(VALUE_FIELD);
            encoder.writeMessage(embedded);
        } else {
            encoder.writeFields(embedded);
        }
        writer.endObject();
    }

    private static Message unpack(final TypeResolver resolver, final Descriptor anyType, final String typeUrl, final ByteString value) {
        final Descriptor embeddedType = resolver.findMessageByUrl(typeUrl);
        if (embeddedType == null) {
            throw new InvalidValueException(anyType.getFullName() + ": unable to resolve \"" + typeUrl + '"');
        }
        LOGGER.atTrace().addArgument(typeUrl).addArgument(embeddedType.getFullName()).log("resolved '{}' to '{}'");
        try {
            // payloads are decoded leniently: missing required fields do not fail the encoding
            return DynamicMessage.newBuilder(embeddedType).mergeFrom(value, resolver.getExtensionRegistry()).buildPartial();
        } catch (InvalidProtocolBufferException e) {
            throw new InvalidValueException(anyType.getFullName() + ": unable to unmarshal \"" + typeUrl + '"', e);
        }
    }
}
