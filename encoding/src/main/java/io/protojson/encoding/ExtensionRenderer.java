package io.protojson.encoding;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.Message;

/**
 * Writes the populated extension fields of a message after its declared fields. Extensions are named
 * {@code [full.name.of.extension]} and ordered by that bracketed name.
 */
final class ExtensionRenderer {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExtensionRenderer.class);
    private static final String MESSAGE_SET_EXTENSION = "message_set_extension";
    private final MessageEncoder encoder;

    ExtensionRenderer(final @NotNull MessageEncoder encoder) {
        this.encoder = encoder;
    }

    void writeExtensions(final @NotNull Message message) {
        final List<ExtensionEntry> entries = new ArrayList<>();
        for (final Map.Entry<FieldDescriptor, Object> field : message.getAllFields().entrySet()) {
            final FieldDescriptor descriptor = field.getKey();
            if (!descriptor.isExtension()) {
                continue;
            }
            final String name = isMessageSetExtension(descriptor) ? getParentName(descriptor) : descriptor.getFullName();
            entries.add(new ExtensionEntry('[' + name + ']', descriptor, field.getValue()));
        }
        if (entries.isEmpty()) {
            return;
        }
        entries.sort(Comparator.comparing(ExtensionEntry::getName));

        for (final ExtensionEntry entry : entries) {
            LOGGER.atTrace().addArgument(entry.getName()).addArgument(message.getDescriptorForType().getFullName()).log("write extension '{}' of '{}'");
            encoder.getWriter().writeName(entry.getName());
            encoder.writeValue(entry.getValue(), entry.getDescriptor());
        }
    }

    /**
     * A message-set extension is a message-typed extension named {@value #MESSAGE_SET_EXTENSION} declared inside the
     * very message type it carries, extending a message-set container.
     *
     * @param extension the extension field
     * @return {@code true} if the extension follows the message-set naming convention
     */
    static boolean isMessageSetExtension(final @NotNull FieldDescriptor extension) {
        return MESSAGE_SET_EXTENSION.equals(extension.getName()) //
                && MessageEncoder.isMessageSet(extension.getContainingType()) //
                && extension.getJavaType() == FieldDescriptor.JavaType.MESSAGE //
                && getParentName(extension).equals(extension.getMessageType().getFullName());
    }

    private static String getParentName(final FieldDescriptor extension) {
        return StringUtils.substringBeforeLast(extension.getFullName(), ".");
    }

    private static final class ExtensionEntry {
        private final String name;
        private final FieldDescriptor descriptor;
        private final Object value;

        private ExtensionEntry(final String name, final FieldDescriptor descriptor, final Object value) {
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

        Object getValue() {
            return value;
        }
    }
}
