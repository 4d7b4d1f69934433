package io.protojson.encoding.wkt;

import java.util.ArrayList;
import java.util.List;

import org.jetbrains.annotations.NotNull;

import io.protojson.encoding.CustomTypeRenderer;
import io.protojson.encoding.InvalidValueException;
import io.protojson.encoding.MessageEncoder;

import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.Message;

/**
 * {@code google.protobuf.FieldMask} renders as a single string of comma-separated lowerCamelCase paths.
 */
final class FieldMaskRenderer implements CustomTypeRenderer {
    static final FieldMaskRenderer INSTANCE = new FieldMaskRenderer();

    private FieldMaskRenderer() {
    }

    @Override
    public void render(final @NotNull MessageEncoder encoder, final @NotNull Message message) {
        final FieldDescriptor pathsField = message.getDescriptorForType().findFieldByNumber(1);
        final List<?> paths = (List<?>) message.getField(pathsField);
        final List<String> converted = new ArrayList<>(paths.size());
        for (final Object item : paths) {
            final String path = (String) item;
            final String camelCase = toCamelCase(path);
            if (!path.equals(toSnakeCase(camelCase))) {
                throw new InvalidValueException(pathsField.getFullName() + " contains irreversible value \"" + path + '"');
            }
            converted.add(camelCase);
        }
        encoder.getWriter().writeString(String.join(",", converted));
    }

    /**
     * Drops underscores and upper-cases the lower-case ASCII letters following them.
     *
     * @param path snake_case path
     * @return camelCase path
     */
    static String toCamelCase(final @NotNull String path) {
        final StringBuilder builder = new StringBuilder(path.length());
        boolean afterUnderscore = false;
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c != '_') {
                if (afterUnderscore && c >= 'a' && c <= 'z') {
                    c = (char) (c - 'a' + 'A');
                }
                builder.append(c);
            }
            afterUnderscore = c == '_';
        }
        return builder.toString();
    }

    static String toSnakeCase(final @NotNull String path) {
        final StringBuilder builder = new StringBuilder(path.length() + 4);
        for (int i = 0; i < path.length(); i++) {
            final char c = path.charAt(i);
            if (c >= 'A' && c <= 'Z') {
                builder.append('_').append((char) (c - 'A' + 'a'));
            } else {
                builder.append(c);
            }
        }
        return builder.toString();
    }
}
