package io.protojson.encoding;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.NotNull;

import io.protojson.json.JsonTokenWriter;

import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.Message;

/**
 * Renders repeated and map fields. Map entries are written in ascending key order (numeric for integer keys, unsigned
 * for unsigned kinds, code point order for strings) so that the output does not depend on the map's storage order.
 */
final class CollectionTranscoder {
    private final MessageEncoder encoder;
    private final JsonTokenWriter writer;

    CollectionTranscoder(final @NotNull MessageEncoder encoder) {
        this.encoder = encoder;
        this.writer = encoder.getWriter();
    }

    void writeList(final @NotNull List<?> list, final @NotNull FieldDescriptor field) {
        writer.startArray();
        for (final Object item : list) {
            encoder.writeSingular(item, field);
        }
        writer.endArray();
    }

    /**
     * @param entries map entry messages as returned by protobuf reflection for map fields
     * @param field the map field
     */
    void writeMap(final @NotNull List<?> entries, final @NotNull FieldDescriptor field) {
        final Descriptor entryType = field.getMessageType();
        final FieldDescriptor keyField = entryType.findFieldByNumber(1);
        final FieldDescriptor valueField = entryType.findFieldByNumber(2);

        // reflection exposes maps as entry lists which may contain repeated keys: the last one wins
        final Map<Object, Object> deduplicated = new LinkedHashMap<>();
        for (final Object item : entries) {
            final Message entry = (Message) item;
            deduplicated.put(entry.getField(keyField), entry.getField(valueField));
        }
        final List<Map.Entry<Object, Object>> sorted = new ArrayList<>(deduplicated.entrySet());
        sorted.sort(Map.Entry.comparingByKey(getKeyOrder(keyField)));

        writer.startObject();
        for (final Map.Entry<Object, Object> entry : sorted) {
            writer.writeName(getKeyName(entry.getKey(), keyField));
            encoder.writeSingular(entry.getValue(), valueField);
        }
        writer.endObject();
    }

    static Comparator<Object> getKeyOrder(final @NotNull FieldDescriptor keyField) {
        switch (keyField.getType()) {
        case INT32:
        case SINT32:
        case SFIXED32:
            return (a, b) -> Integer.compare((Integer) a, (Integer) b);
        case UINT32:
        case FIXED32:
            return (a, b) -> Integer.compareUnsigned((Integer) a, (Integer) b);
        case INT64:
        case SINT64:
        case SFIXED64:
            return (a, b) -> Long.compare((Long) a, (Long) b);
        case UINT64:
        case FIXED64:
            return (a, b) -> Long.compareUnsigned((Long) a, (Long) b);
        case BOOL:
            return (a, b) -> Boolean.compare((Boolean) a, (Boolean) b);
        case STRING:
            return (a, b) -> compareCodePoints((String) a, (String) b);
        default:
            throw new IllegalStateException(keyField.getFullName() + " has invalid map key kind: " + keyField.getType());
        }
    }

    static String getKeyName(final @NotNull Object key, final @NotNull FieldDescriptor keyField) {
        switch (keyField.getType()) {
        case UINT32:
        case FIXED32:
            return Integer.toUnsignedString((Integer) key);
        case UINT64:
        case FIXED64:
            return Long.toUnsignedString((Long) key);
        default:
            return key.toString();
        }
    }

    /**
     * Compares by Unicode code point, which is equivalent to comparing the UTF-8 encoded bytes.
     *
     * @param a first string
     * @param b second string
     * @return negative, zero or positive value as in {@link Comparator#compare(Object, Object)}
     */
    static int compareCodePoints(final @NotNull String a, final @NotNull String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            final int cpA = a.codePointAt(i);
            final int cpB = b.codePointAt(j);
            if (cpA != cpB) {
                return Integer.compare(cpA, cpB);
            }
            i += Character.charCount(cpA);
            j += Character.charCount(cpB);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }
}
