package io.protojson.encoding.wkt;

import org.jetbrains.annotations.NotNull;

import io.protojson.encoding.CustomTypeRegistry;

/**
 * Registers the canonical JSON mappings of the {@code google.protobuf} well-known types.
 */
public final class WellKnownTypes {
    public static final String ANY = "google.protobuf.Any";
    public static final String TIMESTAMP = "google.protobuf.Timestamp";
    public static final String DURATION = "google.protobuf.Duration";
    public static final String FIELD_MASK = "google.protobuf.FieldMask";
    public static final String EMPTY = "google.protobuf.Empty";
    public static final String STRUCT = "google.protobuf.Struct";
    public static final String LIST_VALUE = "google.protobuf.ListValue";
    public static final String VALUE = "google.protobuf.Value";
    private static final String[] WRAPPERS = { "google.protobuf.BoolValue", "google.protobuf.Int32Value", "google.protobuf.Int64Value", "google.protobuf.UInt32Value",
        "google.protobuf.UInt64Value", "google.protobuf.FloatValue", "google.protobuf.DoubleValue", "google.protobuf.StringValue", "google.protobuf.BytesValue" };

    private WellKnownTypes() {
        // utility class
    }

    public static CustomTypeRegistry.Builder registerAll(final @NotNull CustomTypeRegistry.Builder builder) {
        for (final String wrapper : WRAPPERS) {
            builder.register(wrapper, WrapperRenderer.INSTANCE);
        }
        return builder.register(ANY, AnyRenderer.INSTANCE)
                .register(TIMESTAMP, TimeRenderers.TIMESTAMP)
                .register(DURATION, TimeRenderers.DURATION)
                .register(FIELD_MASK, FieldMaskRenderer.INSTANCE)
                .register(EMPTY, StructRenderers.EMPTY)
                .register(STRUCT, StructRenderers.STRUCT)
                .register(LIST_VALUE, StructRenderers.LIST_VALUE)
                .register(VALUE, StructRenderers.VALUE);
    }
}
