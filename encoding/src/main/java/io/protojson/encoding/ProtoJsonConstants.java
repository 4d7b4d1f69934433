package io.protojson.encoding;

import io.protojson.utils.SystemProperties;

/**
 * Process-wide encoder defaults. The following JVM system properties are consulted (case-insensitive) whenever a new
 * {@link EncoderOptions.Builder} is created:
 * <ul>
 * <li>'ProtoJson.protoLegacy' [boolean]: if true, enables encoding of legacy message-set messages (default: false)</li>
 * <li>'ProtoJson.maxRecursionDepth' [int]: maximum message nesting depth (default: 100)</li>
 * </ul>
 */
public final class ProtoJsonConstants {
    public static final String PROTO_LEGACY = "ProtoJson.protoLegacy";
    public static final String MAX_RECURSION_DEPTH = "ProtoJson.maxRecursionDepth";
    public static final boolean DEFAULT_PROTO_LEGACY = false;
    public static final int DEFAULT_MAX_RECURSION_DEPTH = 100;
    /** full name of the enum that always renders as JSON {@code null} */
    public static final String NULL_VALUE_ENUM = "google.protobuf.NullValue";

    private ProtoJsonConstants() {
        // utility class
    }

    public static boolean isProtoLegacy() {
        return SystemProperties.getValueIgnoreCase(PROTO_LEGACY, DEFAULT_PROTO_LEGACY);
    }

    public static int getMaxRecursionDepth() {
        return SystemProperties.getValueIgnoreCase(MAX_RECURSION_DEPTH, DEFAULT_MAX_RECURSION_DEPTH);
    }
}
