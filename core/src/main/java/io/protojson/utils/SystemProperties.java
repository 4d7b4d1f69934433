package io.protojson.utils;

import java.util.Map.Entry;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;

/**
 * Thin accessor around the JVM system properties used to seed process-wide defaults, e.g.
 * {@code -DProtoJson.maxRecursionDepth=64}. Look-ups fall back to a case-insensitive key match.
 */
public final class SystemProperties { //NOPMD -- nomen est omen
    private static final Properties SYSTEM_PROPERTIES = System.getProperties();

    private SystemProperties() {
        // utility class
    }

    public static String getProperty(final @NotNull String key) {
        return SYSTEM_PROPERTIES.getProperty(key);
    }

    public static String getPropertyIgnoreCase(final @NotNull String key, final String defaultValue) {
        final String value = SYSTEM_PROPERTIES.getProperty(key);
        if (null != value) {
            return value;
        }

        // Not matching with the actual key then
        final Set<Entry<Object, Object>> systemProperties = SYSTEM_PROPERTIES.entrySet();
        for (final Entry<Object, Object> entry : systemProperties) {
            if (entry.getKey() instanceof String name && key.equalsIgnoreCase(name)) {
                return Objects.toString(entry.getValue(), defaultValue);
            }
        }
        return defaultValue;
    }

    public static String getPropertyIgnoreCase(final @NotNull String key) {
        return getPropertyIgnoreCase(key, null);
    }

    public static int getValueIgnoreCase(final @NotNull String key, final int defaultValue) {
        final String value = getPropertyIgnoreCase(key);
        if (StringUtils.isBlank(value)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("property '" + key + "' is not an integer: '" + value + "'", e);
        }
    }

    public static boolean getValueIgnoreCase(final @NotNull String key, final boolean defaultValue) {
        final String value = getPropertyIgnoreCase(key);
        if (StringUtils.isBlank(value)) {
            return defaultValue;
        }
        final Boolean parsed = BooleanUtils.toBooleanObject(value.trim());
        if (parsed == null) {
            throw new IllegalArgumentException("property '" + key + "' is not a boolean: '" + value + "'");
        }
        return parsed;
    }

    public static Object put(final @NotNull Object key, final Object value) {
        return SYSTEM_PROPERTIES.put(key, value);
    }

    public static Object remove(final @NotNull Object key) {
        return SYSTEM_PROPERTIES.remove(key);
    }
}
