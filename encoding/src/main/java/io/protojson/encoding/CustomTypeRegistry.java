package io.protojson.encoding;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import org.jetbrains.annotations.NotNull;

import io.protojson.encoding.wkt.WellKnownTypes;

import com.google.protobuf.Descriptors.Descriptor;

/**
 * Immutable mapping from full message type name to {@link CustomTypeRenderer}.
 */
public final class CustomTypeRegistry {
    private static final CustomTypeRegistry EMPTY = new CustomTypeRegistry(Map.of());
    private final Map<String, CustomTypeRenderer> renderers;

    private CustomTypeRegistry(final Map<String, CustomTypeRenderer> renderers) {
        this.renderers = Map.copyOf(renderers);
    }

    /**
     * @return registry without any custom rendering: every message is written as object of its fields
     */
    public static CustomTypeRegistry empty() {
        return EMPTY;
    }

    /**
     * @return registry with the canonical JSON mappings of the {@code google.protobuf} well-known types
     */
    public static CustomTypeRegistry wellKnownTypes() {
        return WellKnownHolder.INSTANCE;
    }

    public static Builder newBuilder() {
        return new Builder(Map.of());
    }

    public Builder toBuilder() {
        return new Builder(renderers);
    }

    /**
     * @param fullName full message type name, e.g. {@code google.protobuf.Timestamp}
     * @return the renderer or {@code null} if the type uses the generic rendering
     */
    public CustomTypeRenderer find(final @NotNull String fullName) {
        return renderers.get(fullName);
    }

    public boolean isCustomType(final @NotNull String fullName) {
        return renderers.containsKey(fullName);
    }

    public Set<String> getTypeNames() {
        return renderers.keySet();
    }

    public static final class Builder {
        private final Map<String, CustomTypeRenderer> renderers;

        private Builder(final Map<String, CustomTypeRenderer> initial) {
            renderers = new HashMap<>(initial);
        }

        public Builder register(final @NotNull String fullName, final @NotNull CustomTypeRenderer renderer) {
            renderers.put(fullName, renderer);
            return this;
        }

        public Builder register(final @NotNull Descriptor descriptor, final @NotNull CustomTypeRenderer renderer) {
            return register(descriptor.getFullName(), renderer);
        }

        public Builder remove(final @NotNull String fullName) {
            renderers.remove(fullName);
            return this;
        }

        public CustomTypeRegistry build() {
            return new CustomTypeRegistry(renderers);
        }
    }

    private static final class WellKnownHolder {
        private static final CustomTypeRegistry INSTANCE = WellKnownTypes.registerAll(newBuilder()).build();
    }
}
