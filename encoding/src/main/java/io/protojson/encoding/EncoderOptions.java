package io.protojson.encoding;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

import io.protojson.encoding.registry.TypeRegistry;
import io.protojson.encoding.registry.TypeResolver;
import io.protojson.json.JsonTokenWriter;

/**
 * Immutable configuration of a single encode call.
 *
 * <ul>
 * <li>{@code allowPartial}: skip the required-field completeness check</li>
 * <li>{@code useProtoNames}: use the declared field names instead of the lowerCamelCase JSON names</li>
 * <li>{@code useEnumNumbers}: render enum values as numbers</li>
 * <li>{@code emitUnpopulated}: also render fields that are not populated (except oneof members and extensions):
 * <table>
 * <caption>unpopulated field rendering</caption>
 * <tr><td>{@code false}, {@code 0}, {@code ""}</td><td>scalar fields without presence (proto3)</td></tr>
 * <tr><td>{@code null}</td><td>scalar fields with presence (proto2) and singular message fields</td></tr>
 * <tr><td>{@code []}</td><td>repeated fields</td></tr>
 * <tr><td>{@code {}}</td><td>map fields</td></tr>
 * </table>
 * </li>
 * <li>{@code indent}: indentation unit composed of spaces and tabs, empty for compact output</li>
 * <li>{@code resolver}: type look-up for {@code google.protobuf.Any} expansion, defaults to
 * {@link TypeRegistry#global()}</li>
 * <li>{@code customTypes}: renderers for types with a custom JSON mapping, defaults to
 * {@link CustomTypeRegistry#wellKnownTypes()}</li>
 * <li>{@code allowMessageSet}: accept legacy message-set messages, defaults to {@link ProtoJsonConstants#isProtoLegacy()}</li>
 * <li>{@code maxRecursionDepth}: maximum message nesting depth, defaults to
 * {@link ProtoJsonConstants#getMaxRecursionDepth()}</li>
 * </ul>
 */
public final class EncoderOptions {
    private final boolean allowPartial;
    private final boolean useProtoNames;
    private final boolean useEnumNumbers;
    private final boolean emitUnpopulated;
    private final String indent;
    private final TypeResolver resolver;
    private final CustomTypeRegistry customTypes;
    private final boolean allowMessageSet;
    private final int maxRecursionDepth;

    private EncoderOptions(final Builder builder) {
        allowPartial = builder.allowPartial;
        useProtoNames = builder.useProtoNames;
        useEnumNumbers = builder.useEnumNumbers;
        emitUnpopulated = builder.emitUnpopulated;
        indent = JsonTokenWriter.checkIndent(builder.indent);
        resolver = builder.resolver == null ? TypeRegistry.global() : builder.resolver;
        customTypes = builder.customTypes == null ? CustomTypeRegistry.wellKnownTypes() : builder.customTypes;
        allowMessageSet = builder.allowMessageSet;
        maxRecursionDepth = builder.maxRecursionDepth;
        if (maxRecursionDepth <= 0) {
            throw new IllegalArgumentException("The maxRecursionDepth must be greater than 0!");
        }
    }

    public static EncoderOptions defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder() //
                .setAllowPartial(allowPartial)
                .setUseProtoNames(useProtoNames)
                .setUseEnumNumbers(useEnumNumbers)
                .setEmitUnpopulated(emitUnpopulated)
                .setIndent(indent)
                .setResolver(resolver)
                .setCustomTypes(customTypes)
                .setAllowMessageSet(allowMessageSet)
                .setMaxRecursionDepth(maxRecursionDepth);
    }

    public boolean isAllowPartial() {
        return allowPartial;
    }

    public boolean isUseProtoNames() {
        return useProtoNames;
    }

    public boolean isUseEnumNumbers() {
        return useEnumNumbers;
    }

    public boolean isEmitUnpopulated() {
        return emitUnpopulated;
    }

    public String getIndent() {
        return indent;
    }

    public TypeResolver getResolver() {
        return resolver;
    }

    public CustomTypeRegistry getCustomTypes() {
        return customTypes;
    }

    public boolean isAllowMessageSet() {
        return allowMessageSet;
    }

    public int getMaxRecursionDepth() {
        return maxRecursionDepth;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof EncoderOptions other)) {
            return false;
        }
        return allowPartial == other.allowPartial && useProtoNames == other.useProtoNames && useEnumNumbers == other.useEnumNumbers
                && emitUnpopulated == other.emitUnpopulated && allowMessageSet == other.allowMessageSet && maxRecursionDepth == other.maxRecursionDepth
                && indent.equals(other.indent) && resolver.equals(other.resolver) && customTypes.equals(other.customTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(allowPartial, useProtoNames, useEnumNumbers, emitUnpopulated, indent, resolver, customTypes, allowMessageSet, maxRecursionDepth);
    }

    @Override
    public String toString() {
        return "EncoderOptions{allowPartial=" + allowPartial + ", useProtoNames=" + useProtoNames + ", useEnumNumbers=" + useEnumNumbers
                + ", emitUnpopulated=" + emitUnpopulated + ", indent='" + indent + "', allowMessageSet=" + allowMessageSet
                + ", maxRecursionDepth=" + maxRecursionDepth + '}';
    }

    public static final class Builder {
        private boolean allowPartial;
        private boolean useProtoNames;
        private boolean useEnumNumbers;
        private boolean emitUnpopulated;
        private String indent = "";
        private TypeResolver resolver;
        private CustomTypeRegistry customTypes;
        private boolean allowMessageSet = ProtoJsonConstants.isProtoLegacy();
        private int maxRecursionDepth = ProtoJsonConstants.getMaxRecursionDepth();

        private Builder() {
            // use EncoderOptions.newBuilder()
        }

        public Builder setAllowPartial(final boolean allowPartial) {
            this.allowPartial = allowPartial;
            return this;
        }

        public Builder setUseProtoNames(final boolean useProtoNames) {
            this.useProtoNames = useProtoNames;
            return this;
        }

        public Builder setUseEnumNumbers(final boolean useEnumNumbers) {
            this.useEnumNumbers = useEnumNumbers;
            return this;
        }

        public Builder setEmitUnpopulated(final boolean emitUnpopulated) {
            this.emitUnpopulated = emitUnpopulated;
            return this;
        }

        /**
         * @param indent indentation unit composed of space and tab characters; {@code null} or empty for compact output
         * @return this builder
         */
        public Builder setIndent(final String indent) {
            this.indent = indent;
            return this;
        }

        /**
         * @param resolver type look-up, {@code null} selects {@link TypeRegistry#global()}
         * @return this builder
         */
        public Builder setResolver(final TypeResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        /**
         * @param customTypes custom renderers, {@code null} selects {@link CustomTypeRegistry#wellKnownTypes()}
         * @return this builder
         */
        public Builder setCustomTypes(final CustomTypeRegistry customTypes) {
            this.customTypes = customTypes;
            return this;
        }

        public Builder setAllowMessageSet(final boolean allowMessageSet) {
            this.allowMessageSet = allowMessageSet;
            return this;
        }

        public Builder setMaxRecursionDepth(final int maxRecursionDepth) {
            this.maxRecursionDepth = maxRecursionDepth;
            return this;
        }

        /**
         * @return the immutable options
         * @throws IllegalArgumentException for an invalid indent or a non-positive recursion depth
         */
        public @NotNull EncoderOptions build() {
            return new EncoderOptions(this);
        }
    }
}
