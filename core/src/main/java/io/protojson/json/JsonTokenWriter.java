package io.protojson.json;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;

/**
 * Append-only JSON token writer.
 *
 * <p>
 * The writer keeps track of the previously written token and inserts the separators (and, if an indent unit is
 * configured, the line breaks and indentation) that are required before the next token. It does not validate the
 * overall document structure: callers are expected to balance {@code start*}/{@code end*} calls and to write exactly
 * one value after each name.
 * <p>
 * Compact output contains no whitespace at all. Indented output places every object member and array element on its
 * own line, e.g. for indent {@code "  "}:
 * <pre>
 * {
 *   "a": 1,
 *   "b": [
 *     true
 *   ],
 *   "c": {}
 * }
 * </pre>
 * Instances are not thread-safe and are meant to be used for a single document.
 */
@SuppressWarnings("PMD.TooManyMethods")
public class JsonTokenWriter {
    public static final String INVALID_INDENT = "indent may only be composed of space or tab characters";
    private static final int DEFAULT_INITIAL_CAPACITY = 1_000;
    private static final char QUOTE = '\"';
    private static final String NULL = "null";
    private static final String NAN = "\"NaN\"";
    private static final String POSITIVE_INFINITY = "\"Infinity\"";
    private static final String NEGATIVE_INFINITY = "\"-Infinity\"";
    private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();
    private static final int FLOAT_MAX_DIGITS = 9;
    private static final int DOUBLE_MAX_DIGITS = 17;
    private final StringBuilder builder = new StringBuilder(DEFAULT_INITIAL_CAPACITY); // NOPMD
    private final StringBuilder indentation = new StringBuilder(); // NOPMD
    private final String indent;
    private Token lastToken = Token.NONE;

    /**
     * Creates a writer producing compact output.
     */
    public JsonTokenWriter() {
        this("");
    }

    /**
     * @param indent indentation unit, {@code null} or empty for compact output
     * @throws IllegalArgumentException if the indent contains characters other than space or tab
     */
    public JsonTokenWriter(final String indent) {
        this.indent = checkIndent(indent);
    }

    /**
     * @param indent indentation unit to be checked
     * @return the given indent, or an empty string for {@code null}
     * @throws IllegalArgumentException if the indent contains characters other than space or tab
     */
    public static String checkIndent(final String indent) {
        if (indent == null) {
            return "";
        }
        if (!StringUtils.containsOnly(indent, ' ', '\t')) {
            throw new IllegalArgumentException(INVALID_INDENT);
        }
        return indent;
    }

    public void startObject() {
        prepareNext(Token.OBJECT_OPEN);
        builder.append('{');
    }

    public void endObject() {
        prepareNext(Token.OBJECT_CLOSE);
        builder.append('}');
    }

    public void startArray() {
        prepareNext(Token.ARRAY_OPEN);
        builder.append('[');
    }

    public void endArray() {
        prepareNext(Token.ARRAY_CLOSE);
        builder.append(']');
    }

    /**
     * Writes an object member name followed by the name separator.
     *
     * @param name member name
     * @throws JsonWriterException if the name contains unpaired surrogate characters
     */
    public void writeName(final @NotNull String name) {
        prepareNext(Token.NAME);
        appendQuoted(name);
        builder.append(':');
    }

    public void writeNull() {
        prepareNext(Token.SCALAR);
        builder.append(NULL);
    }

    public void writeBool(final boolean value) {
        prepareNext(Token.SCALAR);
        builder.append(value);
    }

    public void writeInt(final long value) {
        prepareNext(Token.SCALAR);
        builder.append(value);
    }

    /**
     * @param value bit pattern interpreted as unsigned 64-bit integer
     */
    public void writeUint(final long value) {
        prepareNext(Token.SCALAR);
        builder.append(Long.toUnsignedString(value));
    }

    /**
     * @param value string to be written as quoted and escaped JSON string
     * @throws JsonWriterException if the value contains unpaired surrogate characters
     */
    public void writeString(final @NotNull String value) {
        prepareNext(Token.SCALAR);
        appendQuoted(value);
    }

    /**
     * Writes a floating point number. NaN and infinities have no JSON number representation and are written as the
     * strings {@code "NaN"}, {@code "Infinity"} and {@code "-Infinity"}.
     *
     * @param value the number
     * @param bitSize 32 for single precision, 64 for double precision values
     */
    public void writeFloat(final double value, final int bitSize) {
        prepareNext(Token.SCALAR);
        if (Double.isNaN(value)) {
            builder.append(NAN);
        } else if (Double.isInfinite(value)) {
            builder.append(value > 0 ? POSITIVE_INFINITY : NEGATIVE_INFINITY);
        } else {
            builder.append(formatFloat(value, bitSize));
        }
    }

    /**
     * @return UTF-8 encoded copy of the text written so far
     */
    public byte[] getBytes() {
        return builder.toString().getBytes(StandardCharsets.UTF_8);
    }

    public String getIndent() {
        return indent;
    }

    @Override
    public String toString() {
        return builder.toString();
    }

    /**
     * Formats a finite number using the shortest decimal representation that round-trips at the given precision.
     * Values with magnitude in [1e-6, 1e21) use plain notation, all others exponent notation (e.g. {@code 1e+21},
     * {@code 1.5e-7}).
     *
     * @param value finite number
     * @param bitSize 32 or 64
     * @return JSON number text
     */
    public static String formatFloat(final double value, final int bitSize) {
        final boolean plain;
        final BigDecimal decimal;
        switch (bitSize) {
        case 32:
            final float single = (float) value;
            final float absSingle = Math.abs(single);
            if (single == 0f) {
                return 1f / single < 0 ? "-0" : "0";
            }
            plain = absSingle >= 1e-6f && absSingle < 1e21f;
            decimal = shortestFloat(single);
            break;
        case 64:
            final double abs = Math.abs(value);
            if (value == 0d) {
                return 1d / value < 0 ? "-0" : "0";
            }
            plain = abs >= 1e-6 && abs < 1e21;
            decimal = shortestDouble(value);
            break;
        default:
            throw new IllegalArgumentException("unsupported float bit size: " + bitSize);
        }

        if (plain) {
            return decimal.toPlainString();
        }
        final String digits = decimal.unscaledValue().abs().toString();
        final int exponent = decimal.precision() - decimal.scale() - 1;
        final StringBuilder out = new StringBuilder(digits.length() + 8);
        if (decimal.signum() < 0) {
            out.append('-');
        }
        out.append(digits.charAt(0));
        if (digits.length() > 1) {
            out.append('.').append(digits, 1, digits.length());
        }
        return out.append('e').append(exponent < 0 ? '-' : '+').append(Math.abs(exponent)).toString();
    }

    private static BigDecimal shortestFloat(final float value) {
        final BigDecimal exact = new BigDecimal(value);
        for (int digits = 1; digits < FLOAT_MAX_DIGITS; digits++) {
            final BigDecimal candidate = exact.round(new MathContext(digits, RoundingMode.HALF_EVEN));
            if (candidate.floatValue() == value) {
                return candidate.stripTrailingZeros();
            }
        }
        return exact.round(new MathContext(FLOAT_MAX_DIGITS, RoundingMode.HALF_EVEN)).stripTrailingZeros();
    }

    private static BigDecimal shortestDouble(final double value) {
        final BigDecimal exact = new BigDecimal(value);
        for (int digits = 1; digits < DOUBLE_MAX_DIGITS; digits++) {
            final BigDecimal candidate = exact.round(new MathContext(digits, RoundingMode.HALF_EVEN));
            if (candidate.doubleValue() == value) {
                return candidate.stripTrailingZeros();
            }
        }
        return exact.round(new MathContext(DOUBLE_MAX_DIGITS, RoundingMode.HALF_EVEN)).stripTrailingZeros();
    }

    private void appendQuoted(final String value) {
        builder.append(QUOTE);
        final int length = value.length();
        for (int i = 0; i < length; i++) {
            final char c = value.charAt(i);
            switch (c) {
            case '\"':
            case '\\':
                builder.append('\\').append(c);
                break;
            case '\b':
                builder.append("\\b");
                break;
            case '\f':
                builder.append("\\f");
                break;
            case '\n':
                builder.append("\\n");
                break;
            case '\r':
                builder.append("\\r");
                break;
            case '\t':
                builder.append("\\t");
                break;
            default:
                if (c < ' ') {
                    builder.append("\\u00").append(HEX_DIGITS[c >> 4]).append(HEX_DIGITS[c & 0xF]);
                } else if (Character.isHighSurrogate(c) && i + 1 < length && Character.isLowSurrogate(value.charAt(i + 1))) {
                    builder.append(c).append(value.charAt(++i));
                } else if (Character.isSurrogate(c)) {
                    throw new JsonWriterException("invalid UTF-8: unpaired surrogate at index " + i);
                } else {
                    builder.append(c);
                }
                break;
            }
        }
        builder.append(QUOTE);
    }

    private void prepareNext(final Token next) {
        final Token last = lastToken;
        lastToken = next;
        if (indent.isEmpty()) {
            if (last.isValueEnd() && next.isValueStart()) {
                builder.append(',');
            }
            return;
        }

        if (last.isOpen()) {
            if (!next.isClose()) {
                indentation.append(indent);
                builder.append('\n').append(indentation);
            }
        } else if (last.isValueEnd()) {
            if (next.isValueStart()) {
                builder.append(",\n");
            } else if (next.isClose()) {
                indentation.setLength(indentation.length() - indent.length());
                builder.append('\n');
            }
            builder.append(indentation);
        } else if (last == Token.NAME) {
            builder.append(' ');
        }
    }

    private enum Token {
        NONE,
        NAME,
        SCALAR,
        OBJECT_OPEN,
        OBJECT_CLOSE,
        ARRAY_OPEN,
        ARRAY_CLOSE;

        boolean isOpen() {
            return this == OBJECT_OPEN || this == ARRAY_OPEN;
        }

        boolean isClose() {
            return this == OBJECT_CLOSE || this == ARRAY_CLOSE;
        }

        boolean isValueEnd() {
            return this == SCALAR || isClose();
        }

        boolean isValueStart() {
            return this == NAME || this == SCALAR || isOpen();
        }
    }
}
