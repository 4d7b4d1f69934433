package io.protojson.encoding.wkt;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

import org.jetbrains.annotations.NotNull;

import io.protojson.encoding.CustomTypeRenderer;
import io.protojson.encoding.InvalidValueException;
import io.protojson.encoding.MessageEncoder;

import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Message;

/**
 * {@code google.protobuf.Timestamp} and {@code google.protobuf.Duration} renderers. Both emit 0, 3, 6 or 9 fractional
 * second digits.
 */
final class TimeRenderers {
    /** 0001-01-01T00:00:00Z */
    static final long MIN_TIMESTAMP_SECONDS = -62_135_596_800L;
    /** 9999-12-31T23:59:59Z */
    static final long MAX_TIMESTAMP_SECONDS = 253_402_300_799L;
    /** +10000 years */
    static final long MAX_DURATION_SECONDS = 315_576_000_000L;
    static final int MAX_NANOS = 999_999_999;
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss", Locale.ROOT);

    static final CustomTypeRenderer TIMESTAMP = TimeRenderers::renderTimestamp;
    static final CustomTypeRenderer DURATION = TimeRenderers::renderDuration;

    private TimeRenderers() {
        // utility class
    }

    static void renderTimestamp(final @NotNull MessageEncoder encoder, final @NotNull Message message) {
        final Descriptor descriptor = message.getDescriptorForType();
        final long seconds = (Long) message.getField(descriptor.findFieldByNumber(1));
        final int nanos = (Integer) message.getField(descriptor.findFieldByNumber(2));
        if (seconds < MIN_TIMESTAMP_SECONDS || seconds > MAX_TIMESTAMP_SECONDS) {
            throw new InvalidValueException(descriptor.getFullName() + ": seconds out of range " + seconds);
        }
        if (nanos < 0 || nanos > MAX_NANOS) {
            throw new InvalidValueException(descriptor.getFullName() + ": nanos out of range " + nanos);
        }

        final StringBuilder text = new StringBuilder(30).append(DATE_TIME.format(LocalDateTime.ofEpochSecond(seconds, nanos, ZoneOffset.UTC)));
        appendFraction(text, nanos);
        encoder.getWriter().writeString(text.append('Z').toString());
    }

    static void renderDuration(final @NotNull MessageEncoder encoder, final @NotNull Message message) {
        final Descriptor descriptor = message.getDescriptorForType();
        long seconds = (Long) message.getField(descriptor.findFieldByNumber(1));
        int nanos = (Integer) message.getField(descriptor.findFieldByNumber(2));
        if (seconds < -MAX_DURATION_SECONDS || seconds > MAX_DURATION_SECONDS) {
            throw new InvalidValueException(descriptor.getFullName() + ": seconds out of range " + seconds);
        }
        if (nanos < -MAX_NANOS || nanos > MAX_NANOS) {
            throw new InvalidValueException(descriptor.getFullName() + ": nanos out of range " + nanos);
        }
        if (seconds > 0 && nanos < 0 || seconds < 0 && nanos > 0) {
            throw new InvalidValueException(descriptor.getFullName() + ": signs of seconds and nanos do not match");
        }

        final StringBuilder text = new StringBuilder(24);
        if (seconds < 0 || nanos < 0) {
            text.append('-');
            seconds = -seconds;
            nanos = -nanos;
        }
        text.append(seconds);
        appendFraction(text, nanos);
        encoder.getWriter().writeString(text.append('s').toString());
    }

    static void appendFraction(final StringBuilder text, final int nanos) {
        if (nanos == 0) {
            return;
        }
        final String digits = String.format(Locale.ROOT, "%09d", nanos);
        if (nanos % 1_000_000 == 0) {
            text.append('.').append(digits, 0, 3);
        } else if (nanos % 1_000 == 0) {
            text.append('.').append(digits, 0, 6);
        } else {
            text.append('.').append(digits);
        }
    }
}
