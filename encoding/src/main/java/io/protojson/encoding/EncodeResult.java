package io.protojson.encoding;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import org.jetbrains.annotations.NotNull;

/**
 * Outcome of an encode call. Besides plain success and failure, a result may carry both the produced JSON and an
 * {@link IncompleteMessageException}: required fields were missing, yet the document was written completely and may
 * be used by lenient callers.
 */
public final class EncodeResult {
    private final byte[] bytes;
    private final RuntimeException error;

    private EncodeResult(final byte[] bytes, final RuntimeException error) {
        this.bytes = bytes;
        this.error = error;
    }

    static EncodeResult success(final byte[] bytes) {
        return new EncodeResult(bytes, null);
    }

    static EncodeResult failure(final @NotNull RuntimeException error) {
        return new EncodeResult(null, error);
    }

    static EncodeResult incomplete(final byte[] bytes, final @NotNull IncompleteMessageException error) {
        return new EncodeResult(bytes, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean hasBytes() {
        return bytes != null;
    }

    /**
     * @return copy of the UTF-8 encoded JSON document, {@code null} if the encoding failed before completion
     */
    public byte[] getBytes() {
        return bytes == null ? null : bytes.clone();
    }

    public Optional<RuntimeException> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * @return the UTF-8 encoded JSON document
     * @throws ProtoJsonException the error of an unsuccessful encode call
     * @throws io.protojson.json.JsonWriterException if a string could not be written as UTF-8
     */
    public byte[] getOrThrow() {
        if (error != null) {
            throw error;
        }
        return bytes.clone();
    }

    /**
     * @return the JSON document as string, regardless of a carried {@link IncompleteMessageException}
     * @throws IllegalStateException if no document has been produced
     */
    public String toJson() {
        if (bytes == null) {
            throw new IllegalStateException("no JSON produced", error);
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "EncodeResult{" + (bytes == null ? "<no output>" : toJson()) + (error == null ? "" : ", error=" + error.getMessage()) + '}';
    }
}
