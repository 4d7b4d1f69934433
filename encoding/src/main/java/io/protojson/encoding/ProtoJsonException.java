package io.protojson.encoding;

/**
 * Base class of all recoverable errors reported by the encoder.
 */
public class ProtoJsonException extends RuntimeException {
    private static final long serialVersionUID = 4101567720953377364L;

    public ProtoJsonException(final String message) {
        super(message);
    }

    public ProtoJsonException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
