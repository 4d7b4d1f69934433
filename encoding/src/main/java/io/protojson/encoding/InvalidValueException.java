package io.protojson.encoding;

/**
 * A field value is well-formed protobuf but cannot be expressed in the JSON mapping (e.g. a timestamp outside of the
 * supported range or an {@code Any} whose payload type cannot be resolved).
 */
public class InvalidValueException extends ProtoJsonException {
    private static final long serialVersionUID = 2356640946283427671L;

    public InvalidValueException(final String message) {
        super(message);
    }

    public InvalidValueException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
