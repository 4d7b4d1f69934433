package io.protojson.json;

/**
 * Raised by {@link JsonTokenWriter} when a token cannot be represented as valid UTF-8 JSON text.
 */
public class JsonWriterException extends RuntimeException {
    private static final long serialVersionUID = -2739312958610843532L;

    public JsonWriterException(final String message) {
        super(message);
    }
}
