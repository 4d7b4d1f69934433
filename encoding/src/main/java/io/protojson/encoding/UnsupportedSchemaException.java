package io.protojson.encoding;

/**
 * The message schema uses a construct that has no JSON mapping, e.g. a legacy message-set.
 */
public class UnsupportedSchemaException extends ProtoJsonException {
    private static final long serialVersionUID = -6870406331468823785L;

    public UnsupportedSchemaException(final String message) {
        super(message);
    }
}
