package io.protojson.encoding;

public class RecursionLimitException extends ProtoJsonException {
    private static final long serialVersionUID = -1482209323962316262L;

    public RecursionLimitException(final String message) {
        super(message);
    }
}
