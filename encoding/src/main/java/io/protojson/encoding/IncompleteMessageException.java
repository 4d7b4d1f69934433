package io.protojson.encoding;

import java.util.List;

import org.jetbrains.annotations.NotNull;

/**
 * One or more required fields are not set somewhere in the encoded message graph.
 */
public class IncompleteMessageException extends ProtoJsonException {
    private static final long serialVersionUID = 7263093440160318213L;
    private final String messageName;
    private final List<String> missingFields;

    /**
     * @param messageName full name of the top-level message type
     * @param missingFields paths of the missing required fields, e.g. {@code "child.name"}
     */
    public IncompleteMessageException(final @NotNull String messageName, final @NotNull List<String> missingFields) {
        super(messageName + ": required fields not set: " + String.join(", ", missingFields));
        this.messageName = messageName;
        this.missingFields = List.copyOf(missingFields);
    }

    public String getMessageName() {
        return messageName;
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
