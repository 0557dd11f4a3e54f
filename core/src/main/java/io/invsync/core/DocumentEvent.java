package io.invsync.core;

import java.util.Map;
import java.util.Objects;

/**
 * State of a subscribed document as delivered to a {@link DocumentListener}.
 * {@code fields} is empty when {@code exists} is false.
 */
public record DocumentEvent(DocumentRef ref, boolean exists, Map<String, Object> fields) {

    public DocumentEvent {
        Objects.requireNonNull(ref, "ref");
        fields = exists ? Fields.stored(fields) : Map.of();
    }

    public static DocumentEvent of(Document doc) {
        return new DocumentEvent(doc.ref(), true, doc.fields());
    }

    public static DocumentEvent missing(DocumentRef ref) {
        return new DocumentEvent(ref, false, Map.of());
    }
}
