package io.invsync.core;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of a stored document.
 * <p>
 * Identity (the {@link DocumentRef}) never changes; a newer snapshot of the
 * same document simply carries different fields and a later update time.
 */
public final class Document {
    private final DocumentRef ref;
    private final Map<String, Object> fields;
    private final Instant updateTime;

    public Document(DocumentRef ref, Map<String, ?> fields, Instant updateTime) {
        this.ref = Objects.requireNonNull(ref, "ref");
        this.fields = Fields.stored(fields);
        this.updateTime = Objects.requireNonNull(updateTime, "updateTime");
    }

    public DocumentRef ref() { return ref; }

    public String id() { return ref.id(); }

    /** Unmodifiable field map; values may be null. */
    public Map<String, Object> fields() { return fields; }

    public Instant updateTime() { return updateTime; }

    public boolean contains(String field) {
        return fields.containsKey(field);
    }

    public Object get(String field) {
        if (PageQuery.DOCUMENT_ID.equals(field)) {
            return id();
        }
        return fields.get(field);
    }

    public String getString(String field) {
        Object v = fields.get(field);
        return v instanceof String s ? s : null;
    }

    public Long getLong(String field) {
        Object v = fields.get(field);
        return v instanceof Long l ? l : null;
    }

    public Instant getTimestamp(String field) {
        Object v = fields.get(field);
        return v instanceof Instant t ? t : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Document other)) return false;
        return ref.equals(other.ref) && fields.equals(other.fields) && updateTime.equals(other.updateTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ref, fields, updateTime);
    }

    @Override
    public String toString() {
        return "Document{" + ref + ", " + fields + "}";
    }
}
