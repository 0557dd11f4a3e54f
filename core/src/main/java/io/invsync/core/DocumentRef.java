package io.invsync.core;

import java.util.Objects;

/**
 * Address of a single document: its parent collection plus the document id.
 */
public record DocumentRef(CollectionRef parent, String id) {

    public DocumentRef {
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(id, "id");
        if (id.isBlank() || id.indexOf('/') >= 0) {
            throw new IllegalArgumentException("invalid document id: '" + id + "'");
        }
    }

    /**
     * Parse a full document path such as {@code users/u1/items/i9}.
     */
    public static DocumentRef parse(String path) {
        Objects.requireNonNull(path, "path");
        String[] segments = PathSegments.split(path);
        if (segments.length % 2 != 0) {
            throw new IllegalArgumentException("document path must have an even number of segments: " + path);
        }
        int slash = path.lastIndexOf('/');
        return new DocumentRef(new CollectionRef(path.substring(0, slash)), path.substring(slash + 1));
    }

    public String path() {
        return parent.path() + "/" + id;
    }

    public CollectionRef collection(String name) {
        return new CollectionRef(path() + "/" + name);
    }

    @Override
    public String toString() {
        return path();
    }
}
