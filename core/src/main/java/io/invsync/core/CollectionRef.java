package io.invsync.core;

import java.util.Objects;

/**
 * Slash-separated path of a collection, e.g. {@code groups/g1/items}.
 * <p>
 * A collection path always has an odd number of segments: a top-level
 * collection name, then (document id, sub-collection name) pairs.
 */
public record CollectionRef(String path) {

    public CollectionRef {
        Objects.requireNonNull(path, "path");
        String[] segments = PathSegments.split(path);
        if (segments.length % 2 == 0) {
            throw new IllegalArgumentException("collection path must have an odd number of segments: " + path);
        }
    }

    public static CollectionRef of(String first, String... more) {
        return new CollectionRef(PathSegments.join(first, more));
    }

    public DocumentRef document(String id) {
        return new DocumentRef(this, id);
    }

    /** Last path segment. */
    public String name() {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    @Override
    public String toString() {
        return path;
    }
}
