package io.invsync.core;

import java.util.Map;
import java.util.Objects;

/**
 * A single write inside an atomic commit.
 */
public sealed interface WriteOp permits WriteOp.Set, WriteOp.Delete {

    DocumentRef ref();

    /**
     * Create or overwrite a document.
     * With {@code merge=true} only the given fields are replaced and the rest
     * of an existing document is kept.
     */
    record Set(DocumentRef ref, Map<String, Object> fields, boolean merge) implements WriteOp {
        public Set {
            Objects.requireNonNull(ref, "ref");
            fields = Fields.writable(fields);
        }
    }

    /** Delete a document. Deleting a missing document is a no-op. */
    record Delete(DocumentRef ref) implements WriteOp {
        public Delete {
            Objects.requireNonNull(ref, "ref");
        }
    }

    static WriteOp set(DocumentRef ref, Map<String, ?> fields) {
        return new Set(ref, Fields.writable(fields), false);
    }

    static WriteOp merge(DocumentRef ref, Map<String, ?> fields) {
        return new Set(ref, Fields.writable(fields), true);
    }

    static WriteOp delete(DocumentRef ref) {
        return new Delete(ref);
    }
}
