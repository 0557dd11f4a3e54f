package io.invsync.sync.delete;

import io.invsync.core.CollectionRef;
import io.invsync.core.Document;
import io.invsync.core.DocumentRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Describes what belongs to a root document and must go with it.
 * <p>
 * Order of deletion:
 *  1. every dependent collection, in declaration order; each dependent
 *     document may bring linked records stored elsewhere;
 *  2. auxiliary records derived from the root's own fields;
 *  3. the root itself.
 * <p>
 * Auxiliary refs are resolved from the root before anything is deleted: a
 * resolver that throws fails the cascade with nothing removed.
 */
public final class DeletionPlan {

    /**
     * One dependent collection.
     *
     * @param name       label used in logs
     * @param collection collection to drain, derived from the root document
     * @param linked     extra records to delete with each dependent document
     *                   (root, dependent) -> refs
     */
    public record DependentStep(
            String name,
            Function<Document, CollectionRef> collection,
            BiFunction<Document, Document, List<DocumentRef>> linked
    ) {
        public DependentStep {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(collection, "collection");
            Objects.requireNonNull(linked, "linked");
        }
    }

    private final DocumentRef root;
    private final List<DependentStep> dependents;
    private final Function<Document, List<DocumentRef>> auxiliary;

    private DeletionPlan(Builder b) {
        this.root = b.root;
        this.dependents = List.copyOf(b.dependents);
        this.auxiliary = b.auxiliary;
    }

    public static Builder builder(DocumentRef root) {
        return new Builder(root);
    }

    public DocumentRef root() {
        return root;
    }

    public List<DependentStep> dependents() {
        return dependents;
    }

    public List<DocumentRef> auxiliaryRecords(Document rootDoc) {
        return List.copyOf(auxiliary.apply(rootDoc));
    }

    public static final class Builder {
        private final DocumentRef root;
        private final List<DependentStep> dependents = new ArrayList<>();
        private Function<Document, List<DocumentRef>> auxiliary = root -> List.of();

        private Builder(DocumentRef root) {
            this.root = Objects.requireNonNull(root, "root");
        }

        public Builder dependent(String name, Function<Document, CollectionRef> collection) {
            return dependent(name, collection, (root, doc) -> List.of());
        }

        public Builder dependent(
                String name,
                Function<Document, CollectionRef> collection,
                BiFunction<Document, Document, List<DocumentRef>> linked
        ) {
            dependents.add(new DependentStep(name, collection, linked));
            return this;
        }

        public Builder auxiliary(Function<Document, List<DocumentRef>> resolver) {
            this.auxiliary = Objects.requireNonNull(resolver, "resolver");
            return this;
        }

        public DeletionPlan build() {
            return new DeletionPlan(this);
        }
    }
}
