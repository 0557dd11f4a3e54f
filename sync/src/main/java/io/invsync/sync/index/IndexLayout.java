package io.invsync.sync.index;

import io.invsync.core.DocumentRef;

/**
 * Where fan-out index records live.
 * <p>
 * A fan-out index mirrors "member M belongs to root R" under the member's
 * own subtree, so a member can list its roots without a collection-group
 * query.
 */
public interface IndexLayout {

    /** Index record telling {@code memberId} it belongs to {@code rootId}. */
    DocumentRef indexRecord(String memberId, String rootId);

    /** Root document the index points at. */
    DocumentRef root(String rootId);
}
