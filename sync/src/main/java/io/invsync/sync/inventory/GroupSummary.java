package io.invsync.sync.inventory;

import io.invsync.core.GroupRole;

import java.util.Comparator;
import java.util.Locale;

/**
 * A group as shown in a user's group list: the group's own name and
 * description plus the user's role from their index record.
 */
public record GroupSummary(String groupId, String name, String description, GroupRole role) {

    static final String DEFAULT_NAME = "Group";

    /** Groups the user owns first, then by name ignoring case. */
    public static final Comparator<GroupSummary> LIST_ORDER = Comparator
            .comparing((GroupSummary g) -> g.role() == GroupRole.OWNER ? 0 : 1)
            .thenComparing(g -> g.name().toLowerCase(Locale.ROOT))
            .thenComparing(GroupSummary::groupId);

    GroupSummary withRole(GroupRole newRole) {
        return new GroupSummary(groupId, name, description, newRole);
    }
}
