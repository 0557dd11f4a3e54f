package io.invsync.core;

import java.util.Locale;
import java.util.Optional;

/**
 * Role of a user inside a group. Stored lower-case ("owner", "admin", "member").
 */
public enum GroupRole {
    OWNER,
    ADMIN,
    MEMBER;

    /** Wire/storage form. */
    public String storedName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Owners and admins may edit group items. */
    public boolean canEditItems() {
        return this == OWNER || this == ADMIN;
    }

    /**
     * Decode a stored role.
     *
     * @return the role, or empty if {@code raw} is null or not a known role
     */
    public static Optional<GroupRole> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (GroupRole r : values()) {
            if (r.name().equals(normalized)) {
                return Optional.of(r);
            }
        }
        return Optional.empty();
    }
}
