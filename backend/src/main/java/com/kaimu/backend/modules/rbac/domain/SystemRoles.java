package com.kaimu.backend.modules.rbac.domain;

import java.util.Set;
import java.util.UUID;

/**
 * Fixed ids of the built-in roles seeded by the initial migration.
 */
public final class SystemRoles {

    public static final UUID OWNER_ID = UUID.fromString("00000000-0000-0000-0000-000000000001");
    public static final UUID ADMIN_ID = UUID.fromString("00000000-0000-0000-0000-000000000002");
    public static final UUID MEMBER_ID = UUID.fromString("00000000-0000-0000-0000-000000000003");
    public static final UUID VIEWER_ID = UUID.fromString("00000000-0000-0000-0000-000000000004");

    public static final Set<UUID> ALL = Set.of(OWNER_ID, ADMIN_ID, MEMBER_ID, VIEWER_ID);

    public static final String LEGACY_OWNER = "owner";

    private SystemRoles() {
    }

    /**
     * Maps a role string from memberships that predate explicit role references.
     * Anything unrecognised gets read-only access.
     */
    public static UUID fromLegacy(String legacyRole) {
        if (legacyRole == null) {
            return VIEWER_ID;
        }
        return switch (legacyRole) {
            case LEGACY_OWNER -> OWNER_ID;
            case "admin" -> ADMIN_ID;
            case "member" -> MEMBER_ID;
            default -> VIEWER_ID;
        };
    }
}
