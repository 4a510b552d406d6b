package com.kaimu.backend.modules.rbac.application;

/**
 * Codes this module checks itself. The full catalog lives in the permissions table.
 */
public final class PermissionCodes {

    public static final String ORG_VIEW = "org:view";
    public static final String ORG_REMOVE_MEMBERS = "org:remove_members";
    public static final String ORG_MANAGE_ROLES = "org:manage_roles";
    public static final String PROJECT_VIEW = "project:view";
    public static final String PROJECT_MANAGE_MEMBERS = "project:manage_members";

    private PermissionCodes() {
    }
}
