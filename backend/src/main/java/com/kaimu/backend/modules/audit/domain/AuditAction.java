package com.kaimu.backend.modules.audit.domain;

public enum AuditAction {
    REFRESH_TOKEN_REUSE,
    ROLE_CREATED,
    ROLE_UPDATED,
    ROLE_DELETED,
    ORG_ROLE_ASSIGNED,
    PROJECT_ROLE_ASSIGNED,
    ORG_MEMBER_REMOVED,
    PROJECT_MEMBER_REMOVED,
    OIDC_IDENTITY_LINKED,
    OIDC_IDENTITY_UNLINKED
}
