package com.kaimu.backend.modules.rbac.domain;

public enum RoleScope {
    ORGANIZATION,
    PROJECT,
    BOARD
}
