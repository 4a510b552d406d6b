package com.kaimu.backend.modules.rbac.domain;

import com.kaimu.backend.global.error.ErrorCode;

import org.springframework.http.HttpStatus;

public enum AuthorizationError implements ErrorCode {

    ROLE_NOT_FOUND(HttpStatus.NOT_FOUND, "Role not found"),
    CANNOT_MODIFY_SYSTEM_ROLE(HttpStatus.FORBIDDEN, "System roles cannot be modified or deleted"),
    CANNOT_DELETE_OWNER_ASSIGNMENT(HttpStatus.FORBIDDEN, "Only an owner can change or remove another owner"),
    LAST_OWNER_VIOLATION(HttpStatus.CONFLICT, "An organization must keep at least one owner"),
    INVALID_PERMISSION_CODE(HttpStatus.UNPROCESSABLE_ENTITY, "Unknown permission code"),
    PERMISSION_DENIED(HttpStatus.FORBIDDEN, "Permission denied"),
    MEMBERSHIP_NOT_FOUND(HttpStatus.NOT_FOUND, "Membership not found"),
    ROLE_NAME_CONFLICT(HttpStatus.CONFLICT, "A role with this name already exists"),
    RESOURCE_NOT_FOUND(HttpStatus.NOT_FOUND, "Resource not found"),
    INVALID_RESOURCE_TYPE(HttpStatus.BAD_REQUEST, "Unsupported resource type");

    private final HttpStatus status;
    private final String defaultDetail;

    AuthorizationError(HttpStatus status, String defaultDetail) {
        this.status = status;
        this.defaultDetail = defaultDetail;
    }

    @Override
    public HttpStatus status() {
        return status;
    }

    @Override
    public String code() {
        return name();
    }

    @Override
    public String defaultDetail() {
        return defaultDetail;
    }
}
