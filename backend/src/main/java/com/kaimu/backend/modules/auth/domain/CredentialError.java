package com.kaimu.backend.modules.auth.domain;

import com.kaimu.backend.global.error.ErrorCode;

import org.springframework.http.HttpStatus;

public enum CredentialError implements ErrorCode {

    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid username or password"),
    // Distinct from INVALID_CREDENTIALS so clients can redirect to federated login.
    PASSWORD_LOGIN_DISABLED(HttpStatus.FORBIDDEN, "Password login is disabled for this user"),
    INVALID_ACCESS_TOKEN(HttpStatus.UNAUTHORIZED, "Invalid or expired access token"),
    INVALID_REFRESH_TOKEN(HttpStatus.UNAUTHORIZED, "Invalid or expired refresh token"),
    REFRESH_TOKEN_REVOKED(HttpStatus.UNAUTHORIZED, "Refresh token has been revoked"),
    USERNAME_TAKEN(HttpStatus.CONFLICT, "Username already exists"),
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "User not found");

    private final HttpStatus status;
    private final String defaultDetail;

    CredentialError(HttpStatus status, String defaultDetail) {
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
