package com.kaimu.backend.modules.oidc.domain;

import com.kaimu.backend.global.error.ErrorCode;

import org.springframework.http.HttpStatus;

public enum FederationError implements ErrorCode {

    PROVIDER_NOT_FOUND(HttpStatus.NOT_FOUND, "OIDC provider not found"),
    INVALID_STATE(HttpStatus.BAD_REQUEST, "Invalid or missing state parameter"),
    STATE_EXPIRED(HttpStatus.BAD_REQUEST, "State parameter has expired"),
    TOKEN_EXCHANGE_FAILED(HttpStatus.BAD_GATEWAY, "Failed to exchange authorization code for tokens"),
    INVALID_ID_TOKEN(HttpStatus.UNAUTHORIZED, "Invalid ID token"),
    NONCE_MISMATCH(HttpStatus.UNAUTHORIZED, "ID token nonce does not match"),
    IDENTITY_LINK_FAILED(HttpStatus.CONFLICT, "Failed to link OIDC identity to user"),
    PRINCIPAL_CREATION_FAILED(HttpStatus.CONFLICT, "Failed to create user from OIDC identity"),
    PROVIDER_UNAVAILABLE(HttpStatus.GATEWAY_TIMEOUT, "OIDC provider could not be reached"),
    IDENTITY_NOT_FOUND(HttpStatus.NOT_FOUND, "No identity linked for this provider");

    private final HttpStatus status;
    private final String defaultDetail;

    FederationError(HttpStatus status, String defaultDetail) {
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
