package com.kaimu.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class ProblemException extends ResponseStatusException {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:kaimu:";

    private final ErrorCode errorCode;
    private final String code;
    private final String detail;
    private final String type;

    public ProblemException(ErrorCode errorCode) {
        this(errorCode, null, null);
    }

    public ProblemException(ErrorCode errorCode, String detail) {
        this(errorCode, detail, null);
    }

    public ProblemException(ErrorCode errorCode, String detail, Throwable cause) {
        this(errorCode, errorCode.status(), errorCode.code(),
                (detail != null && !detail.isBlank()) ? detail : errorCode.defaultDetail(), cause);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        this(null, status, code, detail, null);
    }

    private ProblemException(ErrorCode errorCode, HttpStatus status, String code, String detail, Throwable cause) {
        super(status, code, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.errorCode = errorCode;
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        String normalized = code.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
        this.type = DEFAULT_TYPE_PREFIX + normalized;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }
}
