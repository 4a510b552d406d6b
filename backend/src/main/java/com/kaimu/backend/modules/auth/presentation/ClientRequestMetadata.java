package com.kaimu.backend.modules.auth.presentation;

import com.kaimu.backend.modules.auth.domain.ClientMetadata;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;

public final class ClientRequestMetadata {

    private ClientRequestMetadata() {
    }

    public static ClientMetadata from(HttpServletRequest request) {
        return ClientMetadata.of(request.getHeader(HttpHeaders.USER_AGENT), request.getRemoteAddr());
    }
}
