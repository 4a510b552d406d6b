package com.kaimu.backend.global.security;

import java.io.IOException;

import com.kaimu.backend.global.error.ProblemException;
import com.kaimu.backend.global.error.ProblemResponse;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        ProblemResponse body = ProblemResponse.of(HttpStatus.UNAUTHORIZED, "unauthorized", authException.getMessage(), request.getRequestURI());
        write(response, HttpStatus.UNAUTHORIZED, body);
    }

    void writeProblem(HttpServletRequest request, HttpServletResponse response, ProblemException ex) throws IOException {
        write(response, HttpStatus.valueOf(ex.getStatusCode().value()), ProblemResponse.of(ex, request.getRequestURI()));
    }

    private void write(HttpServletResponse response, HttpStatus status, ProblemResponse body) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
