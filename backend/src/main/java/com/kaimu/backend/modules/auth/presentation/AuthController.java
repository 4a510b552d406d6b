package com.kaimu.backend.modules.auth.presentation;

import com.kaimu.backend.modules.auth.application.AuthService;
import com.kaimu.backend.modules.auth.presentation.dto.LoginRequest;
import com.kaimu.backend.modules.auth.presentation.dto.LoginResponse;
import com.kaimu.backend.modules.auth.presentation.dto.LogoutRequest;
import com.kaimu.backend.modules.auth.presentation.dto.RefreshRequest;
import com.kaimu.backend.modules.auth.presentation.dto.RegisterRequest;
import com.kaimu.backend.modules.auth.presentation.dto.TokenPairResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/auth/register")
    public ResponseEntity<LoginResponse> register(@Valid @RequestBody RegisterRequest request,
                                                  HttpServletRequest httpRequest) {
        LoginResponse response = authService.register(request, ClientRequestMetadata.from(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(
            summary = "Password login",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Credential pair and profile"),
                    @ApiResponse(responseCode = "401", description = "INVALID_CREDENTIALS"),
                    @ApiResponse(responseCode = "403", description = "PASSWORD_LOGIN_DISABLED for federation-only accounts")
            }
    )
    @PostMapping("/auth/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request,
                                               HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.login(request, ClientRequestMetadata.from(httpRequest)));
    }

    @Operation(
            summary = "Rotate a refresh token",
            description = "Presenting an already rotated or expired token revokes every session of its owner."
    )
    @PostMapping("/auth/refresh")
    public ResponseEntity<TokenPairResponse> refresh(@Valid @RequestBody RefreshRequest request,
                                                     HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.refresh(request, ClientRequestMetadata.from(httpRequest)));
    }

    @PostMapping("/auth/logout")
    public ResponseEntity<Void> logout(@Valid @RequestBody LogoutRequest request) {
        authService.logout(request);
        return ResponseEntity.noContent().build();
    }
}
