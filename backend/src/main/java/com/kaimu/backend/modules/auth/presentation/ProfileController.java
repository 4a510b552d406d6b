package com.kaimu.backend.modules.auth.presentation;

import com.kaimu.backend.global.security.SecurityUtils;
import com.kaimu.backend.modules.auth.application.AuthService;
import com.kaimu.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProfileController {

    private final AuthService authService;

    public ProfileController(AuthService authService) {
        this.authService = authService;
    }

    @GetMapping("/me")
    public ResponseEntity<UserProfileResponse> me() {
        return ResponseEntity.ok(authService.loadProfile(SecurityUtils.getCurrentUserId()));
    }

    @DeleteMapping("/me/sessions")
    public ResponseEntity<Void> revokeAllSessions() {
        authService.revokeAllSessions(SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }
}
