package com.kaimu.backend.modules.oidc.presentation;

import java.util.List;

import com.kaimu.backend.global.security.SecurityUtils;
import com.kaimu.backend.modules.oidc.application.OidcService;
import com.kaimu.backend.modules.oidc.presentation.dto.LinkedIdentityResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/me/identities")
public class IdentityController {

    private final OidcService oidcService;

    public IdentityController(OidcService oidcService) {
        this.oidcService = oidcService;
    }

    @GetMapping
    public ResponseEntity<List<LinkedIdentityResponse>> list() {
        return ResponseEntity.ok(oidcService.listIdentities(SecurityUtils.getCurrentUserId()).stream()
                .map(LinkedIdentityResponse::from)
                .toList());
    }

    @DeleteMapping("/{provider}")
    public ResponseEntity<Void> unlink(@PathVariable("provider") String provider) {
        oidcService.unlink(SecurityUtils.getCurrentUserId(), provider);
        return ResponseEntity.noContent().build();
    }
}
