package com.kaimu.backend.modules.oidc.presentation;

import java.util.List;

import com.kaimu.backend.modules.auth.presentation.ClientRequestMetadata;
import com.kaimu.backend.modules.oidc.application.OidcService;
import com.kaimu.backend.modules.oidc.presentation.dto.AuthorizeResponse;
import com.kaimu.backend.modules.oidc.presentation.dto.OidcLoginResponse;
import com.kaimu.backend.modules.oidc.presentation.dto.OidcProviderResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth/oidc")
public class OidcController {

    private final OidcService oidcService;

    public OidcController(OidcService oidcService) {
        this.oidcService = oidcService;
    }

    @GetMapping("/providers")
    public ResponseEntity<List<OidcProviderResponse>> providers() {
        return ResponseEntity.ok(oidcService.listProviders().stream()
                .map(OidcProviderResponse::from)
                .toList());
    }

    @Operation(
            summary = "Start an authorization code + PKCE login",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Provider authorization URL and state"),
                    @ApiResponse(responseCode = "404", description = "PROVIDER_NOT_FOUND")
            }
    )
    @GetMapping("/{provider}/authorize")
    public ResponseEntity<AuthorizeResponse> authorize(
            @PathVariable("provider") String provider,
            @RequestParam(value = "redirect_uri", required = false) String redirectUri
    ) {
        return ResponseEntity.ok(AuthorizeResponse.from(oidcService.beginAuthorization(provider, redirectUri)));
    }

    @Operation(
            summary = "Complete a provider login",
            description = "The state token is single-use. A failed callback cannot be retried with the same state.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Credential pair and profile"),
                    @ApiResponse(responseCode = "400", description = "INVALID_STATE or STATE_EXPIRED"),
                    @ApiResponse(responseCode = "401", description = "INVALID_ID_TOKEN or NONCE_MISMATCH"),
                    @ApiResponse(responseCode = "502", description = "TOKEN_EXCHANGE_FAILED")
            }
    )
    @GetMapping("/{provider}/callback")
    public ResponseEntity<OidcLoginResponse> callback(
            @PathVariable("provider") String provider,
            @RequestParam(value = "code", required = false) String code,
            @RequestParam("state") String state,
            @RequestParam(value = "error", required = false) String error,
            @RequestParam(value = "error_description", required = false) String errorDescription,
            HttpServletRequest httpRequest
    ) {
        if (error != null && !error.isBlank()) {
            oidcService.rejectCallback(provider, state, error, errorDescription);
        }
        OidcService.CallbackResult result =
                oidcService.handleCallback(provider, code, state, ClientRequestMetadata.from(httpRequest));
        return ResponseEntity.ok(OidcLoginResponse.from(result));
    }
}
