package com.kaimu.backend.modules.auth.application;

import java.util.UUID;

import com.kaimu.backend.global.error.ProblemException;
import com.kaimu.backend.modules.auth.domain.ClientMetadata;
import com.kaimu.backend.modules.auth.domain.CredentialError;
import com.kaimu.backend.modules.auth.domain.User;
import com.kaimu.backend.modules.auth.infrastructure.persistence.UserRepository;
import com.kaimu.backend.modules.auth.presentation.dto.LoginRequest;
import com.kaimu.backend.modules.auth.presentation.dto.LoginResponse;
import com.kaimu.backend.modules.auth.presentation.dto.LogoutRequest;
import com.kaimu.backend.modules.auth.presentation.dto.RefreshRequest;
import com.kaimu.backend.modules.auth.presentation.dto.RegisterRequest;
import com.kaimu.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.kaimu.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokenService;

    public AuthService(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            TokenService tokenService
    ) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.tokenService = tokenService;
    }

    @Transactional
    public LoginResponse register(RegisterRequest request, ClientMetadata clientMetadata) {
        String username = request.username().trim();
        if (userRepository.existsByUsername(username)) {
            throw new ProblemException(CredentialError.USERNAME_TAKEN);
        }

        User user = new User();
        user.setUsername(username);
        user.setEmail(request.email().trim());
        user.setEmailVerified(false);
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(CredentialError.USERNAME_TAKEN, null, ex);
        }

        TokenPair tokens = tokenService.issuePair(user.getId(), clientMetadata);
        return new LoginResponse(TokenPairResponse.from(tokens), UserProfileResponse.from(user));
    }

    public LoginResponse login(LoginRequest request, ClientMetadata clientMetadata) {
        User user = userRepository.findByUsername(request.username().trim())
                .orElseThrow(() -> new ProblemException(CredentialError.INVALID_CREDENTIALS));

        if (!user.hasPassword()) {
            throw new ProblemException(CredentialError.PASSWORD_LOGIN_DISABLED);
        }

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw new ProblemException(CredentialError.INVALID_CREDENTIALS);
        }

        TokenPair tokens = tokenService.issuePair(user.getId(), clientMetadata);
        return new LoginResponse(TokenPairResponse.from(tokens), UserProfileResponse.from(user));
    }

    public TokenPairResponse refresh(RefreshRequest request, ClientMetadata clientMetadata) {
        return TokenPairResponse.from(tokenService.rotate(request.refreshToken(), clientMetadata));
    }

    public void logout(LogoutRequest request) {
        // Unknown tokens get the same response so token validity is not disclosed.
        tokenService.revoke(request.refreshToken());
    }

    public void revokeAllSessions(UUID userId) {
        tokenService.revokeAllForPrincipal(userId);
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(CredentialError.USER_NOT_FOUND));
        return UserProfileResponse.from(user);
    }
}
