package com.kaimu.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import com.kaimu.backend.global.error.ProblemException;
import com.kaimu.backend.modules.auth.domain.ClientMetadata;
import com.kaimu.backend.modules.auth.domain.CredentialError;
import com.kaimu.backend.modules.auth.domain.User;
import com.kaimu.backend.modules.auth.infrastructure.persistence.UserRepository;
import com.kaimu.backend.modules.auth.presentation.dto.LoginRequest;
import com.kaimu.backend.modules.auth.presentation.dto.LoginResponse;
import com.kaimu.backend.modules.auth.presentation.dto.RegisterRequest;
import com.kaimu.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final ClientMetadata CLIENT = ClientMetadata.of("JUnit", "127.0.0.1");

    @Mock
    private UserRepository userRepository;

    @Mock
    private TokenService tokenService;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);

    private AuthService authService;

    @BeforeEach
    void setUp() {
        authService = new AuthService(userRepository, passwordEncoder, tokenService);
    }

    @Test
    void registeredUserCanLogInWithSameCredentials() {
        AtomicReference<User> saved = new AtomicReference<>();
        when(userRepository.existsByUsername("alice")).thenReturn(false);
        when(userRepository.saveAndFlush(any(User.class))).thenAnswer(invocation -> {
            User user = TestEntities.withId(invocation.<User>getArgument(0), UUID.randomUUID());
            saved.set(user);
            return user;
        });
        when(tokenService.issuePair(any(UUID.class), eq(CLIENT)))
                .thenAnswer(invocation -> new TokenPair("access", "refresh-" + UUID.randomUUID(), 900L));

        LoginResponse registered = authService.register(new RegisterRequest(" alice ", "alice@example.com", "s3cret-pass"), CLIENT);

        assertThat(registered.user().username()).isEqualTo("alice");
        assertThat(registered.user().emailVerified()).isFalse();
        assertThat(saved.get().getPasswordHash()).isNotEqualTo("s3cret-pass");

        when(userRepository.findByUsername("alice")).thenReturn(Optional.of(saved.get()));
        LoginResponse login = authService.login(new LoginRequest("alice", "s3cret-pass"), CLIENT);

        assertThat(login.tokens().expiresInSeconds()).isEqualTo(900L);
        assertThat(login.tokens().tokenType()).isEqualTo("Bearer");
        assertThat(login.user().userId()).isEqualTo(saved.get().getId());
    }

    @Test
    void registerRejectsTakenUsername() {
        when(userRepository.existsByUsername("alice")).thenReturn(true);

        assertThatThrownBy(() -> authService.register(new RegisterRequest("alice", "a@example.com", "password1"), CLIENT))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(CredentialError.USERNAME_TAKEN));
    }

    @Test
    void registerMapsConcurrentInsertToUsernameTaken() {
        when(userRepository.existsByUsername("alice")).thenReturn(false);
        when(userRepository.saveAndFlush(any(User.class))).thenThrow(new DataIntegrityViolationException("uq_users_username"));

        assertThatThrownBy(() -> authService.register(new RegisterRequest("alice", "a@example.com", "password1"), CLIENT))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(CredentialError.USERNAME_TAKEN));
        verify(tokenService, never()).issuePair(any(), any());
    }

    @Test
    void loginWithUnknownUsernameIsInvalidCredentials() {
        when(userRepository.findByUsername("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.login(new LoginRequest("ghost", "whatever"), CLIENT))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(CredentialError.INVALID_CREDENTIALS));
    }

    @Test
    void federationOnlyAccountGetsDistinctError() {
        User federated = new User();
        federated.setUsername("bob_1a2b3c4d");
        when(userRepository.findByUsername("bob_1a2b3c4d")).thenReturn(Optional.of(federated));

        assertThatThrownBy(() -> authService.login(new LoginRequest("bob_1a2b3c4d", "anything"), CLIENT))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(CredentialError.PASSWORD_LOGIN_DISABLED));
        verify(tokenService, never()).issuePair(any(), any());
    }

    @Test
    void wrongPasswordIsInvalidCredentials() {
        User user = new User();
        user.setUsername("carol");
        user.setPasswordHash(passwordEncoder.encode("right-password"));
        when(userRepository.findByUsername("carol")).thenReturn(Optional.of(user));

        assertThatThrownBy(() -> authService.login(new LoginRequest("carol", "wrong-password"), CLIENT))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(CredentialError.INVALID_CREDENTIALS));
        verify(tokenService, never()).issuePair(any(), any());
    }
}
