package com.kaimu.backend.global.security;

import java.util.UUID;

public record AuthenticatedPrincipal(UUID userId) {
}
