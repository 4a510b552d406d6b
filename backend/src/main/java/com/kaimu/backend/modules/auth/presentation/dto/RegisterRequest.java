package com.kaimu.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "username is required") @Size(min = 3, max = 50) String username,
        @NotBlank(message = "email is required") @Email String email,
        @NotBlank(message = "password is required") @Size(min = 8, max = 72) String password
) {
}
