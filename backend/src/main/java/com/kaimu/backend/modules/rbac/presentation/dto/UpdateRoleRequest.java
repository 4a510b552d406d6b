package com.kaimu.backend.modules.rbac.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Omitted fields stay as they are. {@code permissions}, when present, replaces the whole set.
 */
public record UpdateRoleRequest(
        @Size(max = 100) @Pattern(regexp = ".*\\S.*", message = "must not be blank") String name,
        @Size(max = 1000) String description,
        List<@NotBlank String> permissions
) {
}
