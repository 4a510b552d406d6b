package com.kaimu.backend.modules.rbac.domain;

import java.util.Locale;

import com.kaimu.backend.global.error.ProblemException;

/**
 * Resource kinds a permission question can target. Boards carry no memberships of their own
 * and resolve through the owning project.
 */
public enum ResourceType {
    ORGANIZATION,
    PROJECT,
    BOARD;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ResourceType from(String value) {
        if (value != null) {
            for (ResourceType type : values()) {
                if (type.value().equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new ProblemException(AuthorizationError.INVALID_RESOURCE_TYPE, "Unsupported resource type: " + value);
    }
}
