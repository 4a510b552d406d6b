package com.kaimu.backend.modules.auth.domain;

/**
 * Client details stored next to a refresh token.
 */
public record ClientMetadata(String userAgent, String ipAddress) {

    public static final ClientMetadata UNKNOWN = new ClientMetadata(null, null);

    private static final int IP_ADDRESS_MAX_LENGTH = 45;
    private static final int USER_AGENT_MAX_LENGTH = 512;

    public static ClientMetadata of(String userAgent, String ipAddress) {
        return new ClientMetadata(truncate(userAgent, USER_AGENT_MAX_LENGTH), truncate(ipAddress, IP_ADDRESS_MAX_LENGTH));
    }

    private static String truncate(String raw, int maxLength) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > maxLength ? trimmed.substring(0, maxLength) : trimmed;
    }
}
