package com.complaintportal.security;

import java.time.Instant;

public record AdminTokenClaims(String subject, String role, Instant issuedAt, Instant expiresAt) {

    public boolean isAdmin() {
        return AdminTokenService.ADMIN_ROLE.equals(role);
    }
}
