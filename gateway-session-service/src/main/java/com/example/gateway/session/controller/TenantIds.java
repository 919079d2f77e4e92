package com.example.gateway.session.controller;

import com.example.gateway.shared.exception.ValidationException;

import java.util.regex.Pattern;

/**
 * Tenant ids end up in file names, so only a conservative character set is accepted.
 */
final class TenantIds {

    private static final Pattern VALID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    private TenantIds() {
    }

    static String requireValid(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new ValidationException("tenant id is required");
        }
        if (!VALID.matcher(tenantId).matches() || tenantId.equals(".") || tenantId.equals("..")) {
            throw new ValidationException("Invalid tenant id: must match [A-Za-z0-9._-]{1,64}");
        }
        return tenantId;
    }
}
