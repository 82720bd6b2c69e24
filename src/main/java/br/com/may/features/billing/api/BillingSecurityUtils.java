package br.com.may.features.billing.api;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.UUID;

/**
 * Utility class for extracting the calling user from the security context in billing operations.
 */
public final class BillingSecurityUtils {

    private BillingSecurityUtils() {
    }

    /**
     * Extract the current user ID from the security context. The JWT subject is the user UUID.
     *
     * @throws IllegalStateException if no authenticated user is found
     */
    public static UUID getCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            throw new IllegalStateException("No authenticated user found");
        }

        String userIdStr = authentication.getName();
        if (userIdStr == null || userIdStr.isEmpty()) {
            throw new IllegalStateException("User ID not found in authentication");
        }

        try {
            return UUID.fromString(userIdStr);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid user ID format in authentication: " + userIdStr);
        }
    }
}
