package br.com.may.features.billing.application.gateway;

import br.com.may.features.billing.domain.exception.GatewayValidationException;
import br.com.may.features.billing.domain.model.GatewayProvider;

/**
 * Identifier checks shared by the gateway adapters. Customer, card, token and order references are
 * not interchangeable; passing the wrong one is a programming error and fails before any HTTP call.
 */
public final class GatewayIds {

    private GatewayIds() {
    }

    public static String require(GatewayProvider provider, String id, String prefix, String name) {
        if (id == null || id.isBlank()) {
            throw new GatewayValidationException(provider, name + " is required");
        }
        if (!id.startsWith(prefix)) {
            throw new GatewayValidationException(provider,
                    name + " must start with '" + prefix + "' but was '" + abbreviate(id) + "'");
        }
        return id;
    }

    public static boolean hasPrefix(String id, String prefix) {
        return id != null && id.startsWith(prefix);
    }

    /**
     * Amounts are integer centavos and at least one.
     */
    public static long requireAmount(GatewayProvider provider, long amountCents) {
        if (amountCents < 1) {
            throw new GatewayValidationException(provider,
                    "Amount must be a positive integer in cents, got " + amountCents);
        }
        return amountCents;
    }

    private static String abbreviate(String id) {
        return id.length() <= 8 ? id : id.substring(0, 8) + "...";
    }
}
