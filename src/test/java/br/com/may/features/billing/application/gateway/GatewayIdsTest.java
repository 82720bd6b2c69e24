package br.com.may.features.billing.application.gateway;

import br.com.may.features.billing.domain.exception.GatewayValidationException;
import br.com.may.features.billing.domain.model.GatewayProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GatewayIdsTest {

    @Test
    @DisplayName("require returns an id with the expected prefix")
    void requireAccepts() {
        assertThat(GatewayIds.require(GatewayProvider.PAGARME, "cus_123", "cus_", "customerId")).isEqualTo("cus_123");
    }

    @Test
    @DisplayName("require rejects a card id passed as a customer id, abbreviating it")
    void requireWrongPrefix() {
        assertThatThrownBy(() -> GatewayIds.require(GatewayProvider.PAGARME, "card_abcdefghijk", "cus_", "customerId"))
                .isInstanceOf(GatewayValidationException.class)
                .hasMessageContaining("must start with 'cus_'")
                .hasMessageContaining("card_abc...")
                .satisfies(e -> assertThat(((GatewayValidationException) e).isRetryable()).isFalse());
    }

    @Test
    @DisplayName("require rejects a blank id")
    void requireBlank() {
        assertThatThrownBy(() -> GatewayIds.require(GatewayProvider.PAGARME, " ", "tok_", "cardToken"))
                .isInstanceOf(GatewayValidationException.class)
                .hasMessage("cardToken is required");
    }

    @Test
    @DisplayName("amounts must be at least one centavo")
    void amounts() {
        assertThat(GatewayIds.requireAmount(GatewayProvider.PAGARME, 1)).isEqualTo(1);
        assertThatThrownBy(() -> GatewayIds.requireAmount(GatewayProvider.PAGARME, 0))
                .isInstanceOf(GatewayValidationException.class);
    }

    @Test
    @DisplayName("hasPrefix is null-safe")
    void hasPrefix() {
        assertThat(GatewayIds.hasPrefix(null, "sub_")).isFalse();
        assertThat(GatewayIds.hasPrefix("sub_1", "sub_")).isTrue();
    }
}
