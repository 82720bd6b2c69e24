package br.com.may.features.billing.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BillingCycleTest {

    @Test
    @DisplayName("advance adds one, six or twelve months")
    void advance() {
        LocalDateTime start = LocalDateTime.of(2025, 1, 31, 10, 0);

        assertThat(BillingCycle.MONTHLY.advance(start)).isEqualTo(LocalDateTime.of(2025, 2, 28, 10, 0));
        assertThat(BillingCycle.SEMIANNUAL.advance(start)).isEqualTo(LocalDateTime.of(2025, 7, 31, 10, 0));
        assertThat(BillingCycle.ANNUAL.advance(start)).isEqualTo(LocalDateTime.of(2026, 1, 31, 10, 0));
        assertThat(BillingCycle.PER_INVOICE.advance(start)).isEqualTo(LocalDateTime.of(2025, 2, 28, 10, 0));
    }

    @Test
    @DisplayName("fromValue accepts API values and Portuguese aliases")
    void fromValue() {
        assertThat(BillingCycle.fromValue("monthly")).isEqualTo(BillingCycle.MONTHLY);
        assertThat(BillingCycle.fromValue(" Anual ")).isEqualTo(BillingCycle.ANNUAL);
        assertThat(BillingCycle.fromValue("semestral")).isEqualTo(BillingCycle.SEMIANNUAL);
        assertThat(BillingCycle.fromValue(null)).isEqualTo(BillingCycle.MONTHLY);
        assertThatThrownBy(() -> BillingCycle.fromValue("weekly"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Money converts centavos both ways")
    void money() {
        assertThat(Money.fromCents(9700)).isEqualByComparingTo(new BigDecimal("97.00"));
        assertThat(Money.toCents(new BigDecimal("1100.5"))).isEqualTo(110050L);
        assertThatThrownBy(() -> Money.toCents(new BigDecimal("1.005")))
                .isInstanceOf(ArithmeticException.class);
    }
}
