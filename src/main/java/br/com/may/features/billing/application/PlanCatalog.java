package br.com.may.features.billing.application;

import br.com.may.features.billing.domain.model.BillingCycle;
import br.com.may.features.billing.domain.model.Money;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Self-service plans and their prices in centavos per billing cycle.
 */
@Component
public class PlanCatalog {

    public static final String TRIAL = "trial";

    private static final Map<String, Plan> PLANS = new LinkedHashMap<>();

    static {
        register(new Plan("pro", "MAY Pro", prices(9700, 54000L, 97000L), false));
        register(new Plan("business", "MAY Business", prices(19700, 110000L, 197000L), false));
        // essential and professional are sold monthly or annually, annual at a discounted monthly rate
        register(new Plan("essential", "MAY Essencial", prices(7900, null, 3900L * 12), false));
        register(new Plan("professional", "MAY Profissional", prices(14900, null, 12900L * 12), false));
        register(new Plan("accountant", "MAY Contador", Map.of(), true));
        register(new Plan(TRIAL, "Teste gratuito", prices(0, null, null), false));
    }

    public record Plan(String code, String displayName, Map<BillingCycle, Long> pricesCents,
                       boolean customPricing) {

        public boolean offers(BillingCycle cycle) {
            return pricesCents.containsKey(cycle);
        }

        public boolean isTrial() {
            return TRIAL.equals(code);
        }
    }

    public Optional<Plan> find(String planCode) {
        if (planCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(PLANS.get(planCode.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Plan that can be bought through self-service checkout.
     *
     * @throws IllegalArgumentException for unknown plans and plans with negotiated pricing
     */
    public Plan requirePurchasable(String planCode) {
        Plan plan = find(planCode)
                .orElseThrow(() -> new IllegalArgumentException("Unknown plan: " + planCode));
        if (plan.customPricing()) {
            throw new IllegalArgumentException("Plan '" + plan.code() + "' has custom pricing; contact sales");
        }
        return plan;
    }

    /**
     * @throws IllegalArgumentException if the plan is not sold in the given cycle
     */
    public long priceCents(Plan plan, BillingCycle cycle) {
        Long cents = plan.pricesCents().get(cycle);
        if (cents == null) {
            throw new IllegalArgumentException(
                    "Plan '" + plan.code() + "' is not offered with billing cycle " + cycle.apiValue());
        }
        return cents;
    }

    public BigDecimal price(Plan plan, BillingCycle cycle) {
        return Money.fromCents(priceCents(plan, cycle));
    }

    public Collection<Plan> all() {
        return PLANS.values();
    }

    private static void register(Plan plan) {
        PLANS.put(plan.code(), plan);
    }

    private static Map<BillingCycle, Long> prices(long monthly, Long semiannual, Long annual) {
        Map<BillingCycle, Long> prices = new EnumMap<>(BillingCycle.class);
        prices.put(BillingCycle.MONTHLY, monthly);
        if (semiannual != null) {
            prices.put(BillingCycle.SEMIANNUAL, semiannual);
        }
        if (annual != null) {
            prices.put(BillingCycle.ANNUAL, annual);
        }
        return Map.copyOf(prices);
    }
}
