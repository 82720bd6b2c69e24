package br.com.may.features.billing.infra.mapping;

import br.com.may.features.billing.api.dto.SubscriptionDto;
import br.com.may.features.billing.domain.model.BillingCycle;
import br.com.may.features.billing.domain.model.GatewayProvider;
import br.com.may.features.billing.domain.model.Subscription;
import br.com.may.features.billing.domain.model.SubscriptionStatus;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;
import org.mapstruct.ReportingPolicy;

import java.util.Locale;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface SubscriptionMapper {

    @Mapping(target = "status", source = "status", qualifiedByName = "statusValue")
    @Mapping(target = "provider", source = "provider", qualifiedByName = "providerValue")
    @Mapping(target = "plan", source = "planCode")
    @Mapping(target = "billingCycle", source = "billingCycle", qualifiedByName = "cycleValue")
    SubscriptionDto toDto(Subscription subscription);

    @Named("statusValue")
    default String statusValue(SubscriptionStatus status) {
        return status != null ? status.name().toLowerCase(Locale.ROOT) : null;
    }

    @Named("providerValue")
    default String providerValue(GatewayProvider provider) {
        return provider != null ? provider.name().toLowerCase(Locale.ROOT) : null;
    }

    @Named("cycleValue")
    default String cycleValue(BillingCycle cycle) {
        return cycle != null ? cycle.apiValue() : null;
    }
}
