package br.com.may.features.billing.infra.mapping;

import br.com.may.features.billing.api.dto.PaymentDto;
import br.com.may.features.billing.domain.model.GatewayProvider;
import br.com.may.features.billing.domain.model.Payment;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;
import org.mapstruct.ReportingPolicy;

import java.util.List;
import java.util.Locale;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface PaymentMapper {

    @Mapping(target = "provider", source = "provider", qualifiedByName = "providerValue")
    PaymentDto toDto(Payment payment);

    List<PaymentDto> toDtos(List<Payment> payments);

    @Named("providerValue")
    default String providerValue(GatewayProvider provider) {
        return provider != null ? provider.name().toLowerCase(Locale.ROOT) : null;
    }
}
