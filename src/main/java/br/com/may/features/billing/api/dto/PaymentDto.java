package br.com.may.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "PaymentDto", description = "Ledger entry for one payment attempt")
public record PaymentDto(
        UUID id,
        String provider,
        String providerTransactionId,
        String providerInvoiceId,
        @Schema(example = "97.00")
        BigDecimal amount,
        String currency,
        @Schema(example = "PAID")
        String status,
        String method,
        String failureReason,
        LocalDateTime paidAt,
        LocalDateTime failedAt,
        LocalDateTime createdAt
) {}
