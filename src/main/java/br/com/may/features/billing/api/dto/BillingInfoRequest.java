package br.com.may.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@Schema(name = "BillingInfoRequest", description = "Payer data required by the gateway")
public record BillingInfoRequest(
        @NotBlank(message = "Name is required")
        String name,

        @NotBlank(message = "Email is required")
        @Email(message = "Email must be valid")
        String email,

        @Schema(description = "CPF (11 digits) or CNPJ (14 digits); punctuation is ignored", example = "123.456.789-09")
        @NotBlank(message = "CPF or CNPJ is required")
        String document,

        @Schema(example = "+55 11 91234-5678")
        @NotBlank(message = "Phone is required")
        String phone,

        @NotNull(message = "Address is required")
        @Valid
        AddressRequest address
) {}
