package br.com.may.features.billing.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record TokenizeCardRequest(
        @NotBlank(message = "Card number is required")
        @Pattern(regexp = "\\d{13,19}", message = "Card number must have 13 to 19 digits")
        String number,

        @NotBlank(message = "Holder name is required")
        String holderName,

        @Min(value = 1, message = "Expiration month must be between 1 and 12")
        @Max(value = 12, message = "Expiration month must be between 1 and 12")
        int expMonth,

        @Min(value = 2000, message = "Expiration year must have four digits")
        int expYear,

        @NotBlank(message = "CVV is required")
        @Pattern(regexp = "\\d{3,4}", message = "CVV must have 3 or 4 digits")
        String cvv
) {

    @Override
    public String toString() {
        return "TokenizeCardRequest[holderName=" + holderName + ", expMonth=" + expMonth + ", expYear=" + expYear + "]";
    }
}
