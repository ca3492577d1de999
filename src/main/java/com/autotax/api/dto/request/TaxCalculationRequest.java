package com.autotax.api.dto.request;

import com.autotax.domain.model.TaxCalculationInput;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a tax calculation. When {@code deal.rates} is empty and a ZIP code is
 * given, the rate components are resolved from the local rate table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaxCalculationRequest {

    /** Jurisdiction code, e.g. "IN" or "US_IN". */
    @NotBlank
    private String stateCode;

    /** Optional ZIP or ZIP+4 of the buyer's address. */
    @Pattern(regexp = "\\d{5}(-\\d{4})?", message = "must be 12345 or 12345-6789")
    private String zipCode;

    @NotNull
    @Valid
    private TaxCalculationInput deal;
}
