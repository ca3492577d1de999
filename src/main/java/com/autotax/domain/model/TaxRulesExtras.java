package com.autotax.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Parameters of the titling-tax schemes. A block is read only when
 * {@link TaxRulesConfig#getVehicleTaxScheme()} names the matching scheme.
 */
@Value
@Builder
@Jacksonized
public class TaxRulesExtras {

    TavtRules tavt;
    HighwayUseTaxRules highwayUseTax;
    PrivilegeTaxRules privilegeTax;
}
