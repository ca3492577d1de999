package com.autotax.domain.model;

import com.autotax.domain.enums.JurisdictionType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** One entry of a detailed jurisdiction breakdown for a location. */
@Value
@Builder
@Jacksonized
public class JurisdictionRate {

    JurisdictionType jurisdictionType;
    String name;
    BigDecimal rate;
}
