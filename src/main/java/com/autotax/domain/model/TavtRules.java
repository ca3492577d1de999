package com.autotax.domain.model;

import com.autotax.domain.enums.TavtLeaseBaseMode;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Title ad valorem tax (Georgia style): a one-time, vehicle-only tax at a fixed state rate.
 * Fees and F&I products are outside the TAVT base and rebates never reduce it.
 */
@Value
@Builder
@Jacksonized
public class TavtRules {

    BigDecimal rate;

    /** Base is the higher of the deal price and {@code assessedValue} when the deal supplies one. */
    boolean useHigherOfPriceOrAssessed;

    boolean allowTradeInCredit;
    boolean applyNegativeEquityToBase;

    /** Null means AGREED_VALUE. */
    TavtLeaseBaseMode leaseBaseMode;
}
