package com.autotax.domain.model;

import com.autotax.domain.enums.TradeInPolicyType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Trade-in credit policy of a jurisdiction. {@code capAmount} is only read for CAPPED,
 * {@code percent} (a fraction in [0, 1]) only for PERCENT.
 */
@Value
@Builder
@Jacksonized
public class TradeInPolicy {

    TradeInPolicyType type;
    BigDecimal capAmount;
    BigDecimal percent;

    public static TradeInPolicy none() {
        return TradeInPolicy.builder().type(TradeInPolicyType.NONE).build();
    }

    public static TradeInPolicy full() {
        return TradeInPolicy.builder().type(TradeInPolicyType.FULL).build();
    }

    public static TradeInPolicy capped(BigDecimal capAmount) {
        return TradeInPolicy.builder()
                .type(TradeInPolicyType.CAPPED)
                .capAmount(capAmount)
                .build();
    }

    public static TradeInPolicy percent(BigDecimal percent) {
        return TradeInPolicy.builder()
                .type(TradeInPolicyType.PERCENT)
                .percent(percent)
                .build();
    }
}
