package com.autotax.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** One non-doc fee on a deal, identified by a jurisdiction fee code (TITLE, REG, ...). */
@Value
@Builder
@Jacksonized
public class FeeLine {

    String code;
    BigDecimal amount;

    public static FeeLine of(String code, BigDecimal amount) {
        return FeeLine.builder().code(code).amount(amount).build();
    }
}
