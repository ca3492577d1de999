package com.autotax.domain.vo;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Tax owed to one rate component (or one flat special fee, where rate is null). */
@Value
@Builder
public class ComponentTax {

    String label;
    BigDecimal rate;
    BigDecimal amount;
}
