package com.autotax.domain.vo;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Component taxes for one taxable base.
 *
 * <ul>
 *   <li>grossTax: sum of {@code componentTaxes} amounts (after any tax cap, before credits)</li>
 *   <li>totalTax: grossTax less the reciprocity credit, never below zero</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class TaxAmountBreakdown {

    List<ComponentTax> componentTaxes;
    BigDecimal grossTax;
    BigDecimal totalTax;
}
