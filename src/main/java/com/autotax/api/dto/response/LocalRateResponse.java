package com.autotax.api.dto.response;

import com.autotax.domain.model.LocalTaxRateInfo;
import com.autotax.domain.model.TaxRateComponent;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Local rate summary for a ZIP code together with the rate components it produces. */
@Value
@Builder
public class LocalRateResponse {
    LocalTaxRateInfo rateInfo;
    BigDecimal combinedRate;
    List<TaxRateComponent> rateComponents;
}
