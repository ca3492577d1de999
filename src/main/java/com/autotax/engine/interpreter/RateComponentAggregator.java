package com.autotax.engine.interpreter;

import com.autotax.domain.enums.JurisdictionType;
import com.autotax.domain.model.JurisdictionRate;
import com.autotax.domain.model.LocalTaxRateInfo;
import com.autotax.domain.model.TaxRateComponent;
import com.autotax.engine.Amounts;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the ordered rate component list fed to the engine, either from a flat local
 * rate summary or from a detailed jurisdiction breakdown.
 */
public final class RateComponentAggregator {

    private static final Logger log = LoggerFactory.getLogger(RateComponentAggregator.class);

    private static final String DISTRICT_PREFIX = "DISTRICT_";

    static final String UNKNOWN = "UNKNOWN";

    private RateComponentAggregator() {}

    /** STATE is always present (even at 0); COUNTY, CITY and SPECIAL_DISTRICT only when non-zero. */
    public static List<TaxRateComponent> fromLocalInfo(LocalTaxRateInfo info) {
        List<TaxRateComponent> components = new ArrayList<>();
        components.add(TaxRateComponent.of(TaxRateComponent.STATE, Amounts.orZero(info.getStateTaxRate())));
        addIfNonZero(components, TaxRateComponent.COUNTY, info.getCountyRate());
        addIfNonZero(components, TaxRateComponent.CITY, info.getCityRate());
        addIfNonZero(components, TaxRateComponent.SPECIAL_DISTRICT, info.getSpecialDistrictRate());
        return components;
    }

    /**
     * Preserves breakdown order. Special districts get a synthesized label
     * {@code DISTRICT_<NAME>} so several districts stay distinguishable. Entries without a
     * jurisdiction type are labeled {@code UNKNOWN} and logged.
     */
    public static List<TaxRateComponent> fromBreakdown(List<JurisdictionRate> breakdown) {
        List<TaxRateComponent> components = new ArrayList<>();
        for (JurisdictionRate item : breakdown) {
            if (item == null) {
                log.warn("Skipping empty entry in jurisdiction rate breakdown");
                continue;
            }
            components.add(TaxRateComponent.of(labelFor(item), Amounts.orZero(item.getRate())));
        }
        return components;
    }

    static String labelFor(JurisdictionRate item) {
        if (item.getJurisdictionType() == JurisdictionType.SPECIAL_DISTRICT) {
            String name = item.getName() != null ? item.getName() : "UNNAMED";
            return DISTRICT_PREFIX + name.replaceAll("[^A-Za-z0-9]", "_").toUpperCase(Locale.ROOT);
        }
        if (item.getJurisdictionType() == null) {
            log.warn("Jurisdiction rate {} has no jurisdiction type; labeled {}", item.getName(), UNKNOWN);
            return UNKNOWN;
        }
        return item.getJurisdictionType().name();
    }

    private static void addIfNonZero(List<TaxRateComponent> components, String label, BigDecimal rate) {
        if (rate != null && rate.signum() != 0) {
            components.add(TaxRateComponent.of(label, rate));
        }
    }
}
