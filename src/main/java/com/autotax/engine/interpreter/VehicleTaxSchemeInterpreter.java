package com.autotax.engine.interpreter;

import com.autotax.domain.enums.VehicleTaxScheme;
import com.autotax.domain.model.TaxRateComponent;
import com.autotax.domain.model.TaxRulesConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.Value;

/**
 * Filters the deal's rate components according to the jurisdiction's vehicle tax scheme.
 *
 * <p>Order of the surviving components is preserved and null entries are dropped. An
 * unknown (null) scheme passes every rate through and says so in the notes.
 */
public final class VehicleTaxSchemeInterpreter {

    private VehicleTaxSchemeInterpreter() {}

    public static SchemeRates interpret(VehicleTaxScheme scheme, List<TaxRateComponent> rates, TaxRulesConfig rules) {
        List<TaxRateComponent> all = rates != null
                ? rates.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList())
                : List.of();
        List<String> notes = new ArrayList<>();

        if (scheme == null) {
            notes.add("WARNING: Vehicle tax scheme unknown for " + stateOf(rules) + "; applying all rates");
            return new SchemeRates(all, notes);
        }

        switch (scheme) {
            case STATE_ONLY -> {
                List<TaxRateComponent> stateOnly =
                        all.stream().filter(TaxRateComponent::isState).collect(Collectors.toList());
                notes.add("Vehicle tax scheme: STATE_ONLY (local rates ignored)");
                if (stateOnly.isEmpty()) {
                    notes.add("WARNING: No STATE rate component supplied; no tax computed");
                }
                return new SchemeRates(stateOnly, notes);
            }
            case LOCAL_ONLY -> {
                List<TaxRateComponent> localOnly =
                        all.stream().filter(rate -> !rate.isState()).collect(Collectors.toList());
                notes.add("Vehicle tax scheme: LOCAL_ONLY (state rate ignored)");
                return new SchemeRates(localOnly, notes);
            }
            case STATE_PLUS_LOCAL -> notes.add("Vehicle tax scheme: STATE_PLUS_LOCAL (all jurisdiction rates apply)");
            case SPECIAL_HUT -> notes.add("Vehicle tax scheme: SPECIAL_HUT (NC Highway Use Tax)");
            case SPECIAL_TAVT -> notes.add("Vehicle tax scheme: SPECIAL_TAVT (GA Title Ad Valorem Tax, one-time)");
            case DMV_PRIVILEGE_TAX -> notes.add("Vehicle tax scheme: DMV_PRIVILEGE_TAX (WV-style privilege tax)");
            default -> throw new IllegalStateException("Unhandled vehicle tax scheme: " + scheme);
        }
        return new SchemeRates(all, notes);
    }

    private static String stateOf(TaxRulesConfig rules) {
        return rules != null && rules.getStateCode() != null ? rules.getStateCode() : "jurisdiction";
    }

    /** Effective rate components after scheme filtering, with the notes explaining the filter. */
    @Value
    public static class SchemeRates {
        List<TaxRateComponent> effectiveRates;
        List<String> notes;
    }
}
