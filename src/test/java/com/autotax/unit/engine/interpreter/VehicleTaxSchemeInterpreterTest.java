package com.autotax.unit.engine.interpreter;

import static com.autotax.fixtures.TaxRulesFixtures.retailRules;
import static com.autotax.fixtures.TaxRulesFixtures.stateCountyCity;
import static org.assertj.core.api.Assertions.assertThat;

import com.autotax.domain.enums.VehicleTaxScheme;
import com.autotax.domain.model.TaxRateComponent;
import com.autotax.engine.interpreter.VehicleTaxSchemeInterpreter;
import com.autotax.engine.interpreter.VehicleTaxSchemeInterpreter.SchemeRates;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class VehicleTaxSchemeInterpreterTest {

    private final List<TaxRateComponent> rates = stateCountyCity("0.056", "0.007", "0.023");

    @Test
    @DisplayName("STATE_ONLY keeps only the STATE component")
    void stateOnly() {
        SchemeRates result = VehicleTaxSchemeInterpreter.interpret(VehicleTaxScheme.STATE_ONLY, rates, retailRules());

        assertThat(result.getEffectiveRates()).extracting(TaxRateComponent::getLabel).containsExactly("STATE");
    }

    @Test
    @DisplayName("STATE_ONLY without a STATE component warns")
    void stateOnly_missingState() {
        SchemeRates result = VehicleTaxSchemeInterpreter.interpret(
                VehicleTaxScheme.STATE_ONLY, rates.subList(1, 3), retailRules());

        assertThat(result.getEffectiveRates()).isEmpty();
        assertThat(result.getNotes()).anyMatch(note -> note.startsWith("WARNING:"));
    }

    @Test
    @DisplayName("LOCAL_ONLY drops the STATE component and keeps order")
    void localOnly() {
        SchemeRates result = VehicleTaxSchemeInterpreter.interpret(VehicleTaxScheme.LOCAL_ONLY, rates, retailRules());

        assertThat(result.getEffectiveRates()).extracting(TaxRateComponent::getLabel)
                .containsExactly("COUNTY", "CITY");
    }

    @ParameterizedTest
    @EnumSource(
            value = VehicleTaxScheme.class,
            names = {"STATE_PLUS_LOCAL", "SPECIAL_HUT", "SPECIAL_TAVT", "DMV_PRIVILEGE_TAX"})
    @DisplayName("Pass-through schemes keep every component")
    void passThrough(VehicleTaxScheme scheme) {
        SchemeRates result = VehicleTaxSchemeInterpreter.interpret(scheme, rates, retailRules());

        assertThat(result.getEffectiveRates()).isEqualTo(rates);
        assertThat(result.getNotes()).singleElement().asString().contains(scheme.name());
    }

    @Test
    @DisplayName("Unknown scheme keeps every component with a warning")
    void unknownScheme() {
        SchemeRates result = VehicleTaxSchemeInterpreter.interpret(null, rates, retailRules());

        assertThat(result.getEffectiveRates()).hasSize(3);
        assertThat(result.getNotes()).containsExactly("WARNING: Vehicle tax scheme unknown for TS; applying all rates");
    }

    @Test
    @DisplayName("Null rate entries are dropped before filtering")
    void nullEntries_dropped() {
        List<TaxRateComponent> withGap = new ArrayList<>(rates);
        withGap.add(1, null);

        SchemeRates result =
                VehicleTaxSchemeInterpreter.interpret(VehicleTaxScheme.STATE_PLUS_LOCAL, withGap, retailRules());

        assertThat(result.getEffectiveRates()).isEqualTo(rates);
    }
}
