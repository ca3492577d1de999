package com.autotax.rules;

import com.autotax.domain.model.TaxRulesConfig;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only lookup of jurisdiction rules by state code.
 *
 * <p>Built once at startup from the loaded rule documents and never modified afterwards,
 * so lookups need no synchronization. Codes are matched case-insensitively, surrounding
 * whitespace is ignored and a {@code US_} prefix is accepted ({@code in}, {@code IN} and
 * {@code US_IN} all resolve to Indiana).
 */
public class TaxRulesRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaxRulesRegistry.class);

    private static final String COUNTRY_PREFIX = "US_";

    private final Map<String, TaxRulesConfig> rulesByState;

    public TaxRulesRegistry(Collection<TaxRulesConfig> rules) {
        Map<String, TaxRulesConfig> byState = new TreeMap<>();
        for (TaxRulesConfig config : rules) {
            String code = normalize(config.getStateCode());
            if (code == null) {
                throw new IllegalStateException("Tax rules without a state code");
            }
            if (byState.putIfAbsent(code, config) != null) {
                throw new IllegalStateException("Duplicate tax rules for state " + code);
            }
        }
        this.rulesByState = Collections.unmodifiableMap(byState);
        log.info(
                "Tax rules registry ready: {} implemented, {} stub",
                getImplementedStates().size(),
                getStubStates().size());
    }

    /** Rules for a state, including stubs; empty for unknown codes. */
    public Optional<TaxRulesConfig> getRulesForState(String stateCode) {
        String code = normalize(stateCode);
        return code == null ? Optional.empty() : Optional.ofNullable(rulesByState.get(code));
    }

    /** True when the state has researched (non-stub) rules. */
    public boolean isStateImplemented(String stateCode) {
        return getRulesForState(stateCode).map(rules -> !rules.isStub()).orElse(false);
    }

    public List<String> getImplementedStates() {
        return rulesByState.values().stream()
                .filter(rules -> !rules.isStub())
                .map(rules -> normalize(rules.getStateCode()))
                .collect(Collectors.toList());
    }

    public List<String> getStubStates() {
        return rulesByState.values().stream()
                .filter(TaxRulesConfig::isStub)
                .map(rules -> normalize(rules.getStateCode()))
                .collect(Collectors.toList());
    }

    /** Canonical two-letter form of a state code, or null for blank input. */
    public static String normalize(String stateCode) {
        if (stateCode == null || stateCode.isBlank()) {
            return null;
        }
        String code = stateCode.trim().toUpperCase(Locale.ROOT);
        return code.startsWith(COUNTRY_PREFIX) ? code.substring(COUNTRY_PREFIX.length()) : code;
    }
}
