package com.autotax.config;

import com.autotax.localtax.LocalTaxRateService;
import com.autotax.localtax.LocalTaxRateTable;
import com.autotax.mapper.JsonHelper;
import com.autotax.rules.TaxRulesLoader;
import com.autotax.rules.TaxRulesRegistry;
import java.io.IOException;
import java.io.InputStream;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;

/**
 * Configuration properties and reference-data beans for the tax engine.
 *
 * <p>Binds to the {@code autotax.*} prefix. The rule registry and the local rate table are
 * loaded once here at startup; a missing or unreadable document fails the context.
 */
@Configuration
@ConfigurationProperties(prefix = "autotax")
@Getter
@Setter
public class AutotaxConfig {

    private static final Logger log = LoggerFactory.getLogger(AutotaxConfig.class);

    private Rules rules = new Rules();

    private LocalTax localTax = new LocalTax();

    private Calculation calculation = new Calculation();

    @Bean
    public TaxRulesRegistry taxRulesRegistry() {
        return new TaxRulesRegistry(new TaxRulesLoader().load(rules.getLocation()));
    }

    @Bean
    public LocalTaxRateService localTaxRateService() {
        Resource resource = new DefaultResourceLoader().getResource(localTax.getLocation());
        log.info("Loading local tax rates from {}", resource.getDescription());
        try (InputStream in = resource.getInputStream()) {
            return new LocalTaxRateService(JsonHelper.fromJson(in, LocalTaxRateTable.class, resource.getDescription()));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot open local tax rate table " + localTax.getLocation(), e);
        }
    }

    @Getter
    @Setter
    public static class Rules {

        /** Resource pattern of the per-state rule documents. */
        private String location = "classpath:tax-rules/*.json";
    }

    @Getter
    @Setter
    public static class LocalTax {

        /** Resource holding the ZIP and state-average local rate table. */
        private String location = "classpath:tax-data/local-tax-rates.json";
    }

    @Getter
    @Setter
    public static class Calculation {

        /** If true, calculations for states whose rules are still a stub are refused. Defaults to false. */
        private boolean rejectStubStates = false;
    }
}
