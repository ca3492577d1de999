package com.autotax.rules;

import com.autotax.domain.model.TaxRulesConfig;
import com.autotax.engine.ReciprocityCreditCalculator;
import com.autotax.mapper.JsonHelper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;

/**
 * Reads per-jurisdiction rule documents (one {@link TaxRulesConfig} per JSON file) from a
 * resource pattern such as {@code classpath:tax-rules/*.json}.
 *
 * <p>Any unreadable document, or one whose reciprocity overrides are inconsistent, fails
 * the load; a partially loaded rule table is never returned.
 */
public class TaxRulesLoader {

    private static final Logger log = LoggerFactory.getLogger(TaxRulesLoader.class);

    private final ResourcePatternResolver resolver;

    public TaxRulesLoader() {
        this(new PathMatchingResourcePatternResolver());
    }

    public TaxRulesLoader(ResourcePatternResolver resolver) {
        this.resolver = resolver;
    }

    public List<TaxRulesConfig> load(String locationPattern) {
        Resource[] resources;
        try {
            resources = resolver.getResources(locationPattern);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot resolve tax rule documents at " + locationPattern, e);
        }

        List<TaxRulesConfig> rules = new ArrayList<>(resources.length);
        for (Resource resource : resources) {
            rules.add(read(resource));
        }
        log.info("Loaded {} tax rule documents from {}", rules.size(), locationPattern);
        return rules;
    }

    private TaxRulesConfig read(Resource resource) {
        String source = resource.getDescription();
        try (InputStream in = resource.getInputStream()) {
            TaxRulesConfig config = JsonHelper.fromJson(in, TaxRulesConfig.class, source);
            if (config == null || config.getStateCode() == null || config.getStateCode().isBlank()) {
                throw new IllegalStateException("Tax rule document without stateCode: " + source);
            }
            List<String> problems =
                    ReciprocityCreditCalculator.validate(config.getStateCode(), config.getReciprocity());
            if (!problems.isEmpty()) {
                throw new IllegalStateException(
                        "Invalid reciprocity rules in " + source + ": " + String.join("; ", problems));
            }
            log.debug("Read tax rules for {} (version {}) from {}", config.getStateCode(), config.getVersion(), source);
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Cannot open tax rule document " + source, e);
        }
    }
}
