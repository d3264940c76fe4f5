package com.outreachagent.infrastructure.stage;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link TargetingRules} once and caches them; unreadable or missing
 * files fall back to the built-in defaults.
 * <p>
 * Rules saved through {@link #update(TargetingRules)} go to a writable override
 * file, which takes precedence over the bundled resource on every later load.
 * </p>
 */
@Slf4j
@Component
public class TargetingRulesProvider {

    private final ObjectMapper objectMapper;
    private final Resource rulesResource;
    private final Path overridePath;

    private volatile TargetingRules cached;

    public TargetingRulesProvider(ObjectMapper objectMapper,
                                  @Value("${outreach.enrichment.rules-location:classpath:targeting-rules.json}")
                                  Resource rulesResource,
                                  @Value("${outreach.enrichment.rules-override-path:data/targeting-rules.json}")
                                  String overridePath) {
        this.objectMapper = objectMapper;
        this.rulesResource = rulesResource;
        this.overridePath = Path.of(overridePath);
    }

    public TargetingRules get() {
        TargetingRules rules = cached;
        if (rules == null) {
            synchronized (this) {
                if (cached == null) {
                    cached = load();
                }
                rules = cached;
            }
        }
        return rules;
    }

    public synchronized TargetingRules reload() {
        cached = load();
        return cached;
    }

    /**
     * Validates, persists and activates new rules. Enrichment picks them up from the next run.
     *
     * @throws IllegalArgumentException if a required rule table is missing or empty
     */
    public synchronized TargetingRules update(TargetingRules rules) {
        requireTable("company_size_rules", rules.companySizeRules().isEmpty());
        requireTable("persona_rules", rules.personaRules().isEmpty());
        requireTable("pain_points", rules.painPoints().isEmpty());
        requireTable("triggers", rules.triggers().isEmpty());

        try {
            Path parent = overridePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(overridePath.toFile(), rules);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to save targeting rules to " + overridePath, e);
        }
        log.info("Targeting rules updated and saved to {}", overridePath);
        cached = rules;
        return rules;
    }

    private static void requireTable(String key, boolean missing) {
        if (missing) {
            throw new IllegalArgumentException("Missing required key: " + key);
        }
    }

    private TargetingRules load() {
        if (Files.isRegularFile(overridePath)) {
            try {
                TargetingRules rules = objectMapper.readValue(overridePath.toFile(), TargetingRules.class);
                log.info("Loaded targeting rules from {}", overridePath);
                return rules;
            } catch (IOException e) {
                log.warn("Failed to load saved targeting rules from {}: {}. Trying bundled rules.",
                        overridePath, e.getMessage());
            }
        }
        if (rulesResource == null || !rulesResource.exists()) {
            log.info("Using default targeting rules (no rules file found)");
            return TargetingRules.defaults();
        }
        try (InputStream in = rulesResource.getInputStream()) {
            TargetingRules rules = objectMapper.readValue(in, TargetingRules.class);
            log.info("Loaded targeting rules from {}", rulesResource.getDescription());
            return rules;
        } catch (IOException e) {
            log.warn("Failed to load targeting rules: {}. Using defaults.", e.getMessage());
            return TargetingRules.defaults();
        }
    }
}
