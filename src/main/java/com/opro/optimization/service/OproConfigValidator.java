package com.opro.optimization.service;

import com.opro.config.OproProperties;
import com.opro.optimization.error.InvalidConfigFailure;
import com.opro.optimization.model.OproConfig;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Fills unset fields from {@code opro.defaults} and enforces the config boundary checks.
 */
@Component
public class OproConfigValidator {

    static final double MIN_TEMPERATURE = 0.0;
    static final double MAX_TEMPERATURE = 2.0;

    private final OproProperties properties;

    public OproConfigValidator(OproProperties properties) {
        this.properties = properties;
    }

    public OproConfig resolve(@Nullable Integer k,
                              @Nullable Integer topX,
                              @Nullable String optimizerModel,
                              @Nullable Double optimizerTemperature,
                              @Nullable String scorerModel,
                              @Nullable Double scorerTemperature) {
        OproProperties.SessionDefaults defaults = properties.getDefaults();
        OproConfig config = new OproConfig(
                k != null ? k : defaults.getK(),
                topX != null ? topX : defaults.getTopX(),
                StringUtils.hasText(optimizerModel) ? optimizerModel.trim() : defaults.getOptimizerModel(),
                optimizerTemperature != null ? optimizerTemperature : defaults.getOptimizerTemperature(),
                StringUtils.hasText(scorerModel) ? scorerModel.trim() : defaults.getScorerModel(),
                scorerTemperature != null ? scorerTemperature : defaults.getScorerTemperature());
        validate(config);
        return config;
    }

    public void validate(OproConfig config) {
        List<String> violations = new ArrayList<>();
        if (config.k() < OproConfig.MIN_K || config.k() > OproConfig.MAX_K) {
            violations.add("k must be between " + OproConfig.MIN_K + " and " + OproConfig.MAX_K);
        }
        if (config.topX() < 1) {
            violations.add("topX must be at least 1");
        }
        if (!StringUtils.hasText(config.optimizerModel())) {
            violations.add("optimizerModel must not be blank");
        }
        if (!StringUtils.hasText(config.scorerModel())) {
            violations.add("scorerModel must not be blank");
        }
        checkTemperature("optimizerTemperature", config.optimizerTemperature(), violations);
        checkTemperature("scorerTemperature", config.scorerTemperature(), violations);
        if (!violations.isEmpty()) {
            throw new InvalidConfigFailure(violations);
        }
    }

    private static void checkTemperature(String field, double value, List<String> violations) {
        if (Double.isNaN(value) || value < MIN_TEMPERATURE || value > MAX_TEMPERATURE) {
            violations.add(field + " must be between " + MIN_TEMPERATURE + " and " + MAX_TEMPERATURE);
        }
    }
}
