package com.irondust.seo.service.pipeline;

import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.Content;
import com.irondust.seo.service.cache.CacheTier;
import com.irondust.seo.service.correction.CorrectionOptions;
import com.irondust.seo.service.correction.Corrector;

import java.util.List;

/**
 * Wires a step to its {@link Corrector}. Thresholds are read on every call so
 * adaptive rule updates take effect immediately.
 */
abstract class AbstractValidationStep implements ValidationStep {
    protected final OptimizerProperties properties;
    protected final Corrector corrector;

    protected AbstractValidationStep(OptimizerProperties properties, Corrector corrector) {
        this.properties = properties;
        this.corrector = corrector;
    }

    protected OptimizerProperties.Thresholds thresholds() {
        return properties.getThresholds();
    }

    @Override
    public String getComponent() {
        return corrector.getComponent();
    }

    @Override
    public Content correct(Content content, String focusKeyword, List<String> secondaryKeywords, CorrectionOptions options) {
        return corrector.correct(content, focusKeyword, secondaryKeywords, options);
    }

    @Override
    public CacheTier cacheTier() {
        return CacheTier.METRICS;
    }
}
