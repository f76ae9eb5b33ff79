package com.irondust.seo.service.correction;

import com.irondust.seo.config.OptimizerProperties;

import java.util.Random;

/**
 * Thresholds a corrector must bring content within, plus the random source
 * used wherever a corrector picks among equivalent phrasings.
 */
public class CorrectionOptions {
    private final OptimizerProperties.Thresholds thresholds;
    private final Random random;

    public CorrectionOptions(OptimizerProperties.Thresholds thresholds, Random random) {
        this.thresholds = thresholds;
        this.random = random;
    }

    public OptimizerProperties.Thresholds getThresholds() {
        return thresholds;
    }

    public Random getRandom() {
        return random;
    }
}
