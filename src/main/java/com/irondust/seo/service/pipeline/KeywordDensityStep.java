package com.irondust.seo.service.pipeline;

import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.Content;
import com.irondust.seo.service.analysis.KeywordDensityAnalyzer;
import com.irondust.seo.service.cache.CacheTier;
import com.irondust.seo.service.correction.KeywordDensityCorrector;
import com.irondust.seo.util.TextUtils;

import java.util.List;
import java.util.Locale;

public class KeywordDensityStep extends AbstractValidationStep {
    /** Density moves smaller than this are not reported as a correction */
    static final double MIN_RECORDED_CHANGE = 0.1;

    private final KeywordDensityAnalyzer analyzer = new KeywordDensityAnalyzer();

    public KeywordDensityStep(OptimizerProperties properties) {
        super(properties, new KeywordDensityCorrector());
    }

    @Override
    public StepOutcome validate(Content content, String focusKeyword, List<String> secondaryKeywords) {
        OptimizerProperties.Thresholds t = thresholds();
        StepOutcome o = new StepOutcome();
        if (focusKeyword == null || focusKeyword.isBlank()) {
            return o.suggestion("Set a focus keyword to enable keyword density checks");
        }
        KeywordDensityAnalyzer.Result r = analyzer.analyze(content.getBody(), focusKeyword, secondaryKeywords);
        if (r.overallDensity < t.getMinKeywordDensity()) {
            o.error(String.format(Locale.ROOT, "Keyword density too low (%.2f%%, minimum %.2f%%)",
                    r.overallDensity, t.getMinKeywordDensity()));
        } else if (r.overallDensity > t.getMaxKeywordDensity()) {
            o.error(String.format(Locale.ROOT, "Keyword density too high (%.2f%%, maximum %.2f%%)",
                    r.overallDensity, t.getMaxKeywordDensity()));
        }
        if (r.subheadingDensity > t.getMaxSubheadingKeywordUsage()) {
            o.warning(String.format(Locale.ROOT, "Too many subheadings contain keyword (%.1f%%, maximum %.1f%%)",
                    r.subheadingDensity, t.getMaxSubheadingKeywordUsage()));
        }
        o.setValid(o.getErrors().isEmpty());
        return o.metric("density", r.overallDensity)
                .metric("keywordCount", r.keywordCount)
                .metric("wordCount", r.totalWords)
                .metric("subheadingUsage", r.subheadingDensity);
    }

    @Override
    public boolean hasChanged(Content before, Content after, String focusKeyword, List<String> secondaryKeywords) {
        double b = analyzer.analyze(before.getBody(), focusKeyword, secondaryKeywords).overallDensity;
        double a = analyzer.analyze(after.getBody(), focusKeyword, secondaryKeywords).overallDensity;
        return Math.abs(a - b) > MIN_RECORDED_CHANGE;
    }

    @Override
    public CacheTier cacheTier() {
        return CacheTier.KEYWORDS;
    }

    @Override
    public String fingerprint(Content content) {
        return TextUtils.md5Hex(TextUtils.nullToEmpty(content.getBody()));
    }
}
