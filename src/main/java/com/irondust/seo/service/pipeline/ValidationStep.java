package com.irondust.seo.service.pipeline;

import com.irondust.seo.model.Content;
import com.irondust.seo.service.cache.CacheTier;
import com.irondust.seo.service.correction.CorrectionOptions;

import java.util.List;

/**
 * One aspect of the validate-then-correct pipeline.
 */
public interface ValidationStep {

    /** Component name used in messages, metrics and cache keys. */
    String getComponent();

    StepOutcome validate(Content content, String focusKeyword, List<String> secondaryKeywords);

    /** Returns a corrected copy; {@code content} is left untouched. */
    Content correct(Content content, String focusKeyword, List<String> secondaryKeywords, CorrectionOptions options);

    /** Whether a correction produced a change worth recording. */
    boolean hasChanged(Content before, Content after, String focusKeyword, List<String> secondaryKeywords);

    CacheTier cacheTier();

    /**
     * Hash of the inputs this step's verdict depends on, or null when the
     * verdict must not be cached.
     */
    String fingerprint(Content content);
}
