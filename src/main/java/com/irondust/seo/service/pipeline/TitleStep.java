package com.irondust.seo.service.pipeline;

import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.Content;
import com.irondust.seo.service.correction.TitleCorrector;
import com.irondust.seo.service.correction.TitleUniquenessChecker;
import com.irondust.seo.util.TextUtils;

import java.util.List;
import java.util.Objects;

/**
 * Not cached at step level: the uniqueness verdict depends on the title
 * registry, which the checker caches itself.
 */
public class TitleStep extends AbstractValidationStep {
    private final TitleUniquenessChecker uniquenessChecker;

    public TitleStep(OptimizerProperties properties, TitleUniquenessChecker uniquenessChecker) {
        super(properties, new TitleCorrector());
        this.uniquenessChecker = uniquenessChecker;
    }

    @Override
    public StepOutcome validate(Content content, String focusKeyword, List<String> secondaryKeywords) {
        OptimizerProperties.Thresholds t = thresholds();
        String title = TextUtils.nullToEmpty(content.getTitle());
        StepOutcome o = new StepOutcome();
        if (title.length() > t.getMaxTitleLength()) {
            o.error("Title too long (" + title.length() + " chars, maximum " + t.getMaxTitleLength() + ")");
        }
        boolean hasKeyword = focusKeyword == null || focusKeyword.isBlank() || TextUtils.containsIgnoreCase(title, focusKeyword);
        if (!hasKeyword) {
            o.error("Title should contain focus keyword: " + focusKeyword);
        }
        boolean unique = true;
        if (uniquenessChecker != null && !title.isBlank()) {
            TitleUniquenessChecker.Result u = uniquenessChecker.check(title);
            unique = u.unique;
            if (!unique) {
                o.warning("Title may not be unique");
                o.metric("highestSimilarity", u.highestSimilarity);
            }
        }
        o.setValid(o.getErrors().isEmpty());
        return o.metric("length", title.length()).metric("hasKeyword", hasKeyword).metric("unique", unique);
    }

    @Override
    public boolean hasChanged(Content before, Content after, String focusKeyword, List<String> secondaryKeywords) {
        return !Objects.equals(before.getTitle(), after.getTitle());
    }

    @Override
    public String fingerprint(Content content) {
        return null;
    }
}
