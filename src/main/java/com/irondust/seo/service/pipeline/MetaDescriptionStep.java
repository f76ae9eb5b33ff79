package com.irondust.seo.service.pipeline;

import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.Content;
import com.irondust.seo.service.correction.MetaDescriptionCorrector;
import com.irondust.seo.util.TextUtils;

import java.util.List;
import java.util.Objects;

/** Length bounds are errors; a missing focus keyword is a warning but still fails the step. */
public class MetaDescriptionStep extends AbstractValidationStep {

    public MetaDescriptionStep(OptimizerProperties properties) {
        super(properties, new MetaDescriptionCorrector());
    }

    @Override
    public StepOutcome validate(Content content, String focusKeyword, List<String> secondaryKeywords) {
        OptimizerProperties.Thresholds t = thresholds();
        String meta = TextUtils.nullToEmpty(content.getMetaDescription());
        int length = meta.length();
        StepOutcome o = new StepOutcome();
        boolean lengthOk = true;
        if (length < t.getMinMetaDescLength()) {
            lengthOk = false;
            o.error("Meta description too short (" + length + " chars, minimum " + t.getMinMetaDescLength() + ")");
        } else if (length > t.getMaxMetaDescLength()) {
            lengthOk = false;
            o.error("Meta description too long (" + length + " chars, maximum " + t.getMaxMetaDescLength() + ")");
        }
        boolean hasKeyword = focusKeyword == null || focusKeyword.isBlank() || TextUtils.containsIgnoreCase(meta, focusKeyword);
        if (!hasKeyword) {
            o.warning("Meta description should include focus keyword: " + focusKeyword);
        }
        o.setValid(lengthOk && hasKeyword);
        return o.metric("length", length).metric("hasKeyword", hasKeyword);
    }

    @Override
    public boolean hasChanged(Content before, Content after, String focusKeyword, List<String> secondaryKeywords) {
        return !Objects.equals(before.getMetaDescription(), after.getMetaDescription());
    }

    @Override
    public String fingerprint(Content content) {
        return TextUtils.md5Hex(TextUtils.nullToEmpty(content.getMetaDescription()));
    }
}
