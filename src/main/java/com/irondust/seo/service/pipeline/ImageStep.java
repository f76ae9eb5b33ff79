package com.irondust.seo.service.pipeline;

import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.Content;
import com.irondust.seo.model.ImagePrompt;
import com.irondust.seo.service.analysis.ImageAnalyzer;
import com.irondust.seo.service.correction.ImageCorrector;
import com.irondust.seo.util.TextUtils;

import java.util.List;
import java.util.Objects;

public class ImageStep extends AbstractValidationStep {

    public ImageStep(OptimizerProperties properties) {
        super(properties, new ImageCorrector());
    }

    @Override
    public StepOutcome validate(Content content, String focusKeyword, List<String> secondaryKeywords) {
        OptimizerProperties.Thresholds t = thresholds();
        ImageAnalyzer.Result r = new ImageAnalyzer(t.isRequireKeywordInAltText())
                .analyze(content, focusKeyword, secondaryKeywords);
        StepOutcome o = new StepOutcome();
        if (t.isRequireImages() && r.imageCount == 0) {
            o.error("Content should include at least one image");
        }
        if (t.isRequireKeywordInAltText() && r.imageCount > 0 && r.properAltTextCount < r.imageCount) {
            o.warning("Image alt text should include focus keyword");
        }
        o.setValid(o.getErrors().isEmpty());
        return o.metric("imageCount", r.imageCount).metric("properAltTextCount", r.properAltTextCount);
    }

    @Override
    public boolean hasChanged(Content before, Content after, String focusKeyword, List<String> secondaryKeywords) {
        return !Objects.equals(before.getImagePrompts(), after.getImagePrompts())
                || !Objects.equals(before.getBody(), after.getBody());
    }

    @Override
    public String fingerprint(Content content) {
        StringBuilder sb = new StringBuilder(TextUtils.nullToEmpty(content.getBody()));
        if (content.getImagePrompts() != null) {
            for (ImagePrompt p : content.getImagePrompts()) {
                if (p != null) sb.append('\u0000').append(TextUtils.nullToEmpty(p.getAlt()));
            }
        }
        return TextUtils.md5Hex(sb.toString());
    }
}
