package com.irondust.seo.service.correction;

import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.CorrectionPrompt;
import com.irondust.seo.model.ValidationMessage;
import com.irondust.seo.model.ValidationResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns the errors of a validation result into ordered correction instructions,
 * one per error, grouped by component in the configured priority order.
 */
@Component
public class CorrectionPromptGenerator {

    private static final Map<String, String[]> TEMPLATES = Map.of(
            "meta_description", new String[]{"meta_description_correction",
                    "Fix meta description to be %d-%d characters and include '%s'", "1"},
            "keyword_density", new String[]{"keyword_density_correction",
                    "Adjust keyword density for '%s' to be between %.1f-%.1f%%", "2"},
            "readability", new String[]{"readability_correction",
                    "Improve readability: reduce passive voice (<%.0f%%), shorten long sentences (<%.0f%%), add transition words (>%.0f%%)", "3"},
            "title", new String[]{"title_correction",
                    "Optimize title to include '%s' and be under %d characters", "4"},
            "images", new String[]{"image_correction",
                    "Add images with alt text containing '%s'", "5"});

    private final OptimizerProperties properties;

    public CorrectionPromptGenerator(OptimizerProperties properties) {
        this.properties = properties;
    }

    public List<CorrectionPrompt> generate(ValidationResult result, String focusKeyword, List<String> priorityOrder) {
        List<CorrectionPrompt> prompts = new ArrayList<>();
        if (result == null) return prompts;
        for (String component : priorityOrder) {
            String[] template = TEMPLATES.get(component);
            if (template == null) continue;
            for (ValidationMessage error : result.errorsFor(component)) {
                prompts.add(new CorrectionPrompt(template[0], component,
                        instruction(component, template[1], focusKeyword), Integer.parseInt(template[2]),
                        error.getMessage()));
            }
        }
        return prompts;
    }

    private String instruction(String component, String template, String keyword) {
        OptimizerProperties.Thresholds t = properties.getThresholds();
        String kw = keyword == null ? "" : keyword;
        switch (component) {
            case "meta_description":
                return String.format(template, t.getMinMetaDescLength(), t.getMaxMetaDescLength(), kw);
            case "keyword_density":
                return String.format(Locale.ROOT, template, kw, t.getMinKeywordDensity(), t.getMaxKeywordDensity());
            case "readability":
                return String.format(Locale.ROOT, template, t.getMaxPassiveVoice(), t.getMaxLongSentences(),
                        t.getMinTransitionWords());
            case "title":
                return String.format(template, kw, t.getMaxTitleLength());
            default:
                return String.format(template, kw);
        }
    }
}
