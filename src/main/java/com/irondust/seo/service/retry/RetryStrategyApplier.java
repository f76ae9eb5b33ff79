package com.irondust.seo.service.retry;

import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.Content;
import com.irondust.seo.model.ImagePrompt;
import com.irondust.seo.service.correction.ImageCorrector;
import com.irondust.seo.service.correction.KeywordDensityCorrector;
import com.irondust.seo.service.correction.MetaDescriptionCorrector;
import com.irondust.seo.service.correction.ReadabilityCorrector;
import com.irondust.seo.service.correction.TitleCorrector;
import com.irondust.seo.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Applies {@link RetryStrategy} actions to content using the regular correctors.
 */
class RetryStrategyApplier {
    private static final Logger log = LoggerFactory.getLogger(RetryStrategyApplier.class);

    private final OptimizerProperties.Thresholds thresholds;
    private final MetaDescriptionCorrector metaCorrector = new MetaDescriptionCorrector();
    private final KeywordDensityCorrector densityCorrector = new KeywordDensityCorrector();
    private final ReadabilityCorrector readabilityCorrector = new ReadabilityCorrector();
    private final TitleCorrector titleCorrector = new TitleCorrector();

    RetryStrategyApplier(OptimizerProperties.Thresholds thresholds) {
        this.thresholds = thresholds;
    }

    Content apply(Content content, RetryStrategy strategy, String keyword, Random random) {
        Content out = content.copy();
        if (strategy == null) return out;
        for (Map.Entry<String, Map<String, Object>> e : strategy.getActions().entrySet()) {
            Map<String, Object> p = e.getValue();
            switch (e.getKey()) {
                case RetryStrategy.ADJUST_META_LENGTH -> adjustMetaLength(out, p, keyword);
                case RetryStrategy.REDUCE_KEYWORD_DENSITY -> out.setBody(densityCorrector.replaceKeywordMentions(
                        out.getBody(), keyword, number(p, "reduction_percentage", 0.5), random));
                case RetryStrategy.INCREASE_KEYWORD_DENSITY -> out.setBody(densityCorrector.addKeywordMentions(
                        out.getBody(), keyword, (int) number(p, "increase_count", 2)));
                case RetryStrategy.IMPROVE_READABILITY -> improveReadability(out, p, random);
                case RetryStrategy.SHORTEN_TITLE -> out.setTitle(titleCorrector.correctTitle(
                        out.getTitle(), keyword, (int) number(p, "max_length", 60)));
                case RetryStrategy.ADD_IMAGES -> addImages(out, (int) number(p, "count", 1), keyword);
                default -> log.warn("Unknown retry action {}", e.getKey());
            }
        }
        return out;
    }

    private void adjustMetaLength(Content c, Map<String, Object> p, String keyword) {
        String meta = TextUtils.nullToEmpty(c.getMetaDescription());
        int target = (int) number(p, "target_length", 140);
        if (meta.length() < target) {
            Object ext = p.get("extension_text");
            meta = meta + (ext != null ? ext.toString() : " Learn more about this topic.");
        } else if (meta.length() > target) {
            meta = TextUtils.truncateAtWord(meta, target, "...");
        }
        if (meta.length() < thresholds.getMinMetaDescLength() || meta.length() > thresholds.getMaxMetaDescLength()) {
            meta = metaCorrector.correctDescription(meta, keyword,
                    thresholds.getMinMetaDescLength(), thresholds.getMaxMetaDescLength());
        }
        c.setMetaDescription(meta);
    }

    private void improveReadability(Content c, Map<String, Object> p, Random random) {
        String body = c.getBody();
        if (body == null) return;
        if (Boolean.TRUE.equals(p.get("reduce_passive_voice"))) {
            body = readabilityCorrector.reducePassiveVoice(body);
        }
        if (Boolean.TRUE.equals(p.get("split_long_sentences"))) {
            body = readabilityCorrector.splitLongSentences(body, thresholds.getMaxSentenceWords());
        }
        if (Boolean.TRUE.equals(p.get("add_transitions"))) {
            body = readabilityCorrector.addTransitions(body, thresholds.getMinTransitionWords(), random);
        }
        c.setBody(body);
    }

    private void addImages(Content c, int count, String keyword) {
        List<ImagePrompt> prompts = new ArrayList<>(c.getImagePrompts() != null ? c.getImagePrompts() : List.of());
        for (int i = 0; i < count; i++) {
            prompts.add(ImageCorrector.newPrompt(c.getTitle(), keyword));
        }
        c.setImagePrompts(prompts);
    }

    private static double number(Map<String, Object> p, String key, double fallback) {
        Object v = p.get(key);
        return v instanceof Number ? ((Number) v).doubleValue() : fallback;
    }
}
