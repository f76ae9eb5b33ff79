package com.irondust.seo.service.pipeline;

import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.Content;
import com.irondust.seo.service.analysis.PassiveVoiceAnalyzer;
import com.irondust.seo.service.analysis.SentenceLengthAnalyzer;
import com.irondust.seo.service.analysis.TransitionWordAnalyzer;
import com.irondust.seo.service.cache.CacheTier;
import com.irondust.seo.service.correction.ReadabilityCorrector;
import com.irondust.seo.util.TextUtils;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Passive voice and sentence length are errors, a lack of transition words only a warning.
 */
public class ReadabilityStep extends AbstractValidationStep {
    private final PassiveVoiceAnalyzer passiveAnalyzer = new PassiveVoiceAnalyzer();
    private final TransitionWordAnalyzer transitionAnalyzer = new TransitionWordAnalyzer();

    public ReadabilityStep(OptimizerProperties properties) {
        super(properties, new ReadabilityCorrector());
    }

    @Override
    public StepOutcome validate(Content content, String focusKeyword, List<String> secondaryKeywords) {
        OptimizerProperties.Thresholds t = thresholds();
        String body = content.getBody();
        PassiveVoiceAnalyzer.Result passive = passiveAnalyzer.analyze(body);
        SentenceLengthAnalyzer.Result length = new SentenceLengthAnalyzer(t.getMaxSentenceWords()).analyze(body);
        TransitionWordAnalyzer.Result transitions = transitionAnalyzer.analyze(body);

        StepOutcome o = new StepOutcome();
        if (passive.passivePercentage > t.getMaxPassiveVoice()) {
            o.error(String.format(Locale.ROOT, "Too much passive voice (%.1f%%, maximum %.1f%%)",
                    passive.passivePercentage, t.getMaxPassiveVoice()));
        }
        if (length.longSentencePercentage > t.getMaxLongSentences()) {
            o.error(String.format(Locale.ROOT, "Too many long sentences (%.1f%%, maximum %.1f%%)",
                    length.longSentencePercentage, t.getMaxLongSentences()));
        }
        if (transitions.totalSentences > 0 && transitions.transitionPercentage < t.getMinTransitionWords()) {
            o.warning(String.format(Locale.ROOT, "Not enough transition words (%.1f%%, minimum %.1f%%)",
                    transitions.transitionPercentage, t.getMinTransitionWords()));
        }
        if (length.averageWords > t.getMaxSentenceWords()) {
            o.suggestion("Average sentence length is " + TextUtils.round(length.averageWords, 1) + " words");
        }
        o.setValid(o.getErrors().isEmpty());
        return o.metric("passiveVoice", passive.passivePercentage)
                .metric("longSentences", length.longSentencePercentage)
                .metric("transitionWords", transitions.transitionPercentage)
                .metric("sentenceCount", length.totalSentences);
    }

    @Override
    public boolean hasChanged(Content before, Content after, String focusKeyword, List<String> secondaryKeywords) {
        return !Objects.equals(before.getBody(), after.getBody());
    }

    @Override
    public CacheTier cacheTier() {
        return CacheTier.READABILITY;
    }

    @Override
    public String fingerprint(Content content) {
        return TextUtils.md5Hex(TextUtils.nullToEmpty(content.getBody()));
    }
}
