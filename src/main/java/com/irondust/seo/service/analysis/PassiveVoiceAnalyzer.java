package com.irondust.seo.service.analysis;

import com.irondust.seo.util.TextUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Flags sentences built around a form of "to be" followed by a past participle.
 * Regular (-ed, -en) participles are tried first, then a short list of irregular ones.
 */
public class PassiveVoiceAnalyzer implements TextAnalyzer<PassiveVoiceAnalyzer.Result> {
    private static final int MIN_SENTENCE_CHARS = 11;

    public static final String IRREGULAR = "given|taken|written|spoken|broken|chosen|driven|eaten|fallen"
            + "|forgotten|hidden|known|seen|shown|thrown|worn|made|done|built|found|held|kept|left|sold|told";

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("\\b(am|is|are|was|were|being|been)\\s+\\w+ed\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(have|has|had)\\s+been\\s+\\w+ed\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(will|would|could|should|might)\\s+be\\s+\\w+ed\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(am|is|are|was|were|being|been)\\s+\\w+en\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(have|has|had)\\s+been\\s+\\w+en\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(will|would|could|should|might)\\s+be\\s+\\w+en\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(am|is|are|was|were|being|been)\\s+(" + IRREGULAR + ")\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(have|has|had)\\s+been\\s+(" + IRREGULAR + ")\\b", Pattern.CASE_INSENSITIVE));

    public static class Result {
        public int totalSentences;
        public int passiveSentences;
        public double passivePercentage;
        public List<String> passiveSentenceDetails = new ArrayList<>();
    }

    @Override
    public Result analyze(String text) {
        Result r = new Result();
        List<String> sentences = TextUtils.sentences(TextUtils.stripTags(text), MIN_SENTENCE_CHARS);
        r.totalSentences = sentences.size();
        for (String s : sentences) {
            if (isPassive(s)) {
                r.passiveSentences++;
                r.passiveSentenceDetails.add(s);
            }
        }
        r.passivePercentage = r.totalSentences == 0 ? 0.0
                : TextUtils.round((double) r.passiveSentences / r.totalSentences * 100.0, 2);
        return r;
    }

    public boolean isPassive(String sentence) {
        for (Pattern p : PATTERNS) {
            if (p.matcher(sentence).find()) return true;
        }
        return false;
    }
}
