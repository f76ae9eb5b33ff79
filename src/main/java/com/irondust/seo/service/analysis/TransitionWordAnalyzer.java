package com.irondust.seo.service.analysis;

import com.irondust.seo.util.TextUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Share of sentences containing at least one transition word or phrase.
 * Longer phrases are matched before the single words they contain.
 */
public class TransitionWordAnalyzer implements TextAnalyzer<TransitionWordAnalyzer.Result> {
    private static final int MIN_SENTENCE_CHARS = 6;

    static final Map<String, List<String>> CATEGORIES = new LinkedHashMap<>();
    static {
        CATEGORIES.put("addition", List.of("also", "additionally", "furthermore", "moreover", "besides",
                "in addition", "as well as", "along with", "not only", "plus"));
        CATEGORIES.put("contrast", List.of("however", "nevertheless", "nonetheless", "on the other hand",
                "in contrast", "conversely", "although", "though", "despite", "while", "whereas", "but", "yet", "still"));
        CATEGORIES.put("cause_effect", List.of("therefore", "consequently", "as a result", "thus", "hence",
                "accordingly", "for this reason", "because of this", "due to", "since", "because", "so"));
        CATEGORIES.put("sequence", List.of("first", "second", "third", "next", "then", "after", "before",
                "finally", "lastly", "meanwhile", "subsequently", "previously", "initially", "ultimately", "eventually"));
        CATEGORIES.put("example", List.of("for example", "for instance", "such as", "including", "specifically",
                "in particular", "namely", "that is", "to illustrate", "as an example"));
        CATEGORIES.put("emphasis", List.of("indeed", "certainly", "obviously", "clearly", "undoubtedly",
                "without doubt", "in fact", "actually", "definitely", "absolutely", "particularly", "especially"));
        CATEGORIES.put("summary", List.of("in conclusion", "to conclude", "in summary", "to summarize", "overall",
                "in general", "on the whole", "all in all", "to sum up", "in short", "briefly"));
        CATEGORIES.put("comparison", List.of("similarly", "likewise", "in the same way", "equally", "compared to",
                "in comparison", "just as", "like", "correspondingly", "by the same token"));
    }

    private static final List<Map.Entry<String, Pattern>> ORDERED = new ArrayList<>();
    static {
        List<String> all = new ArrayList<>();
        CATEGORIES.values().forEach(all::addAll);
        all.sort(Comparator.comparingInt(String::length).reversed());
        for (String w : all) {
            ORDERED.add(Map.entry(w, Pattern.compile("\\b" + Pattern.quote(w) + "\\b", Pattern.CASE_INSENSITIVE)));
        }
    }

    public static class Result {
        public int totalSentences;
        public int sentencesWithTransitions;
        public double transitionPercentage;
        public Map<String, Integer> categoryUsage = new LinkedHashMap<>();
        public List<String> sentencesWithoutTransitions = new ArrayList<>();
    }

    @Override
    public Result analyze(String text) {
        Result r = new Result();
        CATEGORIES.keySet().forEach(c -> r.categoryUsage.put(c, 0));
        List<String> sentences = TextUtils.sentences(TextUtils.stripTags(text), MIN_SENTENCE_CHARS);
        r.totalSentences = sentences.size();
        for (String s : sentences) {
            String found = firstTransition(s);
            if (found != null) {
                r.sentencesWithTransitions++;
                r.categoryUsage.merge(categoryOf(found), 1, Integer::sum);
            } else {
                r.sentencesWithoutTransitions.add(s);
            }
        }
        r.transitionPercentage = r.totalSentences == 0 ? 0.0
                : TextUtils.round((double) r.sentencesWithTransitions / r.totalSentences * 100.0, 2);
        return r;
    }

    /** Longest transition phrase in the sentence, or null. */
    public String firstTransition(String sentence) {
        for (Map.Entry<String, Pattern> e : ORDERED) {
            if (e.getValue().matcher(sentence).find()) return e.getKey();
        }
        return null;
    }

    static String categoryOf(String word) {
        String w = word.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> e : CATEGORIES.entrySet()) {
            if (e.getValue().contains(w)) return e.getKey();
        }
        return "other";
    }
}
