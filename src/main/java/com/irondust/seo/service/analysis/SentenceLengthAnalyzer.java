package com.irondust.seo.service.analysis;

import com.irondust.seo.util.TextUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Share of sentences longer than {@code maxWords} words. */
public class SentenceLengthAnalyzer implements TextAnalyzer<SentenceLengthAnalyzer.Result> {
    private static final int MIN_SENTENCE_CHARS = 6;

    private final int maxWords;

    public SentenceLengthAnalyzer(int maxWords) {
        this.maxWords = maxWords;
    }

    public static class Result {
        public int totalSentences;
        public int longSentences;
        public double longSentencePercentage;
        public double averageWords;
        public double medianWords;
        public List<String> longSentenceDetails = new ArrayList<>();
    }

    @Override
    public Result analyze(String text) {
        Result r = new Result();
        List<String> sentences = TextUtils.sentences(TextUtils.stripTags(text), MIN_SENTENCE_CHARS);
        r.totalSentences = sentences.size();
        if (sentences.isEmpty()) return r;
        List<Integer> counts = new ArrayList<>();
        int total = 0;
        for (String s : sentences) {
            int wc = TextUtils.wordCount(s);
            counts.add(wc);
            total += wc;
            if (wc > maxWords) {
                r.longSentences++;
                r.longSentenceDetails.add(s);
            }
        }
        Collections.sort(counts);
        int mid = counts.size() / 2;
        r.medianWords = counts.size() % 2 == 1 ? counts.get(mid) : (counts.get(mid - 1) + counts.get(mid)) / 2.0;
        r.averageWords = TextUtils.round((double) total / sentences.size(), 2);
        r.longSentencePercentage = TextUtils.round((double) r.longSentences / r.totalSentences * 100.0, 2);
        return r;
    }

    public int getMaxWords() {
        return maxWords;
    }
}
