package com.irondust.seo.service.correction;

import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.Content;
import com.irondust.seo.service.analysis.PassiveVoiceAnalyzer;
import com.irondust.seo.service.analysis.SentenceLengthAnalyzer;
import com.irondust.seo.service.analysis.TransitionWordAnalyzer;
import com.irondust.seo.util.TextUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Surface-level readability fixes: passive constructions are rewritten to
 * active ones, long sentences are split at conjunctions or commas, and
 * transition words are prefixed to sentences lacking one. Runs up to three
 * rounds, stopping early once every readability threshold is met.
 */
public class ReadabilityCorrector implements Corrector {
    public static final String COMPONENT = "readability";
    private static final int MAX_ROUNDS = 3;

    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");

    private static final Pattern AGENT_PASSIVE = Pattern.compile(
            "^(.+?)\\s+(?:was|were|is|are|has been|have been)\\s+(\\w+ed)\\s+by\\s+([^.!?,]+)([.!?]?)$",
            Pattern.CASE_INSENSITIVE);

    /** be-verb -> get-verb; keeps the participle so the sentence stays grammatical */
    private static final String[][] BE_TO_GET = {
            {"\\bam\\b", "get"}, {"\\bis\\b", "gets"}, {"\\bare\\b", "get"},
            {"\\bwas\\b", "got"}, {"\\bwere\\b", "got"}, {"\\bbeing\\b", "getting"},
            {"\\bbeen\\b", "gotten"}, {"\\bbe\\b", "get"}};

    private static final List<String[]> SPLITS = List.of(
            new String[]{",\\s+and\\s+", ". "},
            new String[]{",\\s+but\\s+", ". However, "},
            new String[]{",\\s+however,?\\s+", ". However, "},
            new String[]{",\\s+so\\s+", ". Therefore, "},
            new String[]{"\\s+because\\s+", ". This is because "},
            new String[]{",\\s+which\\s+", ". This "});

    static final List<String> TRANSITIONS = List.of(
            "Furthermore", "Additionally", "Moreover", "Also", "In addition", "For example", "Therefore");

    private final PassiveVoiceAnalyzer passiveAnalyzer = new PassiveVoiceAnalyzer();
    private final TransitionWordAnalyzer transitionAnalyzer = new TransitionWordAnalyzer();

    @Override
    public String getComponent() {
        return COMPONENT;
    }

    @Override
    public Content correct(Content content, String focusKeyword, List<String> secondaryKeywords, CorrectionOptions options) {
        Content out = content.copy();
        if (content.getBody() == null || content.getBody().isBlank()) return out;
        OptimizerProperties.Thresholds t = options.getThresholds();
        SentenceLengthAnalyzer lengthAnalyzer = new SentenceLengthAnalyzer(t.getMaxSentenceWords());
        String body = content.getBody();
        for (int round = 0; round < MAX_ROUNDS; round++) {
            String before = body;
            if (passiveAnalyzer.analyze(body).passivePercentage > t.getMaxPassiveVoice()) {
                body = reducePassiveVoice(body);
            }
            if (lengthAnalyzer.analyze(body).longSentencePercentage > t.getMaxLongSentences()) {
                body = splitLongSentences(body, t.getMaxSentenceWords());
            }
            if (transitionAnalyzer.analyze(body).transitionPercentage < t.getMinTransitionWords()) {
                body = addTransitions(body, t.getMinTransitionWords(), options.getRandom());
            }
            if (body.equals(before)) break;
        }
        out.setBody(body);
        return out;
    }

    public String reducePassiveVoice(String html) {
        return HtmlText.mapText(html, text -> mapSentences(text, s -> passiveAnalyzer.isPassive(s) ? toActive(s) : s));
    }

    String toActive(String sentence) {
        Matcher m = AGENT_PASSIVE.matcher(sentence.trim());
        if (m.matches()) {
            String object = HtmlText.decapitalize(m.group(1).trim());
            return HtmlText.capitalize(m.group(3).trim()) + " " + m.group(2) + " " + object
                    + (m.group(4).isEmpty() ? "." : m.group(4));
        }
        String s = sentence;
        for (String[] swap : BE_TO_GET) {
            Matcher b = Pattern.compile(swap[0] + "(?=\\s+\\w+(ed|en)\\b|\\s+(" + PassiveVoiceAnalyzer.IRREGULAR + ")\\b)",
                    Pattern.CASE_INSENSITIVE).matcher(s);
            if (b.find()) {
                String replacement = Character.isUpperCase(b.group().charAt(0)) ? HtmlText.capitalize(swap[1]) : swap[1];
                s = s.substring(0, b.start()) + replacement + s.substring(b.end());
            }
        }
        return s.replaceAll("(?i)\\b(has|have|had) gotten\\b", "$1 got");
    }

    public String splitLongSentences(String html, int maxWords) {
        return HtmlText.mapText(html, text -> mapSentences(text, s -> {
            if (TextUtils.wordCount(s) <= maxWords) return s;
            return splitSentence(s, maxWords);
        }));
    }

    String splitSentence(String sentence, int maxWords) {
        for (String[] split : SPLITS) {
            Matcher m = Pattern.compile(split[0], Pattern.CASE_INSENSITIVE).matcher(sentence);
            if (m.find() && m.start() > 0) {
                String first = sentence.substring(0, m.start()).trim();
                String second = sentence.substring(m.end()).trim();
                if (second.isEmpty()) continue;
                return first + split[1] + (split[1].endsWith(". ") ? HtmlText.capitalize(second) : second);
            }
        }
        int firstComma = sentence.indexOf(',');
        if (firstComma > 0 && sentence.indexOf(',', firstComma + 1) > 0) {
            return sentence.substring(0, firstComma).trim() + ". "
                    + HtmlText.capitalize(sentence.substring(firstComma + 1).trim());
        }
        // No natural break point; cut near the middle word.
        String[] words = sentence.trim().split("\\s+");
        int mid = words.length / 2;
        String first = String.join(" ", Arrays.copyOfRange(words, 0, mid)).replaceAll("[,;:]$", "");
        String second = String.join(" ", Arrays.copyOfRange(words, mid, words.length));
        return first + ". " + HtmlText.capitalize(second);
    }

    /**
     * Prefixes transitions onto sentences without one, skipping the opening
     * sentence, until {@code minPercentage} of sentences carry a transition.
     */
    public String addTransitions(String html, double minPercentage, Random random) {
        TransitionWordAnalyzer.Result r = transitionAnalyzer.analyze(html);
        if (r.totalSentences == 0) return html;
        int needed = (int) Math.ceil(minPercentage / 100.0 * r.totalSentences) - r.sentencesWithTransitions;
        if (needed <= 0) return html;
        int[] budget = {needed};
        boolean[] first = {true};
        return HtmlText.mapText(html, text -> mapSentences(text, s -> {
            if (first[0]) {
                first[0] = false;
                return s;
            }
            if (budget[0] <= 0 || s.length() < 6 || transitionAnalyzer.firstTransition(s) != null) return s;
            budget[0]--;
            String t = TRANSITIONS.get(random.nextInt(TRANSITIONS.size()));
            return t + ", " + HtmlText.decapitalize(s);
        }));
    }

    private static String mapSentences(String text, UnaryOperator<String> fn) {
        String leading = text.substring(0, text.length() - text.stripLeading().length());
        String trailing = text.substring(text.stripTrailing().length());
        String core = text.trim();
        if (core.isEmpty()) return text;
        List<String> out = new ArrayList<>();
        for (String s : SENTENCE_BREAK.split(core)) {
            out.add(fn.apply(s));
        }
        return leading + String.join(" ", out) + trailing;
    }
}
