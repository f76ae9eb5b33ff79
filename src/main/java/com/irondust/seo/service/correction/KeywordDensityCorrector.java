package com.irondust.seo.service.correction;

import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.Content;
import com.irondust.seo.service.analysis.KeywordDensityAnalyzer;
import com.irondust.seo.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Moves keyword density towards the configured target.
 *
 * <p>Below the minimum, short keyword sentences are appended to paragraphs in
 * turn until the target is reached. Above the maximum, surplus occurrences are
 * swapped for neutral references. Bodies under {@value #MIN_WORDS} words are left
 * alone since any change swings the density too far.
 */
public class KeywordDensityCorrector implements Corrector {
    private static final Logger log = LoggerFactory.getLogger(KeywordDensityCorrector.class);

    public static final String COMPONENT = "keyword_density";
    static final int MIN_WORDS = 50;
    private static final int MAX_ADDITIONS = 400;
    private static final Pattern PARAGRAPH_END = Pattern.compile("</p>", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEADING = Pattern.compile("(<h([1-6])[^>]*>)(.*?)(</h\\2>)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    static final List<String> KEYWORD_SENTENCES = List.of(
            "Additionally, %s matters here.",
            "Furthermore, %s deserves attention.",
            "Also, consider %s carefully.",
            "Moreover, %s pays off over time.");

    static final List<String> NEUTRAL_REFERENCES = List.of(
            "this solution", "this approach", "this option", "it");

    private final KeywordDensityAnalyzer analyzer = new KeywordDensityAnalyzer();

    @Override
    public String getComponent() {
        return COMPONENT;
    }

    @Override
    public Content correct(Content content, String focusKeyword, List<String> secondaryKeywords, CorrectionOptions options) {
        Content out = content.copy();
        String body = content.getBody();
        if (body == null || focusKeyword == null || focusKeyword.isBlank()) return out;
        OptimizerProperties.Thresholds t = options.getThresholds();

        KeywordDensityAnalyzer.Result r = analyzer.analyze(body, focusKeyword, secondaryKeywords);
        if (r.totalWords < MIN_WORDS) {
            log.debug("Skipping density correction, only {} words", r.totalWords);
            return out;
        }
        if (r.overallDensity < t.getMinKeywordDensity()) {
            body = increaseDensity(body, focusKeyword, secondaryKeywords, t.getTargetKeywordDensity());
        } else if (r.overallDensity > t.getMaxKeywordDensity()) {
            body = reduceDensity(body, focusKeyword, secondaryKeywords, t.getTargetKeywordDensity(), options.getRandom());
        }
        if (analyzer.analyze(body, focusKeyword, secondaryKeywords).subheadingDensity > t.getMaxSubheadingKeywordUsage()) {
            body = rewriteSubheadings(body, focusKeyword, t.getMaxSubheadingKeywordUsage());
        }
        out.setBody(body);
        return out;
    }

    String increaseDensity(String body, String keyword, List<String> secondary, double target) {
        int paragraphs = countMatches(PARAGRAPH_END, body);
        String current = body;
        for (int i = 0; i < MAX_ADDITIONS; i++) {
            if (analyzer.analyze(current, keyword, secondary).overallDensity >= target) break;
            String sentence = String.format(KEYWORD_SENTENCES.get(i % KEYWORD_SENTENCES.size()), keyword.trim());
            current = paragraphs > 0 ? appendToParagraph(current, i % paragraphs, sentence) : current + " " + sentence;
        }
        return current;
    }

    /**
     * Appends {@code count} keyword sentences, spread round-robin over the paragraphs.
     */
    public String addKeywordMentions(String body, String keyword, int count) {
        if (body == null || keyword == null || keyword.isBlank() || count <= 0) return body;
        int paragraphs = countMatches(PARAGRAPH_END, body);
        String current = body;
        for (int i = 0; i < count; i++) {
            String sentence = String.format(KEYWORD_SENTENCES.get(i % KEYWORD_SENTENCES.size()), keyword.trim());
            current = paragraphs > 0 ? appendToParagraph(current, i % paragraphs, sentence) : current + " " + sentence;
        }
        return current;
    }

    /**
     * Replaces the given share of keyword occurrences, counted from the end of
     * the text, with neutral references.
     */
    public String replaceKeywordMentions(String body, String keyword, double fraction, Random random) {
        if (body == null || keyword == null || keyword.isBlank()) return body;
        int total = TextUtils.countKeyword(TextUtils.stripTags(body), keyword);
        int keep = total - (int) Math.floor(total * fraction);
        int[] seen = {0};
        Pattern p = TextUtils.keywordPattern(keyword);
        return HtmlText.mapText(body, text -> {
            Matcher m = p.matcher(text);
            StringBuilder sb = new StringBuilder();
            while (m.find()) {
                seen[0]++;
                String replacement = seen[0] > keep
                        ? NEUTRAL_REFERENCES.get(random.nextInt(NEUTRAL_REFERENCES.size()))
                        : m.group();
                m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
            }
            m.appendTail(sb);
            return sb.toString();
        });
    }

    private static String appendToParagraph(String html, int index, String sentence) {
        Matcher m = PARAGRAPH_END.matcher(html);
        int seen = 0;
        while (m.find()) {
            if (seen++ == index) {
                return html.substring(0, m.start()) + " " + sentence + html.substring(m.start());
            }
        }
        return html + " " + sentence;
    }

    String reduceDensity(String body, String keyword, List<String> secondary, double target, Random random) {
        KeywordDensityAnalyzer.Result r = analyzer.analyze(body, keyword, secondary);
        int allowed = Math.max(1, (int) Math.floor(target * r.totalWords / 100.0));
        int[] seen = {0};
        Pattern p = TextUtils.keywordPattern(keyword);
        return HtmlText.mapText(body, text -> {
            Matcher m = p.matcher(text);
            StringBuilder sb = new StringBuilder();
            while (m.find()) {
                seen[0]++;
                String replacement = seen[0] > allowed
                        ? NEUTRAL_REFERENCES.get(random.nextInt(NEUTRAL_REFERENCES.size()))
                        : m.group();
                m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
            }
            m.appendTail(sb);
            return sb.toString();
        });
    }

    /**
     * Drops the keyword from the last keyword-bearing headings until usage falls
     * to the limit.
     */
    String rewriteSubheadings(String body, String keyword, double maxUsage) {
        List<int[]> withKeyword = new ArrayList<>();
        int total = 0;
        Matcher m = HEADING.matcher(body);
        while (m.find()) {
            total++;
            if (TextUtils.countKeyword(TextUtils.stripTags(m.group(3)), keyword) > 0) {
                withKeyword.add(new int[]{m.start(3), m.end(3)});
            }
        }
        int keep = (int) Math.floor(maxUsage / 100.0 * total);
        int toRewrite = withKeyword.size() - keep;
        if (toRewrite <= 0) return body;
        StringBuilder sb = new StringBuilder(body);
        for (int i = withKeyword.size() - 1; i >= 0 && toRewrite > 0; i--, toRewrite--) {
            int[] span = withKeyword.get(i);
            String inner = sb.substring(span[0], span[1]);
            String rewritten = TextUtils.keywordPattern(keyword).matcher(inner).replaceAll("")
                    .replaceAll("\\s{2,}", " ").replaceAll("^[\\s:,-]+|[\\s:,-]+$", "");
            if (TextUtils.stripTags(rewritten).isBlank()) rewritten = "Key Points";
            sb.replace(span[0], span[1], HtmlText.capitalize(rewritten));
        }
        return sb.toString();
    }

    private static int countMatches(Pattern p, String s) {
        Matcher m = p.matcher(s);
        int n = 0;
        while (m.find()) n++;
        return n;
    }
}
