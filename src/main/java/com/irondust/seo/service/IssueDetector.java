package com.irondust.seo.service;

import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.Content;
import com.irondust.seo.model.ContentMetrics;
import com.irondust.seo.model.DetectionReport;
import com.irondust.seo.model.Issue;
import com.irondust.seo.model.IssueLocation;
import com.irondust.seo.model.IssueType;
import com.irondust.seo.model.Severity;
import com.irondust.seo.service.analysis.ImageAnalyzer;
import com.irondust.seo.service.analysis.KeywordDensityAnalyzer;
import com.irondust.seo.service.analysis.PassiveVoiceAnalyzer;
import com.irondust.seo.service.analysis.SentenceLengthAnalyzer;
import com.irondust.seo.service.analysis.TransitionWordAnalyzer;
import com.irondust.seo.util.TextUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;

/**
 * Runs every aspect check over a piece of content and turns threshold
 * violations into typed {@link Issue}s.
 *
 * <h3>Scoring</h3>
 * Each issue costs {@code weight x severityWeight x 10} points; the sum is scaled
 * by 0.8 and subtracted from 100, clamped to 0-100. Content is compliant only at
 * a score of 100, i.e. with no issues at all.
 *
 * <p>Detection is pure: the same content, keywords and thresholds always yield the
 * same report, which is what makes reports safe to cache.
 */
@Service
public class IssueDetector {
    private static final Logger log = LoggerFactory.getLogger(IssueDetector.class);

    static final double PENALTY_SCALE = 0.8;
    private static final int CONTEXT_CHARS = 50;

    private final OptimizerProperties.Thresholds thresholds;
    private final KeywordDensityAnalyzer densityAnalyzer = new KeywordDensityAnalyzer();
    private final PassiveVoiceAnalyzer passiveAnalyzer = new PassiveVoiceAnalyzer();
    private final TransitionWordAnalyzer transitionAnalyzer = new TransitionWordAnalyzer();
    private final SentenceLengthAnalyzer sentenceAnalyzer;
    private final ImageAnalyzer imageAnalyzer;

    public IssueDetector(OptimizerProperties properties) {
        this.thresholds = properties.getThresholds();
        this.sentenceAnalyzer = new SentenceLengthAnalyzer(thresholds.getMaxSentenceWords());
        this.imageAnalyzer = new ImageAnalyzer(thresholds.isRequireKeywordInAltText());
    }

    public DetectionReport detectAllIssues(Content content, String focusKeyword, List<String> secondaryKeywords) {
        String keyword = focusKeyword != null ? focusKeyword : content.getFocusKeyword();
        List<String> secondary = secondaryKeywords != null ? secondaryKeywords : content.getSecondaryKeywords();
        ContentMetrics metrics = new ContentMetrics();
        List<Issue> issues = new ArrayList<>();

        issues.addAll(detectKeywordDensityIssues(content, keyword, secondary, metrics));
        issues.addAll(detectMetaDescriptionIssues(content, keyword, metrics));
        issues.addAll(detectPassiveVoiceIssues(content, metrics));
        issues.addAll(detectSentenceLengthIssues(content, metrics));
        issues.addAll(detectTransitionWordIssues(content, metrics));
        issues.addAll(detectTitleIssues(content, keyword, metrics));
        issues.addAll(detectSubheadingIssues(content, keyword, secondary, metrics));
        issues.addAll(detectImageIssues(content, keyword, secondary, metrics));

        double score = calculateComplianceScore(issues);
        log.debug("Detected {} issues for '{}', score {}", issues.size(), content.getTitle(), score);
        return new DetectionReport(issues, score, metrics);
    }

    public static double calculateComplianceScore(List<Issue> issues) {
        double penalty = 0.0;
        for (Issue i : issues) penalty += i.penalty();
        return Math.max(0.0, Math.min(100.0, 100.0 - penalty * PENALTY_SCALE));
    }

    private List<Issue> detectKeywordDensityIssues(Content content, String keyword, List<String> secondary,
                                                   ContentMetrics metrics) {
        List<Issue> issues = new ArrayList<>();
        if (keyword == null || keyword.isBlank()) return issues;
        KeywordDensityAnalyzer.Result r = densityAnalyzer.analyze(content.getBody(), keyword, secondary);
        metrics.setKeywordDensity(r.overallDensity);
        metrics.setKeywordCount(r.keywordCount);
        metrics.setWordCount(r.totalWords);
        metrics.setSubheadingKeywordUsage(r.subheadingDensity);

        if (r.overallDensity < thresholds.getMinKeywordDensity()) {
            issues.add(new Issue(IssueType.KEYWORD_DENSITY_LOW, r.overallDensity, thresholds.getMinKeywordDensity(),
                    keywordLocations(TextUtils.stripTags(content.getBody()), keyword),
                    String.format(Locale.ROOT, "Keyword density too low (%.2f%%, minimum %.2f%%)",
                            r.overallDensity, thresholds.getMinKeywordDensity())));
        } else if (r.overallDensity > thresholds.getMaxKeywordDensity()) {
            issues.add(new Issue(IssueType.KEYWORD_DENSITY_HIGH, r.overallDensity, thresholds.getMaxKeywordDensity(),
                    keywordLocations(TextUtils.stripTags(content.getBody()), keyword),
                    String.format(Locale.ROOT, "Keyword density too high (%.2f%%, maximum %.2f%%)",
                            r.overallDensity, thresholds.getMaxKeywordDensity())));
        }
        return issues;
    }

    private List<Issue> detectMetaDescriptionIssues(Content content, String keyword, ContentMetrics metrics) {
        List<Issue> issues = new ArrayList<>();
        String meta = TextUtils.nullToEmpty(content.getMetaDescription());
        int length = meta.length();
        metrics.setMetaDescriptionLength(length);
        List<IssueLocation> whole = List.of(new IssueLocation(0, length, meta));

        if (length < thresholds.getMinMetaDescLength()) {
            issues.add(new Issue(IssueType.META_DESCRIPTION_SHORT, length, thresholds.getMinMetaDescLength(), whole,
                    String.format(Locale.ROOT, "Meta description too short (%d chars, minimum %d)",
                            length, thresholds.getMinMetaDescLength())));
        } else if (length > thresholds.getMaxMetaDescLength()) {
            issues.add(new Issue(IssueType.META_DESCRIPTION_LONG, length, thresholds.getMaxMetaDescLength(), whole,
                    String.format(Locale.ROOT, "Meta description too long (%d chars, maximum %d)",
                            length, thresholds.getMaxMetaDescLength())));
        }
        boolean hasKeyword = TextUtils.containsIgnoreCase(meta, keyword);
        metrics.setMetaDescriptionHasKeyword(hasKeyword);
        if (keyword != null && !keyword.isBlank() && !hasKeyword) {
            issues.add(new Issue(IssueType.META_DESCRIPTION_NO_KEYWORD, 0, 1, whole,
                    "Meta description missing focus keyword: " + keyword));
        }
        return issues;
    }

    private List<Issue> detectPassiveVoiceIssues(Content content, ContentMetrics metrics) {
        List<Issue> issues = new ArrayList<>();
        PassiveVoiceAnalyzer.Result r = passiveAnalyzer.analyze(content.getBody());
        metrics.setPassiveVoicePercentage(r.passivePercentage);
        if (r.passivePercentage > thresholds.getMaxPassiveVoice()) {
            issues.add(new Issue(IssueType.PASSIVE_VOICE_HIGH, r.passivePercentage, thresholds.getMaxPassiveVoice(),
                    sentenceLocations(TextUtils.stripTags(content.getBody()), r.passiveSentenceDetails),
                    String.format(Locale.ROOT, "Too much passive voice (%.1f%%, maximum %.1f%%)",
                            r.passivePercentage, thresholds.getMaxPassiveVoice())));
        }
        return issues;
    }

    private List<Issue> detectSentenceLengthIssues(Content content, ContentMetrics metrics) {
        List<Issue> issues = new ArrayList<>();
        SentenceLengthAnalyzer.Result r = sentenceAnalyzer.analyze(content.getBody());
        metrics.setLongSentencePercentage(r.longSentencePercentage);
        if (r.longSentencePercentage > thresholds.getMaxLongSentences()) {
            issues.add(new Issue(IssueType.SENTENCE_LENGTH_HIGH, r.longSentencePercentage, thresholds.getMaxLongSentences(),
                    sentenceLocations(TextUtils.stripTags(content.getBody()), r.longSentenceDetails),
                    String.format(Locale.ROOT, "Too many long sentences (%.1f%%, maximum %.1f%%)",
                            r.longSentencePercentage, thresholds.getMaxLongSentences())));
        }
        return issues;
    }

    private List<Issue> detectTransitionWordIssues(Content content, ContentMetrics metrics) {
        List<Issue> issues = new ArrayList<>();
        TransitionWordAnalyzer.Result r = transitionAnalyzer.analyze(content.getBody());
        metrics.setTransitionWordPercentage(r.transitionPercentage);
        if (r.totalSentences > 0 && r.transitionPercentage < thresholds.getMinTransitionWords()) {
            issues.add(new Issue(IssueType.TRANSITION_WORDS_LOW, r.transitionPercentage, thresholds.getMinTransitionWords(),
                    sentenceLocations(TextUtils.stripTags(content.getBody()), r.sentencesWithoutTransitions),
                    String.format(Locale.ROOT, "Not enough transition words (%.1f%%, minimum %.1f%%)",
                            r.transitionPercentage, thresholds.getMinTransitionWords())));
        }
        return issues;
    }

    private List<Issue> detectTitleIssues(Content content, String keyword, ContentMetrics metrics) {
        List<Issue> issues = new ArrayList<>();
        String title = TextUtils.nullToEmpty(content.getTitle());
        metrics.setTitleLength(title.length());
        List<IssueLocation> whole = List.of(new IssueLocation(0, title.length(), title));
        if (title.length() > thresholds.getMaxTitleLength()) {
            issues.add(new Issue(IssueType.TITLE_TOO_LONG, title.length(), thresholds.getMaxTitleLength(), whole,
                    String.format(Locale.ROOT, "Title too long (%d chars, maximum %d)",
                            title.length(), thresholds.getMaxTitleLength())));
        }
        boolean hasKeyword = TextUtils.containsIgnoreCase(title, keyword);
        metrics.setTitleHasKeyword(hasKeyword);
        if (keyword != null && !keyword.isBlank() && !hasKeyword) {
            issues.add(new Issue(IssueType.TITLE_NO_KEYWORD, 0, 1, whole, "Title missing focus keyword: " + keyword));
        }
        return issues;
    }

    private List<Issue> detectSubheadingIssues(Content content, String keyword, List<String> secondary,
                                               ContentMetrics metrics) {
        List<Issue> issues = new ArrayList<>();
        if (keyword == null || keyword.isBlank() || content.getBody() == null) return issues;
        double usage = metrics.getSubheadingKeywordUsage();
        if (usage > thresholds.getMaxSubheadingKeywordUsage()) {
            List<IssueLocation> locations = new ArrayList<>();
            for (Element h : Jsoup.parseBodyFragment(content.getBody()).select("h1, h2, h3, h4, h5, h6")) {
                if (TextUtils.countKeyword(h.text(), keyword) > 0) {
                    locations.add(new IssueLocation(h.siblingIndex(), h.text().length(), h.outerHtml()));
                }
            }
            issues.add(new Issue(IssueType.SUBHEADING_KEYWORD_OVERUSE, usage, thresholds.getMaxSubheadingKeywordUsage(),
                    locations, String.format(Locale.ROOT, "Too many subheadings contain keyword (%.1f%%, maximum %.1f%%)",
                            usage, thresholds.getMaxSubheadingKeywordUsage())));
        }
        return issues;
    }

    private List<Issue> detectImageIssues(Content content, String keyword, List<String> secondary,
                                          ContentMetrics metrics) {
        List<Issue> issues = new ArrayList<>();
        ImageAnalyzer.Result r = imageAnalyzer.analyze(content, keyword, secondary);
        metrics.setImageCount(r.imageCount);
        metrics.setProperAltTextCount(r.properAltTextCount);
        if (thresholds.isRequireImages() && r.imageCount == 0) {
            issues.add(new Issue(IssueType.NO_IMAGES, 0, 1, List.of(), "Content should include at least one image"));
        }
        if (thresholds.isRequireKeywordInAltText() && r.imageCount > 0 && r.properAltTextCount < r.imageCount) {
            List<IssueLocation> locations = new ArrayList<>();
            for (String alt : r.weakAltTexts) locations.add(new IssueLocation(-1, alt.length(), alt));
            issues.add(new Issue(IssueType.ALT_TEXT_NO_KEYWORD, r.properAltTextCount, r.imageCount, locations,
                    "Image alt text should include focus keyword"));
        }
        return issues;
    }

    private static List<IssueLocation> keywordLocations(String text, String keyword) {
        List<IssueLocation> out = new ArrayList<>();
        Matcher m = TextUtils.keywordPattern(keyword).matcher(text);
        while (m.find()) {
            int from = Math.max(0, m.start() - CONTEXT_CHARS);
            int to = Math.min(text.length(), m.end() + CONTEXT_CHARS);
            out.add(new IssueLocation(m.start(), m.end() - m.start(), text.substring(from, to)));
        }
        return out;
    }

    private static List<IssueLocation> sentenceLocations(String text, List<String> sentences) {
        List<IssueLocation> out = new ArrayList<>();
        for (String s : sentences) {
            out.add(new IssueLocation(text.indexOf(s), s.length(), s));
        }
        return out;
    }

    public List<Issue> getIssuesBySeverity(List<Issue> issues, Severity severity) {
        List<Issue> out = new ArrayList<>();
        for (Issue i : issues) if (i.getSeverity() == severity) out.add(i);
        return out;
    }

    public List<Issue> getIssuesByType(List<Issue> issues, IssueType type) {
        List<Issue> out = new ArrayList<>();
        for (Issue i : issues) if (i.getType() == type) out.add(i);
        return out;
    }

    /** Highest priority first; ties broken by weight, heaviest first. */
    public List<Issue> sortIssuesByPriority(List<Issue> issues) {
        List<Issue> out = new ArrayList<>(issues);
        out.sort(Comparator.comparingInt(Issue::getPriority).reversed()
                .thenComparing(Comparator.comparingDouble(Issue::getWeight).reversed()));
        return out;
    }
}
