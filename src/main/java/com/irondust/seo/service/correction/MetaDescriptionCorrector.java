package com.irondust.seo.service.correction;

import com.irondust.seo.model.Content;
import com.irondust.seo.util.TextUtils;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Brings the meta description within the configured length bounds and makes
 * sure it mentions the focus keyword.
 *
 * <p>Short descriptions are expanded with keyword-bearing phrases, then generic
 * fillers, then dots for the last few characters. Long ones are cut at the last
 * sentence end that keeps the keyword, falling back to a word boundary.
 */
public class MetaDescriptionCorrector implements Corrector {
    public static final String COMPONENT = "meta_description";

    private static final Pattern LEADING_ARTICLE = Pattern.compile("^(The|A|An)\\s+(.+)$");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?](?=\\s|$)");
    private static final List<String> FILLERS = List.of(
            " Get expert insights and practical tips.",
            " Find comprehensive information and guidance.",
            " Explore detailed explanations and examples.",
            " Access valuable resources and recommendations.",
            " Learn more here.",
            " Read on.");

    @Override
    public String getComponent() {
        return COMPONENT;
    }

    @Override
    public Content correct(Content content, String focusKeyword, List<String> secondaryKeywords, CorrectionOptions options) {
        Content out = content.copy();
        out.setMetaDescription(correctDescription(content.getMetaDescription(), focusKeyword,
                options.getThresholds().getMinMetaDescLength(), options.getThresholds().getMaxMetaDescLength()));
        return out;
    }

    public String correctDescription(String metaDescription, String focusKeyword, int minLength, int maxLength) {
        String m = TextUtils.nullToEmpty(metaDescription).replaceAll("\\s+", " ").trim();
        if (m.isEmpty()) {
            m = fallback(focusKeyword);
        }
        if (isCompliant(m, focusKeyword, minLength, maxLength)) {
            return m;
        }
        if (hasKeyword(focusKeyword) && !TextUtils.containsIgnoreCase(m, focusKeyword)) {
            m = insertKeyword(m, focusKeyword);
        }
        for (int round = 0; round < 3 && !isCompliant(m, focusKeyword, minLength, maxLength); round++) {
            if (m.length() < minLength) m = expand(m, focusKeyword, minLength, maxLength);
            if (m.length() > maxLength) m = trim(m, focusKeyword, minLength, maxLength);
        }
        return m;
    }

    static boolean isCompliant(String m, String keyword, int min, int max) {
        return m.length() >= min && m.length() <= max
                && (!hasKeyword(keyword) || TextUtils.containsIgnoreCase(m, keyword));
    }

    private static boolean hasKeyword(String keyword) {
        return keyword != null && !keyword.isBlank();
    }

    String insertKeyword(String m, String keyword) {
        Matcher a = LEADING_ARTICLE.matcher(m);
        if (a.matches()) {
            return a.group(1) + " " + keyword.trim() + " " + HtmlText.decapitalize(a.group(2));
        }
        return HtmlText.capitalize(keyword.trim()) + ": " + m;
    }

    String expand(String m, String keyword, int min, int max) {
        StringBuilder sb = new StringBuilder(m);
        if (!m.matches(".*[.!?]$")) sb.append('.');
        if (hasKeyword(keyword)) {
            for (String p : List.of(" Learn more about " + keyword.trim() + " and how it can benefit you.",
                    " Discover everything you need to know about " + keyword.trim() + ".")) {
                if (sb.length() >= min) break;
                if (sb.length() + p.length() <= max) sb.append(p);
            }
        }
        for (String f : FILLERS) {
            if (sb.length() >= min) break;
            if (sb.length() + f.length() <= max) sb.append(f);
        }
        if (sb.length() < min) {
            sb.append(".".repeat(min - sb.length()));
        }
        return sb.toString();
    }

    String trim(String m, String keyword, int min, int max) {
        String best = null;
        Matcher end = SENTENCE_END.matcher(m);
        while (end.find()) {
            if (end.end() > max) break;
            String candidate = m.substring(0, end.end()).trim();
            if (candidate.length() >= min && (!hasKeyword(keyword) || TextUtils.containsIgnoreCase(candidate, keyword))) {
                best = candidate;
            }
        }
        if (best != null) return best;

        String cut = TextUtils.truncateAtWord(m, max, "...");
        if (!hasKeyword(keyword) || TextUtils.containsIgnoreCase(cut, keyword)) return cut;
        return TextUtils.truncateAtWord(HtmlText.capitalize(keyword.trim()) + ": " + m, max, "...");
    }

    String fallback(String keyword) {
        if (!hasKeyword(keyword)) {
            return "Discover comprehensive information, key insights, best practices, and expert recommendations in this guide.";
        }
        return String.format("Discover comprehensive information about %s. Learn key insights, best practices, and expert recommendations.",
                keyword.trim());
    }
}
