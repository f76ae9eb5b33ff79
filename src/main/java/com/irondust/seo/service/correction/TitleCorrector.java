package com.irondust.seo.service.correction;

import com.irondust.seo.model.Content;
import com.irondust.seo.util.TextUtils;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Puts the focus keyword into the title and keeps the title within the
 * maximum length. A trailing "| Brand" or "- Subtitle" segment is dropped
 * before resorting to a word-boundary cut.
 */
public class TitleCorrector implements Corrector {
    public static final String COMPONENT = "title";

    private static final Pattern TRAILING_SEGMENT = Pattern.compile("\\s+[|\\-–:]\\s+[^|\\-–:]*$");

    @Override
    public String getComponent() {
        return COMPONENT;
    }

    @Override
    public Content correct(Content content, String focusKeyword, List<String> secondaryKeywords, CorrectionOptions options) {
        Content out = content.copy();
        out.setTitle(correctTitle(content.getTitle(), focusKeyword, options.getThresholds().getMaxTitleLength()));
        return out;
    }

    public String correctTitle(String title, String focusKeyword, int maxLength) {
        String t = TextUtils.nullToEmpty(title).replaceAll("\\s+", " ").trim();
        boolean hasKeyword = focusKeyword != null && !focusKeyword.isBlank();
        if (t.isEmpty()) {
            return hasKeyword ? HtmlText.capitalize(focusKeyword.trim()) + ": A Complete Guide" : t;
        }
        if (hasKeyword && !TextUtils.containsIgnoreCase(t, focusKeyword)) {
            t = HtmlText.capitalize(focusKeyword.trim()) + ": " + t;
        }
        return shorten(t, focusKeyword, maxLength);
    }

    String shorten(String title, String keyword, int maxLength) {
        String t = title;
        while (t.length() > maxLength) {
            String dropped = TRAILING_SEGMENT.matcher(t).replaceFirst("");
            if (dropped.equals(t) || dropped.isBlank()
                    || (keyword != null && !keyword.isBlank() && !TextUtils.containsIgnoreCase(dropped, keyword))) {
                break;
            }
            t = dropped;
        }
        return t.length() > maxLength ? TextUtils.truncateAtWord(t, maxLength, "...") : t;
    }
}
