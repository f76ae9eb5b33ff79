package com.irondust.seo.service.analysis;

import com.irondust.seo.model.Content;
import com.irondust.seo.model.ImagePrompt;
import com.irondust.seo.util.TextUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Counts images (inline {@code <img>} tags plus requested image prompts) and
 * how many of them carry a descriptive alt text mentioning a keyword.
 */
public class ImageAnalyzer {
    static final int MIN_ALT_LENGTH = 11;

    private final boolean requireKeywordInAlt;

    public ImageAnalyzer(boolean requireKeywordInAlt) {
        this.requireKeywordInAlt = requireKeywordInAlt;
    }

    public static class Result {
        public int imageCount;
        public int properAltTextCount;
        /** Alt texts that are missing, too short or lack a keyword */
        public List<String> weakAltTexts = new ArrayList<>();
    }

    public Result analyze(Content content, String focusKeyword, List<String> secondaryKeywords) {
        Result r = new Result();
        List<String> alts = new ArrayList<>();
        String body = content.getBody();
        if (body != null && !body.isBlank()) {
            for (Element img : Jsoup.parseBodyFragment(body).select("img")) {
                alts.add(img.attr("alt"));
            }
        }
        if (content.getImagePrompts() != null) {
            for (ImagePrompt p : content.getImagePrompts()) {
                if (p != null) alts.add(TextUtils.nullToEmpty(p.getAlt()));
            }
        }
        r.imageCount = alts.size();
        for (String alt : alts) {
            if (isProperAlt(alt, focusKeyword, secondaryKeywords)) {
                r.properAltTextCount++;
            } else {
                r.weakAltTexts.add(alt);
            }
        }
        return r;
    }

    public boolean isProperAlt(String alt, String focusKeyword, List<String> secondaryKeywords) {
        if (alt == null || alt.trim().length() < MIN_ALT_LENGTH) return false;
        if (!requireKeywordInAlt || focusKeyword == null || focusKeyword.isBlank()) return true;
        for (String k : KeywordDensityAnalyzer.keywords(focusKeyword, secondaryKeywords)) {
            if (TextUtils.containsIgnoreCase(alt, k)) return true;
        }
        return false;
    }
}
