package com.irondust.seo.service.analysis;

import com.irondust.seo.util.TextUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Keyword density over the visible text of a marked-up body, counting the
 * focus keyword and every secondary keyword as whole-word, case-insensitive
 * matches. Subheading usage is the share of h1-h6 elements mentioning any keyword.
 */
public class KeywordDensityAnalyzer {

    public static class Result {
        /** Percent, two decimals */
        public double overallDensity;
        public int keywordCount;
        public int totalWords;
        /** Percent of subheadings containing a keyword */
        public double subheadingDensity;
        public int subheadingKeywordCount;
        public int totalSubheadings;
    }

    public Result analyze(String html, String focusKeyword, List<String> secondaryKeywords) {
        Result r = new Result();
        if (html == null || html.isBlank() || focusKeyword == null || focusKeyword.isBlank()) {
            return r;
        }
        List<String> keywords = keywords(focusKeyword, secondaryKeywords);
        String text = TextUtils.stripTags(html);
        r.totalWords = TextUtils.wordCount(text);
        for (String k : keywords) {
            r.keywordCount += TextUtils.countKeyword(text, k);
        }
        r.overallDensity = r.totalWords > 0 ? TextUtils.round((double) r.keywordCount / r.totalWords * 100.0, 2) : 0.0;

        List<Element> headings = Jsoup.parseBodyFragment(html).select("h1, h2, h3, h4, h5, h6");
        r.totalSubheadings = headings.size();
        for (Element h : headings) {
            for (String k : keywords) {
                if (TextUtils.countKeyword(h.text(), k) > 0) {
                    r.subheadingKeywordCount++;
                    break;
                }
            }
        }
        r.subheadingDensity = r.totalSubheadings > 0
                ? TextUtils.round((double) r.subheadingKeywordCount / r.totalSubheadings * 100.0, 2) : 0.0;
        return r;
    }

    static List<String> keywords(String focusKeyword, List<String> secondaryKeywords) {
        List<String> out = new ArrayList<>();
        out.add(focusKeyword.trim());
        if (secondaryKeywords != null) {
            for (String s : secondaryKeywords) {
                if (s != null && !s.isBlank() && !s.trim().equalsIgnoreCase(focusKeyword.trim())) out.add(s.trim());
            }
        }
        return out;
    }
}
