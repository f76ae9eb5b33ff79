package com.irondust.seo.service.correction;

import com.irondust.seo.model.Content;
import com.irondust.seo.model.ImagePrompt;
import com.irondust.seo.service.analysis.ImageAnalyzer;
import com.irondust.seo.util.TextUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Requests an image when the content has none and rewrites weak alt texts,
 * on image prompts and inline {@code <img>} tags alike, so they describe the
 * focus keyword.
 */
public class ImageCorrector implements Corrector {
    public static final String COMPONENT = "images";

    private static final Pattern IMG_TAG = Pattern.compile("<img\\b[^>]*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern ALT_ATTR = Pattern.compile("\\balt\\s*=\\s*(\"[^\"]*\"|'[^']*')", Pattern.CASE_INSENSITIVE);

    @Override
    public String getComponent() {
        return COMPONENT;
    }

    @Override
    public Content correct(Content content, String focusKeyword, List<String> secondaryKeywords, CorrectionOptions options) {
        Content out = content.copy();
        ImageAnalyzer analyzer = new ImageAnalyzer(options.getThresholds().isRequireKeywordInAltText());
        ImageAnalyzer.Result r = analyzer.analyze(content, focusKeyword, secondaryKeywords);

        if (r.imageCount == 0) {
            if (options.getThresholds().isRequireImages()) {
                List<ImagePrompt> prompts = new ArrayList<>(out.getImagePrompts() != null ? out.getImagePrompts() : List.of());
                prompts.add(newPrompt(content.getTitle(), focusKeyword));
                out.setImagePrompts(prompts);
            }
            return out;
        }
        if (r.properAltTextCount == r.imageCount) return out;

        if (out.getImagePrompts() != null) {
            for (ImagePrompt p : out.getImagePrompts()) {
                if (p != null && !analyzer.isProperAlt(p.getAlt(), focusKeyword, secondaryKeywords)) {
                    p.setAlt(altText(p.getAlt(), p.getPrompt(), focusKeyword));
                }
            }
        }
        if (out.getBody() != null) {
            out.setBody(fixInlineAlts(out.getBody(), analyzer, focusKeyword, secondaryKeywords));
        }
        return out;
    }

    public static ImagePrompt newPrompt(String title, String focusKeyword) {
        String subject = title != null && !title.isBlank() ? title.trim() : TextUtils.nullToEmpty(focusKeyword).trim();
        return new ImagePrompt("Image related to " + subject, defaultAlt(focusKeyword));
    }

    static String defaultAlt(String focusKeyword) {
        if (focusKeyword == null || focusKeyword.isBlank()) return "Illustration for this article";
        return "Image showing " + focusKeyword.trim() + " concept";
    }

    String altText(String currentAlt, String prompt, String focusKeyword) {
        String base = TextUtils.nullToEmpty(currentAlt).trim();
        if (base.isEmpty()) base = TextUtils.nullToEmpty(prompt).replaceFirst("(?i)^image (related to|of)\\s+", "").trim();
        if (focusKeyword == null || focusKeyword.isBlank()) {
            return base.length() >= 11 ? base : defaultAlt(null);
        }
        if (base.isEmpty() || TextUtils.containsIgnoreCase(base, focusKeyword)) return defaultAlt(focusKeyword);
        String alt = HtmlText.capitalize(focusKeyword.trim()) + ": " + base;
        return alt.length() >= 11 ? alt : defaultAlt(focusKeyword);
    }

    private String fixInlineAlts(String html, ImageAnalyzer analyzer, String focusKeyword, List<String> secondary) {
        Matcher m = IMG_TAG.matcher(html);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String tag = m.group();
            Matcher alt = ALT_ATTR.matcher(tag);
            String current = alt.find() ? alt.group(1).substring(1, alt.group(1).length() - 1) : null;
            if (!analyzer.isProperAlt(current, focusKeyword, secondary)) {
                String fixed = altText(current, null, focusKeyword).replace("\"", "&quot;");
                if (current != null) {
                    tag = tag.substring(0, alt.start()) + "alt=\"" + fixed + "\"" + tag.substring(alt.end());
                } else {
                    int close = tag.endsWith("/>") ? tag.length() - 2 : tag.length() - 1;
                    tag = tag.substring(0, close).replaceAll("\\s+$", "") + " alt=\"" + fixed + "\"" + tag.substring(close);
                }
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(tag));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
