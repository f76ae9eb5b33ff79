package com.irondust.seo.service.correction;

import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies text rewrites to a marked-up body while leaving tags and their
 * attributes untouched.
 */
final class HtmlText {
    private HtmlText() {}

    private static final Pattern TAG = Pattern.compile("<[^>]*>");

    /** Runs {@code rewrite} over each run of text between tags. */
    static String mapText(String html, UnaryOperator<String> rewrite) {
        if (html == null) return null;
        StringBuilder out = new StringBuilder(html.length() + 64);
        Matcher m = TAG.matcher(html);
        int last = 0;
        while (m.find()) {
            out.append(rewriteSegment(html.substring(last, m.start()), rewrite));
            out.append(m.group());
            last = m.end();
        }
        out.append(rewriteSegment(html.substring(last), rewrite));
        return out.toString();
    }

    private static String rewriteSegment(String segment, UnaryOperator<String> rewrite) {
        if (segment.isBlank()) return segment;
        return rewrite.apply(segment);
    }

    static String capitalize(String s) {
        if (s == null || s.isEmpty()) return s;
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    /** Lower-cases the first letter unless the first word looks like an acronym or "I". */
    static String decapitalize(String s) {
        if (s == null || s.length() < 2) return s;
        String first = s.split("\\s+", 2)[0];
        if (first.equals("I") || (first.length() > 1 && first.equals(first.toUpperCase()))) return s;
        return Character.toLowerCase(s.charAt(0)) + s.substring(1);
    }
}
