package com.irondust.seo.util;

import org.jsoup.Jsoup;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text helpers shared by analyzers, correctors and the cache.
 *
 * <p>All methods accept {@code null} and treat it as empty text.
 */
public final class TextUtils {
    private TextUtils() {}

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}][\\p{L}\\p{N}'’-]*");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");

    /** Plain text of a marked-up fragment with whitespace collapsed. */
    public static String stripTags(String html) {
        if (html == null || html.isBlank()) return "";
        return Jsoup.parse(html).text().replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
    }

    public static List<String> words(String text) {
        List<String> out = new ArrayList<>();
        if (text == null) return out;
        Matcher m = WORD.matcher(text);
        while (m.find()) out.add(m.group());
        return out;
    }

    public static int wordCount(String text) {
        return words(text).size();
    }

    /**
     * Splits plain text into trimmed sentences at terminal punctuation.
     * Sentences shorter than {@code minLength} characters are dropped.
     */
    public static List<String> sentences(String text, int minLength) {
        List<String> out = new ArrayList<>();
        if (text == null) return out;
        for (String s : SENTENCE_BREAK.split(text.trim())) {
            String t = s.trim();
            if (t.length() >= minLength && !t.isEmpty()) out.add(t);
        }
        return out;
    }

    /** Case-insensitive, whole-word pattern for a keyword or phrase. */
    public static Pattern keywordPattern(String keyword) {
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(keyword.trim()) + "(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    public static int countKeyword(String text, String keyword) {
        if (text == null || keyword == null || keyword.isBlank()) return 0;
        Matcher m = keywordPattern(keyword).matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    /** Substring test ignoring case; empty keyword never matches. */
    public static boolean containsIgnoreCase(String text, String keyword) {
        if (text == null || keyword == null || keyword.isBlank()) return false;
        return text.toLowerCase(Locale.ROOT).contains(keyword.trim().toLowerCase(Locale.ROOT));
    }

    public static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public static double round(double value, int decimals) {
        double f = Math.pow(10, decimals);
        return Math.round(value * f) / f;
    }

    /**
     * Similarity of two strings as a percentage 0-100, from edit distance over the longer length.
     */
    public static double similarityPercent(String a, String b) {
        String x = nullToEmpty(a).toLowerCase(Locale.ROOT);
        String y = nullToEmpty(b).toLowerCase(Locale.ROOT);
        int max = Math.max(x.length(), y.length());
        if (max == 0) return 100.0;
        return (1.0 - (double) levenshtein(x, y) / max) * 100.0;
    }

    static int levenshtein(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] cur = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) prev[j] = j;
        for (int i = 1; i <= a.length(); i++) {
            cur[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                cur[j] = Math.min(Math.min(cur[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] t = prev;
            prev = cur;
            cur = t;
        }
        return prev[b.length()];
    }

    public static String md5Hex(String s) {
        return digestHex("MD5", s);
    }

    public static String sha256Hex(String s) {
        return digestHex("SHA-256", s);
    }

    private static String digestHex(String algorithm, String s) {
        try {
            MessageDigest md = MessageDigest.getInstance(algorithm);
            byte[] d = md.digest(nullToEmpty(s).getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : d) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            // Both algorithms are mandatory on every JRE
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }

    /**
     * Cuts {@code text} to at most {@code maxLength} characters at the last word
     * boundary and appends {@code suffix} within that budget.
     */
    public static String truncateAtWord(String text, int maxLength, String suffix) {
        if (text == null || text.length() <= maxLength) return text;
        int budget = Math.max(0, maxLength - suffix.length());
        String cut = text.substring(0, budget);
        int lastSpace = cut.lastIndexOf(' ');
        if (lastSpace > budget / 2) cut = cut.substring(0, lastSpace);
        return cut.replaceAll("[\\s,;:.\\-]+$", "") + suffix;
    }
}
