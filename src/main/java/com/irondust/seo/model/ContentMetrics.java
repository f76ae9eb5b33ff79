package com.irondust.seo.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Raw measurements taken by the issue detector. Percentages are 0-100.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContentMetrics {
    private double keywordDensity;
    private int keywordCount;
    private int wordCount;
    private double subheadingKeywordUsage;
    private int metaDescriptionLength;
    private boolean metaDescriptionHasKeyword;
    private double passiveVoicePercentage;
    private double longSentencePercentage;
    private double transitionWordPercentage;
    private int titleLength;
    private boolean titleHasKeyword;
    private int imageCount;
    private int properAltTextCount;

    public double getKeywordDensity() { return keywordDensity; }
    public void setKeywordDensity(double keywordDensity) { this.keywordDensity = keywordDensity; }
    public int getKeywordCount() { return keywordCount; }
    public void setKeywordCount(int keywordCount) { this.keywordCount = keywordCount; }
    public int getWordCount() { return wordCount; }
    public void setWordCount(int wordCount) { this.wordCount = wordCount; }
    public double getSubheadingKeywordUsage() { return subheadingKeywordUsage; }
    public void setSubheadingKeywordUsage(double subheadingKeywordUsage) { this.subheadingKeywordUsage = subheadingKeywordUsage; }
    public int getMetaDescriptionLength() { return metaDescriptionLength; }
    public void setMetaDescriptionLength(int metaDescriptionLength) { this.metaDescriptionLength = metaDescriptionLength; }
    public boolean isMetaDescriptionHasKeyword() { return metaDescriptionHasKeyword; }
    public void setMetaDescriptionHasKeyword(boolean metaDescriptionHasKeyword) { this.metaDescriptionHasKeyword = metaDescriptionHasKeyword; }
    public double getPassiveVoicePercentage() { return passiveVoicePercentage; }
    public void setPassiveVoicePercentage(double passiveVoicePercentage) { this.passiveVoicePercentage = passiveVoicePercentage; }
    public double getLongSentencePercentage() { return longSentencePercentage; }
    public void setLongSentencePercentage(double longSentencePercentage) { this.longSentencePercentage = longSentencePercentage; }
    public double getTransitionWordPercentage() { return transitionWordPercentage; }
    public void setTransitionWordPercentage(double transitionWordPercentage) { this.transitionWordPercentage = transitionWordPercentage; }
    public int getTitleLength() { return titleLength; }
    public void setTitleLength(int titleLength) { this.titleLength = titleLength; }
    public boolean isTitleHasKeyword() { return titleHasKeyword; }
    public void setTitleHasKeyword(boolean titleHasKeyword) { this.titleHasKeyword = titleHasKeyword; }
    public int getImageCount() { return imageCount; }
    public void setImageCount(int imageCount) { this.imageCount = imageCount; }
    public int getProperAltTextCount() { return properAltTextCount; }
    public void setProperAltTextCount(int properAltTextCount) { this.properAltTextCount = properAltTextCount; }
}
