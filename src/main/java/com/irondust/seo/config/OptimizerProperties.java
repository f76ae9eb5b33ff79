package com.irondust.seo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tuning knobs for the multi-pass optimizer and everything it drives.
 *
 * <p>All fields carry working defaults so services and tests can use
 * {@code new OptimizerProperties()} without any Spring context.
 */
@ConfigurationProperties(prefix = "seo")
public class OptimizerProperties {
    private int maxIterations = 5;
    private double targetComplianceScore = 100.0;
    private boolean enableEarlyTermination = true;
    /** Consecutive low-improvement passes that end a session */
    private int stagnationThreshold = 2;
    private double minImprovementThreshold = 1.0;
    private List<String> priorityOrder = new ArrayList<>(List.of(
            "meta_description", "keyword_density", "readability", "title", "images"));
    private boolean autoCorrection = true;
    /** Hand a stalled pass to the retry manager before recording it */
    private boolean escalateOnStagnation = true;
    private long randomSeed = 42L;

    private Thresholds thresholds = new Thresholds();
    private Retry retry = new Retry();
    private Cache cache = new Cache();
    private Progress progress = new Progress();
    private Structure structure = new Structure();
    private Errors errors = new Errors();

    public static class Thresholds {
        private int minMetaDescLength = 120;
        private int maxMetaDescLength = 156;
        private double minKeywordDensity = 0.5;
        private double maxKeywordDensity = 2.5;
        private double targetKeywordDensity = 1.5;
        private double maxPassiveVoice = 10.0;
        private double maxLongSentences = 25.0;
        private int maxSentenceWords = 20;
        private double minTransitionWords = 30.0;
        private int maxTitleLength = 66;
        private double maxSubheadingKeywordUsage = 75.0;
        private boolean requireImages = true;
        private boolean requireKeywordInAltText = true;

        /**
         * Threshold values that influence validation outcomes, keyed by name.
         * Used for cache keys, so ordering does not matter to callers.
         */
        public Map<String, Object> asMap() {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("minMetaDescLength", minMetaDescLength);
            m.put("maxMetaDescLength", maxMetaDescLength);
            m.put("minKeywordDensity", minKeywordDensity);
            m.put("maxKeywordDensity", maxKeywordDensity);
            m.put("targetKeywordDensity", targetKeywordDensity);
            m.put("maxPassiveVoice", maxPassiveVoice);
            m.put("maxLongSentences", maxLongSentences);
            m.put("maxSentenceWords", maxSentenceWords);
            m.put("minTransitionWords", minTransitionWords);
            m.put("maxTitleLength", maxTitleLength);
            m.put("maxSubheadingKeywordUsage", maxSubheadingKeywordUsage);
            m.put("requireImages", requireImages);
            m.put("requireKeywordInAltText", requireKeywordInAltText);
            return m;
        }

        public int getMinMetaDescLength() { return minMetaDescLength; }
        public void setMinMetaDescLength(int minMetaDescLength) { this.minMetaDescLength = minMetaDescLength; }
        public int getMaxMetaDescLength() { return maxMetaDescLength; }
        public void setMaxMetaDescLength(int maxMetaDescLength) { this.maxMetaDescLength = maxMetaDescLength; }
        public double getMinKeywordDensity() { return minKeywordDensity; }
        public void setMinKeywordDensity(double minKeywordDensity) { this.minKeywordDensity = minKeywordDensity; }
        public double getMaxKeywordDensity() { return maxKeywordDensity; }
        public void setMaxKeywordDensity(double maxKeywordDensity) { this.maxKeywordDensity = maxKeywordDensity; }
        public double getTargetKeywordDensity() { return targetKeywordDensity; }
        public void setTargetKeywordDensity(double targetKeywordDensity) { this.targetKeywordDensity = targetKeywordDensity; }
        public double getMaxPassiveVoice() { return maxPassiveVoice; }
        public void setMaxPassiveVoice(double maxPassiveVoice) { this.maxPassiveVoice = maxPassiveVoice; }
        public double getMaxLongSentences() { return maxLongSentences; }
        public void setMaxLongSentences(double maxLongSentences) { this.maxLongSentences = maxLongSentences; }
        public int getMaxSentenceWords() { return maxSentenceWords; }
        public void setMaxSentenceWords(int maxSentenceWords) { this.maxSentenceWords = maxSentenceWords; }
        public double getMinTransitionWords() { return minTransitionWords; }
        public void setMinTransitionWords(double minTransitionWords) { this.minTransitionWords = minTransitionWords; }
        public int getMaxTitleLength() { return maxTitleLength; }
        public void setMaxTitleLength(int maxTitleLength) { this.maxTitleLength = maxTitleLength; }
        public double getMaxSubheadingKeywordUsage() { return maxSubheadingKeywordUsage; }
        public void setMaxSubheadingKeywordUsage(double maxSubheadingKeywordUsage) { this.maxSubheadingKeywordUsage = maxSubheadingKeywordUsage; }
        public boolean isRequireImages() { return requireImages; }
        public void setRequireImages(boolean requireImages) { this.requireImages = requireImages; }
        public boolean isRequireKeywordInAltText() { return requireKeywordInAltText; }
        public void setRequireKeywordInAltText(boolean requireKeywordInAltText) { this.requireKeywordInAltText = requireKeywordInAltText; }
    }

    public static class Retry {
        private int maxRetryAttempts = 3;
        private double baseDelaySeconds = 1.0;
        private double maxDelaySeconds = 30.0;
        private double backoffMultiplier = 2.0;
        private boolean enableSmartCorrection = true;
        private boolean enablePatternLearning = true;

        public int getMaxRetryAttempts() { return maxRetryAttempts; }
        public void setMaxRetryAttempts(int maxRetryAttempts) { this.maxRetryAttempts = maxRetryAttempts; }
        public double getBaseDelaySeconds() { return baseDelaySeconds; }
        public void setBaseDelaySeconds(double baseDelaySeconds) { this.baseDelaySeconds = baseDelaySeconds; }
        public double getMaxDelaySeconds() { return maxDelaySeconds; }
        public void setMaxDelaySeconds(double maxDelaySeconds) { this.maxDelaySeconds = maxDelaySeconds; }
        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
        public boolean isEnableSmartCorrection() { return enableSmartCorrection; }
        public void setEnableSmartCorrection(boolean enableSmartCorrection) { this.enableSmartCorrection = enableSmartCorrection; }
        public boolean isEnablePatternLearning() { return enablePatternLearning; }
        public void setEnablePatternLearning(boolean enablePatternLearning) { this.enablePatternLearning = enablePatternLearning; }
    }

    public static class Cache {
        private boolean enabled = true;
        private String prefix = "seo_cache_";
        private long defaultTtlSeconds = 3600;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
        public long getDefaultTtlSeconds() { return defaultTtlSeconds; }
        public void setDefaultTtlSeconds(long defaultTtlSeconds) { this.defaultTtlSeconds = defaultTtlSeconds; }
    }

    public static class Progress {
        private int maxHistoryEntries = 10;
        private boolean enableRollback = true;
        private boolean trackStrategyEffectiveness = true;
        private boolean detailedReporting = true;

        public int getMaxHistoryEntries() { return maxHistoryEntries; }
        public void setMaxHistoryEntries(int maxHistoryEntries) { this.maxHistoryEntries = maxHistoryEntries; }
        public boolean isEnableRollback() { return enableRollback; }
        public void setEnableRollback(boolean enableRollback) { this.enableRollback = enableRollback; }
        public boolean isTrackStrategyEffectiveness() { return trackStrategyEffectiveness; }
        public void setTrackStrategyEffectiveness(boolean trackStrategyEffectiveness) { this.trackStrategyEffectiveness = trackStrategyEffectiveness; }
        public boolean isDetailedReporting() { return detailedReporting; }
        public void setDetailedReporting(boolean detailedReporting) { this.detailedReporting = detailedReporting; }
    }

    public static class Structure {
        private int maxSnapshots = 10;
        private boolean enableRollback = true;
        private boolean preserveStructure = true;
        private boolean preserveFormatting = true;
        private boolean preserveIntent = true;

        public int getMaxSnapshots() { return maxSnapshots; }
        public void setMaxSnapshots(int maxSnapshots) { this.maxSnapshots = maxSnapshots; }
        public boolean isEnableRollback() { return enableRollback; }
        public void setEnableRollback(boolean enableRollback) { this.enableRollback = enableRollback; }
        public boolean isPreserveStructure() { return preserveStructure; }
        public void setPreserveStructure(boolean preserveStructure) { this.preserveStructure = preserveStructure; }
        public boolean isPreserveFormatting() { return preserveFormatting; }
        public void setPreserveFormatting(boolean preserveFormatting) { this.preserveFormatting = preserveFormatting; }
        public boolean isPreserveIntent() { return preserveIntent; }
        public void setPreserveIntent(boolean preserveIntent) { this.preserveIntent = preserveIntent; }
    }

    public static class Errors {
        /** Keep at most this many entries in the in-memory failure log */
        private int maxLogEntries = 500;
        /** Persist per-error statistics every N occurrences */
        private int persistEvery = 10;
        /** Occurrences of one error before an adaptive rule is suggested */
        private int adaptiveRuleThreshold = 10;
        private boolean autoApplyAdaptiveRules = false;

        public int getMaxLogEntries() { return maxLogEntries; }
        public void setMaxLogEntries(int maxLogEntries) { this.maxLogEntries = maxLogEntries; }
        public int getPersistEvery() { return persistEvery; }
        public void setPersistEvery(int persistEvery) { this.persistEvery = persistEvery; }
        public int getAdaptiveRuleThreshold() { return adaptiveRuleThreshold; }
        public void setAdaptiveRuleThreshold(int adaptiveRuleThreshold) { this.adaptiveRuleThreshold = adaptiveRuleThreshold; }
        public boolean isAutoApplyAdaptiveRules() { return autoApplyAdaptiveRules; }
        public void setAutoApplyAdaptiveRules(boolean autoApplyAdaptiveRules) { this.autoApplyAdaptiveRules = autoApplyAdaptiveRules; }
    }

    public int getMaxIterations() { return maxIterations; }
    public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
    public double getTargetComplianceScore() { return targetComplianceScore; }
    public void setTargetComplianceScore(double targetComplianceScore) { this.targetComplianceScore = targetComplianceScore; }
    public boolean isEnableEarlyTermination() { return enableEarlyTermination; }
    public void setEnableEarlyTermination(boolean enableEarlyTermination) { this.enableEarlyTermination = enableEarlyTermination; }
    public int getStagnationThreshold() { return stagnationThreshold; }
    public void setStagnationThreshold(int stagnationThreshold) { this.stagnationThreshold = stagnationThreshold; }
    public double getMinImprovementThreshold() { return minImprovementThreshold; }
    public void setMinImprovementThreshold(double minImprovementThreshold) { this.minImprovementThreshold = minImprovementThreshold; }
    public List<String> getPriorityOrder() { return priorityOrder; }
    public void setPriorityOrder(List<String> priorityOrder) { this.priorityOrder = priorityOrder; }
    public boolean isAutoCorrection() { return autoCorrection; }
    public void setAutoCorrection(boolean autoCorrection) { this.autoCorrection = autoCorrection; }
    public boolean isEscalateOnStagnation() { return escalateOnStagnation; }
    public void setEscalateOnStagnation(boolean escalateOnStagnation) { this.escalateOnStagnation = escalateOnStagnation; }
    public long getRandomSeed() { return randomSeed; }
    public void setRandomSeed(long randomSeed) { this.randomSeed = randomSeed; }
    public Thresholds getThresholds() { return thresholds; }
    public void setThresholds(Thresholds thresholds) { this.thresholds = thresholds; }
    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }
    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }
    public Progress getProgress() { return progress; }
    public void setProgress(Progress progress) { this.progress = progress; }
    public Structure getStructure() { return structure; }
    public void setStructure(Structure structure) { this.structure = structure; }
    public Errors getErrors() { return errors; }
    public void setErrors(Errors errors) { this.errors = errors; }
}
