package com.irondust.seo.service.cache;

public class CacheStats {
    private long hits;
    private long misses;
    private long sets;
    private double hitRate;
    private int memoryCacheSize;
    private boolean enabled;

    public CacheStats() {}

    public CacheStats(long hits, long misses, long sets, int memoryCacheSize, boolean enabled) {
        this.hits = hits;
        this.misses = misses;
        this.sets = sets;
        long total = hits + misses;
        this.hitRate = total > 0 ? Math.round((double) hits / total * 10000.0) / 100.0 : 0.0;
        this.memoryCacheSize = memoryCacheSize;
        this.enabled = enabled;
    }

    public long getHits() { return hits; }
    public long getMisses() { return misses; }
    public long getSets() { return sets; }
    /** Percentage 0-100, two decimals */
    public double getHitRate() { return hitRate; }
    public int getMemoryCacheSize() { return memoryCacheSize; }
    public boolean isEnabled() { return enabled; }
}
