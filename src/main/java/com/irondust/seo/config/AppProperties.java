package com.irondust.seo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app")
public class AppProperties {
    private String adminKey;
    /**
     * Backing store for the persistent cache tier, retry statistics and error
     * statistics: "file" or "memory". Defaults to "file".
     */
    private String storeType;
    /**
     * Filesystem path of the JSON key-value store.
     * Defaults to "tmp/seo-store.json" when not set.
     */
    private String storePath;
    /** How many finished optimization sessions the registry keeps. */
    private int sessionHistorySize = 50;

    public String getAdminKey() {
        return adminKey;
    }

    public void setAdminKey(String adminKey) {
        this.adminKey = adminKey;
    }

    public String getStoreType() {
        return storeType;
    }

    public void setStoreType(String storeType) {
        this.storeType = storeType;
    }

    public String getStorePath() {
        return storePath;
    }

    public void setStorePath(String storePath) {
        this.storePath = storePath;
    }

    public int getSessionHistorySize() {
        return sessionHistorySize;
    }

    public void setSessionHistorySize(int sessionHistorySize) {
        this.sessionHistorySize = sessionHistorySize;
    }
}
