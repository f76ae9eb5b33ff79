package com.irondust.seo.model;

/**
 * Content as it stood after a pass. Pass 0 is the session's input and is
 * the rollback floor.
 */
public final class Snapshot {
    private final int passNumber;
    private final String label;
    private final String timestamp;
    private final double score;
    private final Content content;
    private final String contentHash;

    public Snapshot(int passNumber, String label, String timestamp, double score, Content content, String contentHash) {
        this.passNumber = passNumber;
        this.label = label;
        this.timestamp = timestamp;
        this.score = score;
        this.content = content.copy();
        this.contentHash = contentHash;
    }

    public int getPassNumber() { return passNumber; }
    public String getLabel() { return label; }
    public String getTimestamp() { return timestamp; }
    public double getScore() { return score; }
    /** Returns a copy so callers cannot alter the stored history. */
    public Content getContent() { return content.copy(); }
    public String getContentHash() { return contentHash; }
}
