package com.irondust.seo.service.structure;

import com.irondust.seo.model.Content;

public final class ContentSnapshot {
    private final String id;
    private final String label;
    private final Content content;
    private final StructureAnalysis structure;
    private final String checksum;
    private final String timestamp;

    public ContentSnapshot(String id, String label, Content content, StructureAnalysis structure,
                           String checksum, String timestamp) {
        this.id = id;
        this.label = label;
        this.content = content.copy();
        this.structure = structure;
        this.checksum = checksum;
        this.timestamp = timestamp;
    }

    public String getId() { return id; }
    public String getLabel() { return label; }
    public Content getContent() { return content.copy(); }
    public StructureAnalysis getStructure() { return structure; }
    public String getChecksum() { return checksum; }
    public String getTimestamp() { return timestamp; }
}
