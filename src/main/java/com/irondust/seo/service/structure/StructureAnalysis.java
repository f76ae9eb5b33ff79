package com.irondust.seo.service.structure;

import java.util.LinkedHashMap;
import java.util.Map;

/** Element counts of a content body, the basis of every integrity check. */
public class StructureAnalysis {
    public int titleLength;
    public int metaDescriptionLength;
    public int bodyLength;
    /** Start-tag counts by lower-case tag name */
    public Map<String, Integer> tags = new LinkedHashMap<>();
    public int headingCount;
    public int imageCount;
    public int paragraphCount;
    public int listCount;
    public int linkCount;
    public String checksum;
}
