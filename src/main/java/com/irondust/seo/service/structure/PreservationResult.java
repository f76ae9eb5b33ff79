package com.irondust.seo.service.structure;

import com.irondust.seo.model.Content;

/**
 * Outcome of {@link StructurePreserver#preserveContent}. When {@code rolledBack}
 * is set, {@code content} is the pre-pass snapshot rather than the optimized version.
 */
public class PreservationResult {
    public boolean success;
    public boolean rolledBack;
    public Content content;
    public IntegrityReport validation;
    public String snapshotId;
}
