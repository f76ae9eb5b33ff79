package com.irondust.seo.service.structure;

import com.irondust.seo.model.Content;

import java.util.Optional;

/**
 * Guards the markup and intent of content while correctors rewrite it.
 */
public interface StructurePreserver {

    String createSnapshot(Content content, String label);

    /**
     * Snapshots {@code original}, checks {@code optimized} against it and falls
     * back to the snapshot when a major structural violation is found.
     */
    PreservationResult preserveContent(Content original, Content optimized);

    IntegrityReport validateIntegrity(Content original, Content modified);

    Optional<ContentSnapshot> rollback(String snapshotId);

    boolean detectCorruption(Content content, String expectedChecksum);

    String generateChecksum(Content content);
}
