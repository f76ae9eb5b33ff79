package com.irondust.seo.service.structure;

import com.irondust.seo.Fixtures;
import com.irondust.seo.MutableClock;
import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.Content;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class HtmlStructurePreserverTest {

    private final OptimizerProperties.Structure config = new OptimizerProperties.Structure();
    private final MutableClock clock = new MutableClock();

    private HtmlStructurePreserver preserver() {
        return new HtmlStructurePreserver(config, clock);
    }

    @Test
    public void analyzeStructure_countsElements() {
        StructureAnalysis a = preserver().analyzeStructure(Fixtures.compliantContent());
        assertEquals(3, a.headingCount);
        assertEquals(3, a.paragraphCount);
        assertEquals(0, a.imageCount);
        assertEquals(3, a.tags.get("h2").intValue());
        assertEquals(Fixtures.TITLE.length(), a.titleLength);
    }

    @Test
    public void removedHeading_isRolledBack() {
        Content original = Fixtures.compliantContent();
        Content optimized = original.copy();
        optimized.setBody(Fixtures.BODY.replace("<h2>Choosing the right type</h2>", ""));

        PreservationResult r = preserver().preserveContent(original, optimized);

        assertTrue(r.rolledBack);
        assertFalse(r.success);
        assertEquals(Fixtures.BODY, r.content.getBody());
        assertTrue(r.validation.hasMajorViolation());
        assertEquals("structure_heading_count_changed", r.validation.violations.get(0).type);
        assertFalse(r.validation.structurePreserved);
    }

    @Test
    public void reworkedSentence_isKept() {
        Content original = Fixtures.compliantContent();
        Content optimized = original.copy();
        optimized.setBody(Fixtures.BODY.replace("Check the label for added sugar and fillers.",
                "Check the protein powder label for added sugar and fillers."));

        PreservationResult r = preserver().preserveContent(original, optimized);

        assertTrue(r.success);
        assertFalse(r.rolledBack);
        assertEquals(optimized.getBody(), r.content.getBody());
        assertTrue(r.validation.violations.isEmpty());
        assertTrue(r.validation.warnings.isEmpty());
        assertNotEquals(r.validation.originalChecksum, r.validation.modifiedChecksum);
    }

    @Test
    public void extraParagraph_isMinorFormattingViolation() {
        Content original = Fixtures.compliantContent();
        Content optimized = original.copy();
        optimized.setBody(Fixtures.BODY + "<p>Enjoy your shake.</p>");

        PreservationResult r = preserver().preserveContent(original, optimized);

        assertFalse(r.rolledBack);
        assertFalse(r.success);
        assertFalse(r.validation.formattingPreserved);
        assertTrue(r.validation.structurePreserved);
        StructureViolation v = r.validation.violations.get(0);
        assertEquals("formatting_paragraph_count_changed", v.type);
        assertEquals(StructureViolation.MINOR, v.severity);
        assertEquals(33.33, v.change.doubleValue(), 0.001);
    }

    @Test
    public void rewrittenTitle_raisesIntentWarning() {
        Content original = Fixtures.compliantContent();
        Content optimized = original.copy();
        optimized.setTitle("Ten Breakfast Ideas");

        IntegrityReport r = preserver().validateIntegrity(original, optimized);

        assertTrue(r.valid);
        assertFalse(r.intentPreserved);
        assertEquals("intent_title_changed_significantly", r.warnings.get(0).type);
        assertEquals(StructureViolation.WARNING, r.warnings.get(0).severity);
    }

    @Test
    public void rollbackDisabled_keepsOptimizedVersion() {
        config.setEnableRollback(false);
        Content original = Fixtures.compliantContent();
        Content optimized = original.copy();
        optimized.setBody("<p>Only one paragraph left.</p>");

        PreservationResult r = preserver().preserveContent(original, optimized);

        assertFalse(r.rolledBack);
        assertFalse(r.success);
        assertEquals("<p>Only one paragraph left.</p>", r.content.getBody());
    }

    @Test
    public void checksum_ignoresWhitespaceBetweenTags() {
        HtmlStructurePreserver p = preserver();
        Content a = Fixtures.compliantContent();
        Content b = a.copy();
        b.setBody(Fixtures.BODY.replace("</h2><p>", "</h2>\n    <p>"));

        String checksum = p.generateChecksum(a);
        assertEquals(64, checksum.length());
        assertEquals(checksum, p.generateChecksum(b));
        assertFalse(p.detectCorruption(b, checksum));

        b.setMetaDescription("Tampered");
        assertTrue(p.detectCorruption(b, checksum));
    }

    @Test
    public void snapshots_areBounded() {
        config.setMaxSnapshots(2);
        HtmlStructurePreserver p = preserver();
        String first = p.createSnapshot(Fixtures.compliantContent(), "first");
        p.createSnapshot(Fixtures.compliantContent(), "second");
        String third = p.createSnapshot(Fixtures.compliantContent(), "third");

        assertEquals(2, p.getSnapshots().size());
        assertTrue(p.rollback(first).isEmpty());
        ContentSnapshot s = p.rollback(third).orElseThrow();
        assertEquals("third", s.getLabel());
        assertEquals(Fixtures.TITLE, s.getContent().getTitle());
        assertEquals(clock.instant().toString(), s.getTimestamp());
    }
}
