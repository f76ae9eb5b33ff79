package com.irondust.seo.service.structure;

import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.Content;
import com.irondust.seo.util.TextUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link StructurePreserver} that compares element counts of the body markup,
 * parsed with jsoup.
 *
 * <p>Major: a tag's count moves by more than one, or the heading or image
 * count changes. Minor: paragraph count moves by more than 20% or the list
 * count changes. Intent warnings: body length moves by more than 30% or the
 * title drops below 70% similarity.
 */
public class HtmlStructurePreserver implements StructurePreserver {
    private static final Logger log = LoggerFactory.getLogger(HtmlStructurePreserver.class);

    static final double PARAGRAPH_TOLERANCE = 0.2;
    static final double LENGTH_TOLERANCE = 0.3;
    static final double MIN_TITLE_SIMILARITY = 70.0;

    private final OptimizerProperties.Structure config;
    private final Clock clock;
    private final Map<String, ContentSnapshot> snapshots = new LinkedHashMap<>();

    public HtmlStructurePreserver(OptimizerProperties.Structure config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public StructureAnalysis analyzeStructure(Content content) {
        String body = TextUtils.nullToEmpty(content.getBody());
        StructureAnalysis a = new StructureAnalysis();
        a.titleLength = TextUtils.nullToEmpty(content.getTitle()).length();
        a.metaDescriptionLength = TextUtils.nullToEmpty(content.getMetaDescription()).length();
        a.bodyLength = body.length();
        Element root = Jsoup.parseBodyFragment(body).body();
        for (Element e : root.getAllElements()) {
            if (e == root) continue;
            a.tags.merge(e.normalName().toLowerCase(Locale.ROOT), 1, Integer::sum);
        }
        a.headingCount = root.select("h1, h2, h3, h4, h5, h6").size();
        a.imageCount = root.select("img").size();
        a.paragraphCount = root.select("p").size();
        a.listCount = root.select("ul, ol").size();
        a.linkCount = root.select("a").size();
        a.checksum = generateChecksum(content);
        return a;
    }

    @Override
    public String generateChecksum(Content content) {
        String normalized = TextUtils.nullToEmpty(content.getTitle()).trim() + '\u0000'
                + TextUtils.nullToEmpty(content.getMetaDescription()).trim() + '\u0000'
                + normalizeHtml(content.getBody());
        return TextUtils.sha256Hex(normalized);
    }

    static String normalizeHtml(String html) {
        return TextUtils.nullToEmpty(html).replaceAll("\\s+", " ").replaceAll(">\\s+<", "><").trim();
    }

    @Override
    public String createSnapshot(Content content, String label) {
        String id = "snapshot_" + UUID.randomUUID();
        StructureAnalysis structure = analyzeStructure(content);
        snapshots.put(id, new ContentSnapshot(id, label, content, structure, structure.checksum,
                clock.instant().toString()));
        Iterator<String> it = snapshots.keySet().iterator();
        while (snapshots.size() > Math.max(1, config.getMaxSnapshots()) && it.hasNext()) {
            it.next();
            it.remove();
        }
        log.debug("Created snapshot {} ({})", id, label);
        return id;
    }

    @Override
    public IntegrityReport validateIntegrity(Content original, Content modified) {
        StructureAnalysis before = analyzeStructure(original);
        StructureAnalysis after = analyzeStructure(modified);
        IntegrityReport r = new IntegrityReport();
        if (config.isPreserveStructure()) {
            r.violations.addAll(structureViolations(before, after));
        }
        List<StructureViolation> formatting = config.isPreserveFormatting()
                ? formattingViolations(before, after) : List.of();
        r.violations.addAll(formatting);
        if (config.isPreserveIntent()) {
            r.warnings.addAll(intentWarnings(original, modified, before, after));
        }
        r.originalChecksum = before.checksum;
        r.modifiedChecksum = after.checksum;
        r.valid = r.violations.isEmpty();
        r.structurePreserved = r.violations.isEmpty();
        r.formattingPreserved = formatting.isEmpty();
        r.intentPreserved = r.warnings.isEmpty();
        return r;
    }

    static List<StructureViolation> structureViolations(StructureAnalysis before, StructureAnalysis after) {
        List<StructureViolation> out = new ArrayList<>();
        for (Map.Entry<String, Integer> e : before.tags.entrySet()) {
            int modified = after.tags.getOrDefault(e.getKey(), 0);
            if (Math.abs(modified - e.getValue()) > 1) {
                out.add(new StructureViolation("structure_tag_count_changed", e.getKey(),
                        e.getValue(), modified, null, StructureViolation.MAJOR));
            }
        }
        if (before.headingCount != after.headingCount) {
            out.add(new StructureViolation("structure_heading_count_changed", null,
                    before.headingCount, after.headingCount, null, StructureViolation.MAJOR));
        }
        if (before.imageCount != after.imageCount) {
            out.add(new StructureViolation("structure_image_count_changed", null,
                    before.imageCount, after.imageCount, null, StructureViolation.MAJOR));
        }
        return out;
    }

    static List<StructureViolation> formattingViolations(StructureAnalysis before, StructureAnalysis after) {
        List<StructureViolation> out = new ArrayList<>();
        if (before.paragraphCount > 0) {
            double variation = (double) Math.abs(after.paragraphCount - before.paragraphCount) / before.paragraphCount;
            if (variation > PARAGRAPH_TOLERANCE) {
                out.add(new StructureViolation("formatting_paragraph_count_changed", "p",
                        before.paragraphCount, after.paragraphCount, TextUtils.round(variation * 100, 2),
                        StructureViolation.MINOR));
            }
        }
        if (before.listCount != after.listCount) {
            out.add(new StructureViolation("formatting_list_count_changed", null,
                    before.listCount, after.listCount, null, StructureViolation.MINOR));
        }
        return out;
    }

    static List<StructureViolation> intentWarnings(Content original, Content modified,
                                                   StructureAnalysis before, StructureAnalysis after) {
        List<StructureViolation> out = new ArrayList<>();
        if (before.bodyLength > 0) {
            double change = (double) Math.abs(after.bodyLength - before.bodyLength) / before.bodyLength;
            if (change > LENGTH_TOLERANCE) {
                out.add(new StructureViolation("intent_content_length_changed", null,
                        before.bodyLength, after.bodyLength, TextUtils.round(change * 100, 2),
                        StructureViolation.WARNING));
            }
        }
        String titleBefore = TextUtils.nullToEmpty(original.getTitle());
        String titleAfter = TextUtils.nullToEmpty(modified.getTitle());
        if (!titleBefore.equals(titleAfter)) {
            double similarity = TextUtils.similarityPercent(titleBefore, titleAfter);
            if (similarity < MIN_TITLE_SIMILARITY) {
                out.add(new StructureViolation("intent_title_changed_significantly", null,
                        titleBefore, titleAfter, TextUtils.round(similarity, 2), StructureViolation.WARNING));
            }
        }
        return out;
    }

    @Override
    public PreservationResult preserveContent(Content original, Content optimized) {
        String snapshotId = createSnapshot(original, "pre_optimization");
        IntegrityReport validation = validateIntegrity(original, optimized);
        PreservationResult result = new PreservationResult();
        result.validation = validation;
        result.snapshotId = snapshotId;

        if (!validation.valid && config.isEnableRollback() && validation.hasMajorViolation()) {
            Optional<ContentSnapshot> restored = rollback(snapshotId);
            if (restored.isPresent()) {
                log.warn("Major structure violations {}, rolled back to snapshot {}",
                        describe(validation.violations), snapshotId);
                result.success = false;
                result.rolledBack = true;
                result.content = restored.get().getContent();
                return result;
            }
        }
        result.success = validation.valid;
        result.rolledBack = false;
        result.content = optimized.copy();
        return result;
    }

    private static String describe(List<StructureViolation> violations) {
        List<String> types = new ArrayList<>();
        for (StructureViolation v : violations) {
            if (v.isMajor()) types.add(v.tag != null ? v.type + "(" + v.tag + ")" : v.type);
        }
        return types.toString();
    }

    @Override
    public Optional<ContentSnapshot> rollback(String snapshotId) {
        if (!config.isEnableRollback()) {
            log.warn("Rollback disabled, ignoring snapshot {}", snapshotId);
            return Optional.empty();
        }
        ContentSnapshot s = snapshots.get(snapshotId);
        if (s == null) {
            log.warn("Snapshot not found: {}", snapshotId);
        }
        return Optional.ofNullable(s);
    }

    @Override
    public boolean detectCorruption(Content content, String expectedChecksum) {
        boolean corrupted = !generateChecksum(content).equals(expectedChecksum);
        if (corrupted) {
            log.error("Content corruption detected for '{}'", content.getTitle());
        }
        return corrupted;
    }

    public List<ContentSnapshot> getSnapshots() {
        return new ArrayList<>(snapshots.values());
    }
}
