package com.irondust.seo.service.tracking;

import com.irondust.seo.config.OptimizerProperties;
import com.irondust.seo.model.Content;
import com.irondust.seo.model.CorrectionPrompt;
import com.irondust.seo.model.Issue;
import com.irondust.seo.model.PassImprovements;
import com.irondust.seo.model.PassRecord;
import com.irondust.seo.model.Snapshot;
import com.irondust.seo.model.StrategyDescriptor;
import com.irondust.seo.model.StrategyMetrics;
import com.irondust.seo.model.TerminationReason;
import com.irondust.seo.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Append-only audit of an optimization session: one {@link PassRecord} per
 * pass, per-strategy effectiveness and a bounded ring of content snapshots
 * used for rollback. The pass-0 snapshot (the session input) is never evicted.
 *
 * <p>Not thread-safe; the optimizer creates one per session.
 */
public class ProgressTracker {
    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    static final String STAGE_INITIAL = "initial";
    static final String STAGE_PASS_COMPLETE = "pass_complete";

    private final OptimizerProperties.Progress config;
    private final Clock clock;

    private final List<PassRecord> passRecords = new ArrayList<>();
    private final List<Snapshot> contentHistory = new ArrayList<>();
    private final Map<String, StrategyMetrics> strategyMetrics = new LinkedHashMap<>();

    private String sessionId;
    private Instant startedAt;
    private Instant endedAt;
    private Instant lastMark;
    private double initialScore;
    private int initialIssueCount;
    private double finalScore;
    private int totalCorrections;
    private int totalIssuesResolved;
    private boolean complianceAchieved;
    private TerminationReason terminationReason;

    public ProgressTracker(OptimizerProperties.Progress config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Resets all state and stores the input as the pass-0 snapshot.
     *
     * @return the new session id
     */
    public String startSession(Content initialContent, double initialScore, List<Issue> initialIssues) {
        passRecords.clear();
        contentHistory.clear();
        strategyMetrics.clear();
        sessionId = "opt_" + UUID.randomUUID();
        startedAt = clock.instant();
        lastMark = startedAt;
        endedAt = null;
        this.initialScore = initialScore;
        this.finalScore = initialScore;
        this.initialIssueCount = initialIssues != null ? initialIssues.size() : 0;
        totalCorrections = 0;
        totalIssuesResolved = 0;
        complianceAchieved = false;
        terminationReason = null;
        addContentToHistory(initialContent, 0, initialScore, STAGE_INITIAL);
        log.info("Started optimization session {} (score {}, {} issues)", sessionId, initialScore, initialIssueCount);
        return sessionId;
    }

    /**
     * Appends the record for one pass.
     *
     * @throws IllegalStateException when no session is open or {@code passNumber}
     *                               is not the next consecutive pass
     */
    public PassRecord recordPass(int passNumber, Content beforeContent, Content afterContent,
                                 double beforeScore, double afterScore,
                                 List<Issue> issuesBefore, List<Issue> issuesAfter,
                                 List<CorrectionPrompt> corrections, StrategyDescriptor strategyUsed) {
        if (sessionId == null) {
            throw new IllegalStateException("No optimization session started");
        }
        if (passNumber != passRecords.size() + 1) {
            throw new IllegalStateException("Expected pass " + (passRecords.size() + 1) + " but got " + passNumber);
        }
        Instant now = clock.instant();
        long duration = now.toEpochMilli() - lastMark.toEpochMilli();
        lastMark = now;

        List<Issue> before = issuesBefore != null ? issuesBefore : List.of();
        List<Issue> after = issuesAfter != null ? issuesAfter : List.of();
        List<CorrectionPrompt> applied = corrections != null ? corrections : List.of();
        PassRecord record = new PassRecord(passNumber, now.toString(), beforeScore, afterScore,
                before, after, applied, strategyUsed, calculatePassImprovements(before, after, applied), duration);

        if (config.isTrackStrategyEffectiveness() && strategyUsed != null) {
            strategyMetrics.computeIfAbsent(strategyUsed.getName(), StrategyMetrics::new)
                    .record(record.getScoreImprovement(), record.getIssuesResolved());
        }
        if (afterContent != null) {
            addContentToHistory(afterContent, passNumber, afterScore, STAGE_PASS_COMPLETE);
        }
        passRecords.add(record);
        finalScore = afterScore;
        totalCorrections += applied.size();
        totalIssuesResolved += record.getIssuesResolved();
        return record;
    }

    static PassImprovements calculatePassImprovements(List<Issue> issuesBefore, List<Issue> issuesAfter,
                                                      List<CorrectionPrompt> corrections) {
        Set<String> before = typeCodes(issuesBefore);
        Set<String> after = typeCodes(issuesAfter);
        List<String> resolved = new ArrayList<>();
        List<String> persistent = new ArrayList<>();
        List<String> added = new ArrayList<>();
        for (String t : before) {
            if (after.contains(t)) persistent.add(t);
            else resolved.add(t);
        }
        for (String t : after) {
            if (!before.contains(t)) added.add(t);
        }
        Map<String, Integer> byType = new LinkedHashMap<>();
        for (CorrectionPrompt c : corrections) {
            String type = c != null && c.getType() != null ? c.getType() : "unknown";
            byType.merge(type, 1, Integer::sum);
        }
        double effectiveness = corrections.isEmpty() ? 0.0 : (double) resolved.size() / corrections.size();
        return new PassImprovements(resolved, added, persistent, byType, effectiveness);
    }

    private static Set<String> typeCodes(List<Issue> issues) {
        Set<String> out = new LinkedHashSet<>();
        for (Issue i : issues) {
            if (i != null && i.getType() != null) out.add(i.getType().code());
        }
        return out;
    }

    private void addContentToHistory(Content content, int passNumber, double score, String stage) {
        contentHistory.add(new Snapshot(passNumber, stage, clock.instant().toString(), score, content,
                contentHash(content)));
        int max = Math.max(2, config.getMaxHistoryEntries());
        while (contentHistory.size() > max) {
            // index 0 is the baseline
            contentHistory.remove(1);
        }
    }

    static String contentHash(Content c) {
        return TextUtils.md5Hex(TextUtils.nullToEmpty(c.getTitle()) + '\u0000'
                + TextUtils.nullToEmpty(c.getBody()) + '\u0000'
                + TextUtils.nullToEmpty(c.getMetaDescription()));
    }

    public SessionSummary endSession(boolean complianceAchieved, TerminationReason reason) {
        this.endedAt = clock.instant();
        this.complianceAchieved = complianceAchieved;
        this.terminationReason = reason;
        SessionSummary summary = generateSessionSummary();
        log.info("Ended optimization session {} after {} passes: {} ({} -> {})",
                sessionId, passRecords.size(), reason != null ? reason.code() : null, initialScore, finalScore);
        return summary;
    }

    private long durationMillis() {
        if (startedAt == null) return 0L;
        Instant end = endedAt != null ? endedAt : clock.instant();
        return end.toEpochMilli() - startedAt.toEpochMilli();
    }

    SessionSummary generateSessionSummary() {
        SessionSummary s = new SessionSummary();
        int passes = passRecords.size();
        s.sessionId = sessionId;
        s.startTime = startedAt != null ? startedAt.toString() : null;
        s.endTime = endedAt != null ? endedAt.toString() : null;
        s.durationMillis = durationMillis();
        s.totalPasses = passes;
        s.initialScore = initialScore;
        s.finalScore = finalScore;
        s.totalImprovement = finalScore - initialScore;
        s.complianceAchieved = complianceAchieved;
        s.terminationReason = terminationReason;
        s.totalCorrections = totalCorrections;
        s.totalIssuesResolved = totalIssuesResolved;
        s.averagePassDurationMillis = passes > 0 ? (double) s.durationMillis / passes : 0.0;
        s.improvementRate = passes > 0 ? s.totalImprovement / passes : 0.0;
        return s;
    }

    public ProgressReport generateComprehensiveReport() {
        ProgressReport r = new ProgressReport();
        r.summary = generateSessionSummary();
        r.passRecords = new ArrayList<>(passRecords);
        r.strategyEffectiveness = new LinkedHashMap<>(strategyMetrics);
        r.progressAnalysis = analyzeProgress();
        r.contentHistory = contentHistorySummary();
        if (config.isDetailedReporting()) {
            r.detailedMetrics = detailedMetrics(r.summary);
            r.beforeAfterComparison = beforeAfterComparison();
        }
        return r;
    }

    private ProgressReport.ProgressAnalysis analyzeProgress() {
        ProgressReport.ProgressAnalysis a = new ProgressReport.ProgressAnalysis();
        if (passRecords.isEmpty()) {
            a.status = "no_data";
            return a;
        }
        a.status = "available";
        a.scoreProgression = new ArrayList<>();
        a.improvementProgression = new ArrayList<>();
        a.issuesResolvedProgression = new ArrayList<>();
        PassRecord best = passRecords.get(0);
        PassRecord worst = passRecords.get(0);
        double sum = 0;
        int resolved = 0;
        double min = Double.MAX_VALUE;
        for (PassRecord p : passRecords) {
            a.scoreProgression.add(p.getAfterScore());
            a.improvementProgression.add(p.getScoreImprovement());
            a.issuesResolvedProgression.add(p.getIssuesResolved());
            sum += p.getScoreImprovement();
            resolved += p.getIssuesResolved();
            min = Math.min(min, p.getScoreImprovement());
            if (p.getScoreImprovement() > best.getScoreImprovement()) best = p;
            if (p.getScoreImprovement() < worst.getScoreImprovement()) worst = p;
        }
        a.averageImprovement = sum / passRecords.size();
        a.totalIssuesResolved = resolved;
        a.consistentImprovement = min >= 0;
        a.bestPass = ProgressReport.PassHighlight.of(best);
        a.worstPass = ProgressReport.PassHighlight.of(worst);
        return a;
    }

    private ProgressReport.ContentHistory contentHistorySummary() {
        ProgressReport.ContentHistory h = new ProgressReport.ContentHistory();
        h.totalEntries = contentHistory.size();
        for (Snapshot s : contentHistory) {
            h.entries.add(historyEntry(s));
        }
        return h;
    }

    private static ProgressReport.HistoryEntry historyEntry(Snapshot s) {
        ProgressReport.HistoryEntry e = new ProgressReport.HistoryEntry();
        e.passNumber = s.getPassNumber();
        e.stage = s.getLabel();
        e.timestamp = s.getTimestamp();
        e.score = s.getScore();
        e.contentHash = s.getContentHash();
        return e;
    }

    private ProgressReport.DetailedMetrics detailedMetrics(SessionSummary summary) {
        ProgressReport.DetailedMetrics m = new ProgressReport.DetailedMetrics();
        int passes = summary.totalPasses;
        m.totalPasses = passes;
        m.totalDurationMillis = summary.durationMillis;
        m.totalCorrections = totalCorrections;
        m.totalIssuesResolved = totalIssuesResolved;
        if (passes > 0) {
            m.averagePassDurationMillis = (double) summary.durationMillis / passes;
            m.averageCorrectionsPerPass = (double) totalCorrections / passes;
            m.averageIssuesResolvedPerPass = (double) totalIssuesResolved / passes;
            m.efficiencyScore = summary.totalImprovement / passes;
        }
        return m;
    }

    private ProgressReport.BeforeAfter beforeAfterComparison() {
        ProgressReport.BeforeAfter b = new ProgressReport.BeforeAfter();
        if (contentHistory.isEmpty()) {
            b.status = "no_data";
            return b;
        }
        Snapshot first = contentHistory.get(0);
        Snapshot last = contentHistory.get(contentHistory.size() - 1);
        b.status = "available";
        b.before = historyEntry(first);
        b.after = historyEntry(last);
        b.improvement = last.getScore() - first.getScore();
        b.improvementPercentage = first.getScore() > 0
                ? (last.getScore() - first.getScore()) / first.getScore() * 100.0 : 0.0;
        return b;
    }

    /**
     * Content as it stood after {@code passNumber}; 0 is the session input.
     *
     * @return a copy of the snapshot content, or null when rollback is disabled
     *         or the pass is no longer in the history
     */
    public Content rollbackToPass(int passNumber) {
        if (!config.isEnableRollback()) {
            return null;
        }
        for (Snapshot s : contentHistory) {
            if (s.getPassNumber() == passNumber) {
                log.warn("Rolling session {} back to pass {}", sessionId, passNumber);
                return s.getContent();
            }
        }
        return null;
    }

    public List<PassRecord> getPassRecords() {
        return Collections.unmodifiableList(passRecords);
    }

    public PassRecord getPassRecord(int passNumber) {
        return passNumber >= 1 && passNumber <= passRecords.size() ? passRecords.get(passNumber - 1) : null;
    }

    public Map<String, StrategyMetrics> getStrategyMetrics() {
        return Collections.unmodifiableMap(strategyMetrics);
    }

    public List<Snapshot> getContentHistory() {
        return Collections.unmodifiableList(contentHistory);
    }

    public String getSessionId() {
        return sessionId;
    }
}
