package com.csd.repocleaner.service;

import com.csd.repocleaner.model.Rule;
import com.csd.repocleaner.model.Verdict;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides keep or delete for every member of one sorted retention group.
 *
 * <p>Checks run in a fixed order and the first that applies wins:
 * <ol>
 *   <li>reserved slot: position {@code i < reserved}</li>
 *   <li>retention window: age in days {@code <= retentionDays}</li>
 *   <li>recent download: days since last download {@code <= minDaysSinceLastDownload}</li>
 * </ol>
 * Anything left is deleted, with a reason listing every configured threshold it failed.
 * A no-match group whose fallback has no field set is kept entirely.
 */
public final class RetentionEvaluator {

    public static final String UNCONFIGURED_FALLBACK_REASON = "no fallback rule configured — kept by default";

    private RetentionEvaluator() {}

    public static List<Verdict> evaluateGroup(List<RetentionCandidate> sortedGroup, Instant now) {
        List<Verdict> verdicts = new ArrayList<>(sortedGroup.size());
        if (sortedGroup.isEmpty()) return verdicts;

        Rule rule = sortedGroup.get(0).getMatchedRule().getRule();
        boolean keepAll = sortedGroup.get(0).getMatchedRule().isNoMatch() && rule.isEmpty();

        for (int i = 0; i < sortedGroup.size(); i++) {
            RetentionCandidate c = sortedGroup.get(i);
            Verdict.VerdictBuilder verdict = baseVerdict(c, i, now);
            if (keepAll) {
                verdicts.add(verdict.willDelete(false).reason(UNCONFIGURED_FALLBACK_REASON).build());
                continue;
            }
            verdicts.add(decide(verdict, c, rule, i, now));
        }
        return verdicts;
    }

    private static Verdict decide(Verdict.VerdictBuilder verdict, RetentionCandidate c, Rule rule, int i, Instant now) {
        Integer reserved = rule.getReserved();
        Integer retentionDays = rule.getRetentionDays();
        Integer minDays = rule.getMinDaysSinceLastDownload();
        long age = TimestampExtractor.wholeDaysBetween(c.getLastModified(), now);
        Long sinceDownload = c.getLastDownload() == null
                ? null
                : TimestampExtractor.wholeDaysBetween(c.getLastDownload(), now);

        if (reserved != null && i < reserved) {
            return verdict.willDelete(false)
                    .reason(String.format("reserved (position %d/%d)", i + 1, reserved))
                    .build();
        }
        if (retentionDays != null && age <= retentionDays) {
            return verdict.willDelete(false)
                    .reason(String.format("within retention window (age %d days <= %d)", age, retentionDays))
                    .build();
        }
        if (sinceDownload != null && minDays != null && sinceDownload <= minDays) {
            return verdict.willDelete(false)
                    .reason(String.format("recently downloaded (%d days ago <= %d)", sinceDownload, minDays))
                    .build();
        }

        List<String> failures = new ArrayList<>();
        if (reserved != null) {
            failures.add(String.format("not in reserved range (position %d > reserved %d)", i + 1, reserved));
        }
        if (retentionDays != null) {
            failures.add(String.format("age %d days > retention %d days", age, retentionDays));
        }
        if (minDays != null) {
            if (sinceDownload != null) {
                failures.add(String.format("last downloaded %d days ago > min %d days", sinceDownload, minDays));
            } else {
                failures.add(String.format("never downloaded (min_days_since_last_download %d)", minDays));
            }
        }
        String reason = failures.isEmpty()
                ? "rule '" + c.getMatchedRule().getPattern() + "' has no keep condition"
                : String.join("; ", failures);
        return verdict.willDelete(true).reason(reason).build();
    }

    private static Verdict.VerdictBuilder baseVerdict(RetentionCandidate c, int i, Instant now) {
        return Verdict.builder()
                .componentId(c.getComponent().getId())
                .group(c.getComponent().getGroup())
                .name(c.getComponent().getName())
                .version(c.getVersion())
                .retentionName(c.getRetentionName())
                .matchedPattern(c.getMatchedRule().getPattern())
                .mavenType(c.getMavenType())
                .position(i + 1)
                .lastModified(c.getLastModified())
                .lastDownload(c.getLastDownload())
                .ageDays(TimestampExtractor.wholeDaysBetween(c.getLastModified(), now))
                .daysSinceDownload(c.getLastDownload() == null
                        ? null
                        : TimestampExtractor.wholeDaysBetween(c.getLastDownload(), now));
    }
}
