package com.csd.repocleaner.service;

import com.csd.repocleaner.model.Component;
import com.csd.repocleaner.model.EvaluationResult;
import com.csd.repocleaner.model.MavenRuleConfig;
import com.csd.repocleaner.model.MavenType;
import com.csd.repocleaner.model.RuleSet;
import com.csd.repocleaner.model.SkippedComponent;
import com.csd.repocleaner.model.Verdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Splits a repository listing into components to keep and components to delete.
 *
 * <p>Evaluation is pure: nothing is fetched, deleted or stored, and the caller's components are
 * not modified. Every call builds its own matchers and groups, so one instance can serve
 * concurrent callers.
 */
@Slf4j
@Service
public class RetentionService {

    static final String LATEST = "latest";

    private final Clock clock;

    public RetentionService(Clock clock) {
        this.clock = clock;
    }

    /**
     * Raw and docker evaluation. Raw listings must be converted with
     * {@link RawComponentConverter#fromAssets} first.
     */
    public EvaluationResult evaluate(List<Component> components, RuleSet rules) {
        return evaluate(components, rules, clock.instant());
    }

    public EvaluationResult evaluate(List<Component> components, RuleSet rules, Instant now) {
        Objects.requireNonNull(components, "components");
        Objects.requireNonNull(now, "now");
        RuleMatcher matcher = new RuleMatcher(rules);

        List<Verdict> kept = new ArrayList<>();
        List<Verdict> deleted = new ArrayList<>();
        List<SkippedComponent> skipped = new ArrayList<>();
        List<RetentionCandidate> candidates = new ArrayList<>();

        for (Component component : components) {
            Optional<RetentionCandidate> prepared = prepare(component, component == null ? null : component.getName(), skipped);
            if (prepared.isEmpty()) continue;
            RetentionCandidate candidate = prepared.get();

            if (LATEST.equalsIgnoreCase(candidate.getVersion())) {
                Verdict verdict = latestVerdict(candidate, now);
                log.info("Keep: {} | latest is never deleted", candidate.displayName());
                kept.add(verdict);
                continue;
            }
            candidate.setMatchedRule(matcher.match(candidate.getVersion()));
            candidates.add(candidate);
        }

        collect(ComponentGrouper.byNameAndPattern(candidates), now, kept, deleted);
        log.info("Found {} component(s) to delete, {} kept, {} skipped", deleted.size(), kept.size(), skipped.size());
        return result(now, kept, deleted, skipped);
    }

    public EvaluationResult evaluateMaven(List<Component> components, MavenRuleConfig rules) {
        return evaluateMaven(components, rules, clock.instant());
    }

    public EvaluationResult evaluateMaven(List<Component> components, MavenRuleConfig rules, Instant now) {
        Objects.requireNonNull(components, "components");
        Objects.requireNonNull(now, "now");
        MavenRuleConfig config = rules == null ? new MavenRuleConfig() : rules;
        Map<MavenType, RuleMatcher> matchers = new EnumMap<>(MavenType.class);
        for (MavenType type : MavenType.values()) {
            matchers.put(type, new RuleMatcher(config.forType(type)));
        }

        List<Verdict> kept = new ArrayList<>();
        List<Verdict> deleted = new ArrayList<>();
        List<SkippedComponent> skipped = new ArrayList<>();
        List<RetentionCandidate> candidates = new ArrayList<>();

        for (Component component : components) {
            if (component != null && isBlank(component.getName())) {
                skip(component, "missing artifact name", skipped);
                continue;
            }
            String coordinates = component == null
                    ? null
                    : (component.getGroup() == null ? "" : component.getGroup()) + ":" + component.getName();
            Optional<RetentionCandidate> prepared = prepare(component, coordinates, skipped);
            if (prepared.isEmpty()) continue;
            RetentionCandidate candidate = prepared.get();

            MavenType type = MavenTypeClassifier.classify(candidate.getVersion());
            candidate.setMavenType(type);
            candidate.setMatchedRule(matchers.get(type).match(candidate.getVersion()));
            candidates.add(candidate);
        }

        collect(ComponentGrouper.forMaven(candidates), now, kept, deleted);
        log.info("Found {} maven component(s) to delete, {} kept, {} skipped", deleted.size(), kept.size(), skipped.size());
        return result(now, kept, deleted, skipped);
    }

    private Optional<RetentionCandidate> prepare(Component component, String retentionName, List<SkippedComponent> skipped) {
        if (component == null) return Optional.empty();
        if (component.getAssets() == null || component.getAssets().isEmpty()
                || isBlank(component.getVersion()) || isBlank(retentionName)) {
            skip(component, "missing name, version or assets", skipped);
            return Optional.empty();
        }
        Optional<Instant> lastModified = TimestampExtractor.lastModified(component.getAssets());
        if (lastModified.isEmpty()) {
            skip(component, "no parseable lastModified", skipped);
            return Optional.empty();
        }
        return Optional.of(RetentionCandidate.builder()
                .component(component)
                .retentionName(retentionName)
                .lastModified(lastModified.get())
                .lastDownload(TimestampExtractor.lastDownload(component.getAssets()).orElse(null))
                .build());
    }

    private void collect(Map<GroupKey, List<RetentionCandidate>> groups, Instant now,
                         List<Verdict> kept, List<Verdict> deleted) {
        groups.forEach((key, group) -> {
            List<Verdict> verdicts = RetentionEvaluator.evaluateGroup(group, now);
            for (int i = 0; i < verdicts.size(); i++) {
                Verdict verdict = verdicts.get(i);
                String name = group.get(i).displayName();
                if (verdict.isWillDelete()) {
                    log.info("Delete: {} | rule ({}) {}", name, key.label(), verdict.getReason());
                    deleted.add(verdict);
                } else {
                    log.info("Keep: {} | rule ({}) {}", name, key.label(), verdict.getReason());
                    kept.add(verdict);
                }
            }
        });
    }

    private void skip(Component component, String reason, List<SkippedComponent> skipped) {
        log.info("Skip: {}:{} (id {}) - {}", component.getName(), component.getVersion(), component.getId(), reason);
        skipped.add(SkippedComponent.builder()
                .componentId(component.getId())
                .name(component.getName())
                .version(component.getVersion())
                .reason(reason)
                .build());
    }

    private Verdict latestVerdict(RetentionCandidate c, Instant now) {
        return Verdict.builder()
                .componentId(c.getComponent().getId())
                .group(c.getComponent().getGroup())
                .name(c.getComponent().getName())
                .version(c.getVersion())
                .retentionName(c.getRetentionName())
                .matchedPattern(LATEST)
                .lastModified(c.getLastModified())
                .lastDownload(c.getLastDownload())
                .ageDays(TimestampExtractor.wholeDaysBetween(c.getLastModified(), now))
                .daysSinceDownload(c.getLastDownload() == null
                        ? null
                        : TimestampExtractor.wholeDaysBetween(c.getLastDownload(), now))
                .willDelete(false)
                .reason("version 'latest' is never deleted")
                .build();
    }

    private static EvaluationResult result(Instant now, List<Verdict> kept, List<Verdict> deleted,
                                           List<SkippedComponent> skipped) {
        return EvaluationResult.builder()
                .evaluatedAt(now)
                .kept(kept)
                .deleted(deleted)
                .skipped(skipped)
                .build();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
