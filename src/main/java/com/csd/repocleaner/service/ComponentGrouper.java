package com.csd.repocleaner.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Buckets prepared components into retention groups and orders each group newest first.
 *
 * <p>Groups come back in first-encounter order. Inside a group components are sorted by
 * {@code lastModified} descending with a stable sort, so equal timestamps keep input order.
 */
public final class ComponentGrouper {

    private static final Comparator<RetentionCandidate> NEWEST_FIRST =
            Comparator.comparing(RetentionCandidate::getLastModified).reversed();

    private ComponentGrouper() {}

    /**
     * Raw and docker grouping: {@code (name, pattern)}. The no-match token groups per name
     * like any other pattern.
     */
    public static Map<GroupKey, List<RetentionCandidate>> byNameAndPattern(List<RetentionCandidate> candidates) {
        Map<GroupKey, List<RetentionCandidate>> groups = new LinkedHashMap<>();
        for (RetentionCandidate c : candidates) {
            GroupKey key = new GroupKey(c.getRetentionName(), c.getMatchedRule().getPattern(), null);
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(c);
        }
        return sortGroups(groups);
    }

    /**
     * Maven grouping: {@code (name, pattern, type)} for matched patterns. Components falling to
     * the no-match fallback are pooled across names, one pool per maven type.
     */
    public static Map<GroupKey, List<RetentionCandidate>> forMaven(List<RetentionCandidate> candidates) {
        Map<GroupKey, List<RetentionCandidate>> groups = new LinkedHashMap<>();
        for (RetentionCandidate c : candidates) {
            String pattern = c.getMatchedRule().getPattern();
            String name = c.getMatchedRule().isNoMatch() ? null : c.getRetentionName();
            GroupKey key = new GroupKey(name, pattern, c.getMavenType());
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(c);
        }
        return sortGroups(groups);
    }

    public static List<RetentionCandidate> newestFirst(List<RetentionCandidate> group) {
        List<RetentionCandidate> sorted = new ArrayList<>(group);
        sorted.sort(NEWEST_FIRST); // List.sort is stable
        return sorted;
    }

    private static Map<GroupKey, List<RetentionCandidate>> sortGroups(Map<GroupKey, List<RetentionCandidate>> groups) {
        groups.replaceAll((key, members) -> newestFirst(members));
        return groups;
    }
}
