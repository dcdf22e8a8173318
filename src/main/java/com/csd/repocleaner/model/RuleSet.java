package com.csd.repocleaner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordered mapping of version regex to {@link Rule}, plus the fallback applied to versions
 * that match none of the patterns.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleSet {
    @Builder.Default
    private Map<String, Rule> regexRules = new LinkedHashMap<>();
    private Integer noMatchRetentionDays;
    private Integer noMatchReserved;
    private Integer noMatchMinDaysSinceLastDownload;

    public Rule noMatchRule() {
        return Rule.builder()
                .retentionDays(noMatchRetentionDays)
                .reserved(noMatchReserved)
                .minDaysSinceLastDownload(noMatchMinDaysSinceLastDownload)
                .build();
    }

    public static RuleSet empty() {
        return RuleSet.builder().build();
    }
}
