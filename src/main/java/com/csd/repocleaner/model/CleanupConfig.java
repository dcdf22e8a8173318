package com.csd.repocleaner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One rule file: the repositories it applies to plus their rules. Raw and docker
 * repositories use the top-level rules, maven2 repositories use {@code mavenRules}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CleanupConfig {
    @Builder.Default
    private List<String> repoNames = new ArrayList<>();
    private boolean dryRun;
    @Builder.Default
    private Map<String, Rule> regexRules = new LinkedHashMap<>();
    private Integer noMatchRetentionDays;
    private Integer noMatchReserved;
    private Integer noMatchMinDaysSinceLastDownload;
    private MavenRuleConfig mavenRules;

    public RuleSet toRuleSet() {
        return RuleSet.builder()
                .regexRules(regexRules == null ? new LinkedHashMap<>() : regexRules)
                .noMatchRetentionDays(noMatchRetentionDays)
                .noMatchReserved(noMatchReserved)
                .noMatchMinDaysSinceLastDownload(noMatchMinDaysSinceLastDownload)
                .build();
    }
}
