package com.csd.repocleaner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MavenRuleConfig {
    private RuleSet snapshot;
    private RuleSet release;

    /** Missing sections behave as an empty rule set, which keeps everything. */
    public RuleSet forType(MavenType type) {
        RuleSet rules = type == MavenType.SNAPSHOT ? snapshot : release;
        return rules == null ? RuleSet.empty() : rules;
    }
}
