package com.csd.repocleaner.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class MatchedRule {
    public static final String NO_MATCH = "no-match";

    private String pattern;
    private Rule rule;

    public boolean isNoMatch() {
        return NO_MATCH.equals(pattern);
    }
}
