package com.csd.repocleaner.service;

import com.csd.repocleaner.exception.InvalidRuleException;
import com.csd.repocleaner.model.MatchedRule;
import com.csd.repocleaner.model.Rule;
import com.csd.repocleaner.model.RuleSet;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Picks the rule governing a version string.
 *
 * <p>Versions are lower-cased and patterns are anchored at the start of the version only
 * ({@link java.util.regex.Matcher#lookingAt()}). When several patterns match, the longest
 * pattern string wins; patterns of equal length resolve to the one configured first.
 * Versions matching nothing get the rule set's no-match fallback.
 *
 * <p>Patterns are compiled once per instance, so an instance lives for one evaluation run.
 */
public class RuleMatcher {

    private final RuleSet ruleSet;
    private final Map<String, Pattern> patterns = new LinkedHashMap<>();

    public RuleMatcher(RuleSet ruleSet) {
        this.ruleSet = ruleSet == null ? RuleSet.empty() : ruleSet;
        Map<String, Rule> rules = this.ruleSet.getRegexRules();
        if (rules == null) return;
        for (Map.Entry<String, Rule> entry : rules.entrySet()) {
            String regex = entry.getKey();
            if (entry.getValue() == null) {
                throw new InvalidRuleException(regex, "Rule for pattern '" + regex + "' has no body", null);
            }
            try {
                patterns.put(regex, Pattern.compile(Objects.requireNonNull(regex, "pattern")));
            } catch (PatternSyntaxException e) {
                throw new InvalidRuleException(regex, "Invalid version pattern '" + regex + "': " + e.getDescription(), e);
            }
        }
    }

    public MatchedRule match(String version) {
        String normalized = version == null ? "" : version.toLowerCase(Locale.ROOT);
        String best = null;
        for (Map.Entry<String, Pattern> entry : patterns.entrySet()) {
            if (!entry.getValue().matcher(normalized).lookingAt()) continue;
            if (best == null || entry.getKey().length() > best.length()) {
                best = entry.getKey();
            }
        }
        if (best == null) {
            return MatchedRule.builder()
                    .pattern(MatchedRule.NO_MATCH)
                    .rule(ruleSet.noMatchRule())
                    .build();
        }
        return MatchedRule.builder()
                .pattern(best)
                .rule(ruleSet.getRegexRules().get(best))
                .build();
    }
}
