package com.csd.repocleaner.service;

import com.csd.repocleaner.exception.InvalidRuleException;
import com.csd.repocleaner.model.Asset;
import com.csd.repocleaner.model.Component;
import com.csd.repocleaner.model.EvaluationResult;
import com.csd.repocleaner.model.Rule;
import com.csd.repocleaner.model.RuleSet;
import com.csd.repocleaner.model.Verdict;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.csd.repocleaner.service.ComponentFixtures.NOW;
import static com.csd.repocleaner.service.ComponentFixtures.component;
import static org.junit.jupiter.api.Assertions.*;

public class RetentionServiceTest {

    private final RetentionService service = new RetentionService(Clock.fixed(NOW, ZoneOffset.UTC));

    private static RuleSet rules(String pattern, Rule rule) {
        Map<String, Rule> regex = new LinkedHashMap<>();
        regex.put(pattern, rule);
        return RuleSet.builder().regexRules(regex).build();
    }

    private static List<String> versions(List<Verdict> verdicts) {
        return verdicts.stream().map(Verdict::getVersion).collect(Collectors.toList());
    }

    @Test
    void onlyNewestDevBuildIsReserved() {
        RuleSet rules = rules("^dev-", Rule.builder().retentionDays(7).reserved(1).minDaysSinceLastDownload(3).build());
        List<Component> components = List.of(
                component("pkg", "dev-1", 10, 5),
                component("pkg", "dev-2", 1, 0));

        EvaluationResult result = service.evaluate(components, rules);

        assertEquals(List.of("dev-1"), versions(result.getDeleted()));
        assertEquals(List.of("dev-2"), versions(result.getKept()));
        assertEquals("reserved (position 1/1)", result.getKept().get(0).getReason());

        String reason = result.getDeleted().get(0).getReason();
        assertTrue(reason.contains("not in reserved range (position 2 > reserved 1)"), reason);
        assertTrue(reason.contains("age 10 days > retention 7 days"), reason);
        assertTrue(reason.contains("last downloaded 5 days ago > min 3 days"), reason);
        assertEquals(NOW, result.getEvaluatedAt());
    }

    @Test
    void rawAssetsKeepNewestFile() {
        List<Asset> assets = List.of(
                Asset.builder().id("1").path("a/b/file1.zip").lastModified("2024-01-01T00:00:00Z").build(),
                Asset.builder().id("2").path("a/b/file2.zip").lastModified("2024-02-01T00:00:00Z").build());

        EvaluationResult result = service.evaluate(RawComponentConverter.fromAssets(assets),
                rules(".*", Rule.builder().reserved(1).build()));

        assertEquals(List.of("file1.zip"), versions(result.getDeleted()));
        assertEquals("1", result.getDeleted().get(0).getComponentId());
        assertEquals("a/b", result.getDeleted().get(0).getRetentionName());
        assertEquals(List.of("file2.zip"), versions(result.getKept()));
    }

    @Test
    void retentionWindowIsInclusive() {
        RuleSet rules = rules(".*", Rule.builder().retentionDays(7).build());
        EvaluationResult result = service.evaluate(List.of(
                component("app", "1.0", 7),
                component("app", "0.9", 8)), rules);

        assertEquals(List.of("1.0"), versions(result.getKept()));
        assertEquals("within retention window (age 7 days <= 7)", result.getKept().get(0).getReason());
        assertEquals(List.of("0.9"), versions(result.getDeleted()));
    }

    @Test
    void downloadWindowIsInclusive() {
        RuleSet rules = rules(".*", Rule.builder().minDaysSinceLastDownload(3).build());
        EvaluationResult result = service.evaluate(List.of(
                component("app", "3", 30, 3),
                component("app", "2", 40, 4),
                component("app", "1", 50)), rules);

        assertEquals(List.of("3"), versions(result.getKept()));
        assertEquals("recently downloaded (3 days ago <= 3)", result.getKept().get(0).getReason());
        assertEquals(List.of("2", "1"), versions(result.getDeleted()));
        assertTrue(result.getDeleted().get(1).getReason().contains("never downloaded"));
        assertNull(result.getDeleted().get(1).getDaysSinceDownload());
    }

    @Test
    void latestIsNeverDeletedAndTakesNoReservedSlot() {
        RuleSet rules = rules(".*", Rule.builder().reserved(1).retentionDays(0).build());
        EvaluationResult result = service.evaluate(List.of(
                component("img", "LATEST", 100),
                component("img", "v2", 20),
                component("img", "v1", 30)), rules);

        assertEquals(List.of("LATEST", "v2"), versions(result.getKept()));
        Verdict latest = result.getKept().get(0);
        assertEquals("latest", latest.getMatchedPattern());
        assertNull(latest.getPosition());
        assertEquals("version 'latest' is never deleted", latest.getReason());
        assertEquals(1, result.getKept().get(1).getPosition());
        assertEquals(List.of("v1"), versions(result.getDeleted()));
    }

    @Test
    void unmatchedVersionsAreKeptWithoutFallback() {
        RuleSet rules = rules("^never-", Rule.builder().reserved(1).build());
        EvaluationResult result = service.evaluate(List.of(
                component("app", "1.0", 400),
                component("app", "2.0", 300)), rules);

        assertTrue(result.getDeleted().isEmpty());
        assertEquals(2, result.getKept().size());
        result.getKept().forEach(v -> {
            assertEquals("no-match", v.getMatchedPattern());
            assertEquals(RetentionEvaluator.UNCONFIGURED_FALLBACK_REASON, v.getReason());
        });
    }

    @Test
    void fallbackRuleGroupsPerName() {
        RuleSet rules = RuleSet.builder().noMatchReserved(1).build();
        EvaluationResult result = service.evaluate(List.of(
                component("web", "1", 10),
                component("web", "2", 5),
                component("api", "1", 10),
                component("api", "2", 5)), rules);

        assertEquals(2, result.getKept().size());
        assertEquals(List.of("2", "2"), versions(result.getKept()));
        assertEquals(List.of("1", "1"), versions(result.getDeleted()));
    }

    @Test
    void matchedRuleWithoutConditionsDeletes() {
        EvaluationResult result = service.evaluate(List.of(component("app", "1.0", 0)), rules(".*", new Rule()));

        assertEquals(1, result.getDeleted().size());
        assertEquals("rule '.*' has no keep condition", result.getDeleted().get(0).getReason());
    }

    @Test
    void equalTimestampsKeepInputOrder() {
        RuleSet rules = rules(".*", Rule.builder().reserved(1).build());
        EvaluationResult result = service.evaluate(List.of(
                component("app", "a", 5),
                component("app", "b", 5),
                component("app", "c", 5)), rules);

        assertEquals(List.of("a"), versions(result.getKept()));
        assertEquals(List.of("b", "c"), versions(result.getDeleted()));
        assertEquals(2, result.getDeleted().get(0).getPosition());
        assertEquals(3, result.getDeleted().get(1).getPosition());
    }

    @Test
    void reservedKeepsExactlyTheNewest() {
        List<Component> components = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            components.add(component("app", "v" + i, 100 - i));
        }
        for (int n = 0; n <= 6; n++) {
            EvaluationResult result = service.evaluate(components, rules(".*",
                    Rule.builder().reserved(n).retentionDays(0).minDaysSinceLastDownload(0).build()));
            int expectedKept = Math.min(n, 5);
            assertEquals(expectedKept, result.getKept().size(), "reserved " + n);
            for (int k = 0; k < expectedKept; k++) {
                assertEquals("v" + (5 - k), result.getKept().get(k).getVersion());
            }
        }
    }

    @Test
    void evaluationIsRepeatable() {
        RuleSet rules = rules("^dev-", Rule.builder().retentionDays(7).reserved(1).build());
        List<Component> components = List.of(
                component("pkg", "dev-1", 10, 5),
                component("pkg", "dev-2", 1),
                component("pkg", "1.0", 3));

        assertEquals(service.evaluate(components, rules), service.evaluate(components, rules));
    }

    @Test
    void invalidPatternFailsBeforeEvaluation() {
        assertThrows(InvalidRuleException.class, () -> service.evaluate(
                List.of(component("app", "1.0", 1)), rules("[unclosed", Rule.builder().reserved(1).build())));
    }

    @Test
    void incompleteComponentsAreSkipped() {
        Component noAssets = Component.builder().id("x").name("app").version("1").assets(List.of()).build();
        Component noVersion = component("app", " ", 1);
        Component badDate = Component.builder().id("y").name("app").version("2")
                .assets(List.of(Asset.builder().lastModified("garbage").build())).build();

        EvaluationResult result = service.evaluate(List.of(noAssets, noVersion, badDate, component("app", "3", 1)),
                rules(".*", Rule.builder().reserved(5).build()));

        assertEquals(List.of("3"), versions(result.getKept()));
        assertEquals(3, result.getSkipped().size());
        assertEquals("missing name, version or assets", result.getSkipped().get(0).getReason());
        assertEquals("no parseable lastModified", result.getSkipped().get(2).getReason());
    }

    @Test
    void newestAssetDatesTheComponent() {
        Component multi = Component.builder().id("m").name("app").version("1")
                .assets(List.of(
                        Asset.builder().lastModified("garbage").build(),
                        Asset.builder().lastModified(ComponentFixtures.daysAgo(30)).build(),
                        Asset.builder().lastModified(ComponentFixtures.daysAgo(2)).build()))
                .build();

        EvaluationResult result = service.evaluate(List.of(multi), rules(".*", Rule.builder().retentionDays(5).build()));

        assertEquals(1, result.getKept().size());
        assertEquals(2L, result.getKept().get(0).getAgeDays());
    }
}
