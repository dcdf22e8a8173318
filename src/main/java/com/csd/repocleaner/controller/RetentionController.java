package com.csd.repocleaner.controller;

import com.csd.repocleaner.model.Asset;
import com.csd.repocleaner.model.Component;
import com.csd.repocleaner.model.EvaluationResult;
import com.csd.repocleaner.model.MavenRuleConfig;
import com.csd.repocleaner.model.RuleSet;
import com.csd.repocleaner.service.RawComponentConverter;
import com.csd.repocleaner.service.RetentionService;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * Dry evaluation of a listing against a rule set. Nothing is fetched from or deleted in Nexus.
 */
@Slf4j
@RestController
@RequestMapping("/api/retention")
public class RetentionController {

    private final RetentionService retentionService;

    public RetentionController(RetentionService retentionService) { this.retentionService = retentionService; }

    @PostMapping("/evaluate")
    public EvaluationResult evaluate(@RequestBody EvaluateRequest request) {
        List<Component> components = orEmpty(request.getComponents());
        log.info("Evaluate request: {} component(s)", components.size());
        return request.getNow() == null
                ? retentionService.evaluate(components, request.getRules())
                : retentionService.evaluate(components, request.getRules(), request.getNow());
    }

    @PostMapping("/evaluate/raw")
    public EvaluationResult evaluateRaw(@RequestBody RawEvaluateRequest request) {
        List<Component> components = RawComponentConverter.fromAssets(orEmpty(request.getAssets()));
        log.info("Evaluate raw request: {} asset(s), {} component(s)", orEmpty(request.getAssets()).size(), components.size());
        return request.getNow() == null
                ? retentionService.evaluate(components, request.getRules())
                : retentionService.evaluate(components, request.getRules(), request.getNow());
    }

    @PostMapping("/evaluate/maven")
    public EvaluationResult evaluateMaven(@RequestBody MavenEvaluateRequest request) {
        List<Component> components = orEmpty(request.getComponents());
        log.info("Evaluate maven request: {} component(s)", components.size());
        return request.getNow() == null
                ? retentionService.evaluateMaven(components, request.getMavenRules())
                : retentionService.evaluateMaven(components, request.getMavenRules(), request.getNow());
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    @Data
    public static class EvaluateRequest {
        private List<Component> components;
        private RuleSet rules;
        private Instant now; // optional, defaults to the current time
    }

    @Data
    public static class RawEvaluateRequest {
        private List<Asset> assets;
        private RuleSet rules;
        private Instant now;
    }

    @Data
    public static class MavenEvaluateRequest {
        private List<Component> components;
        private MavenRuleConfig mavenRules;
        private Instant now;
    }
}
