package com.csd.repocleaner.service;

import com.csd.repocleaner.exception.InvalidRuleException;
import com.csd.repocleaner.exception.NexusApiException;
import com.csd.repocleaner.model.Asset;
import com.csd.repocleaner.model.CleanupConfig;
import com.csd.repocleaner.model.CleanupReport;
import com.csd.repocleaner.model.Component;
import com.csd.repocleaner.model.DeletionOutcome;
import com.csd.repocleaner.model.EvaluationResult;
import com.csd.repocleaner.model.LoadedConfig;
import com.csd.repocleaner.model.RepositoryFormat;
import com.csd.repocleaner.model.RepositoryStatus;
import com.csd.repocleaner.model.Verdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Runs cleanup for every repository named in the rule files: detects the repository format,
 * lists its content, evaluates retention and deletes what the evaluation marks.
 * A failing repository is reported and the run moves on to the next one.
 */
@Slf4j
@Service
public class CleanupService {

    private final NexusApiClient nexusApiClient;
    private final RetentionService retentionService;
    private final CleanupConfigLoader configLoader;
    private final Clock clock;

    private final Map<String, CleanupReport> lastReports = new ConcurrentHashMap<>();

    public CleanupService(NexusApiClient nexusApiClient, RetentionService retentionService,
                          CleanupConfigLoader configLoader, Clock clock) {
        this.nexusApiClient = nexusApiClient;
        this.retentionService = retentionService;
        this.configLoader = configLoader;
        this.clock = clock;
    }

    public List<CleanupReport> runAll() {
        List<LoadedConfig> configs = configLoader.loadAll();
        if (configs.isEmpty()) {
            log.warn("No YAML rule files found, nothing to clean");
            return List.of();
        }
        List<CleanupReport> reports = new ArrayList<>();
        for (LoadedConfig loaded : configs) {
            log.info("Processing config file: {}", loaded.getSource());
            List<String> repos = loaded.getConfig().getRepoNames();
            if (repos == null) continue;
            for (String repo : repos) {
                if (repo == null || repo.isBlank()) {
                    log.warn("Skipping blank repository name in {}", loaded.getSource());
                    continue;
                }
                reports.add(clearRepository(repo, loaded.getConfig()));
            }
        }
        return reports;
    }

    public CleanupReport clearRepository(String repository, CleanupConfig config) {
        log.info("=== Starting cleanup of repository: {} ===", repository);
        CleanupReport report;
        try {
            report = doClear(repository, config);
        } catch (NexusApiException | InvalidRuleException e) {
            log.error("Cleanup of '{}' failed: {}", repository, e.getMessage());
            report = report(repository, null, config, RepositoryStatus.FAILED, e.getMessage()).build();
        }
        lastReports.put(repository, report);
        return report;
    }

    public List<CleanupReport> getLastReports() {
        return lastReports.values().stream()
                .sorted(Comparator.comparing(CleanupReport::getRepository))
                .collect(Collectors.toList());
    }

    private CleanupReport doClear(String repository, CleanupConfig config) {
        Optional<String> rawFormat = nexusApiClient.getRepositoryFormat(repository);
        if (rawFormat.isEmpty()) {
            log.warn("Skipping repository '{}': unknown format", repository);
            return report(repository, null, config, RepositoryStatus.SKIPPED, "unknown format").build();
        }
        Optional<RepositoryFormat> format = RepositoryFormat.fromValue(rawFormat.get());
        if (format.isEmpty()) {
            log.warn("Skipping repository '{}': unsupported format '{}'", repository, rawFormat.get());
            return report(repository, rawFormat.get(), config, RepositoryStatus.SKIPPED,
                    "unsupported format " + rawFormat.get()).build();
        }

        EvaluationResult result;
        switch (format.get()) {
            case RAW -> {
                List<Asset> assets = nexusApiClient.listAssets(repository);
                if (assets.isEmpty()) return empty(repository, rawFormat.get(), config);
                result = retentionService.evaluate(RawComponentConverter.fromAssets(assets), config.toRuleSet());
            }
            case MAVEN2 -> {
                List<Component> components = nexusApiClient.listComponents(repository);
                if (components.isEmpty()) return empty(repository, rawFormat.get(), config);
                result = retentionService.evaluateMaven(components, config.getMavenRules());
            }
            default -> {
                List<Component> components = nexusApiClient.listComponents(repository);
                if (components.isEmpty()) return empty(repository, rawFormat.get(), config);
                result = retentionService.evaluate(components, config.toRuleSet());
            }
        }

        if (result.getDeleted().isEmpty()) {
            log.info("No components to delete in '{}'", repository);
            return report(repository, rawFormat.get(), config, RepositoryStatus.NOTHING_TO_DELETE, "nothing to delete")
                    .evaluation(result)
                    .build();
        }

        log.info("Deleting {} component(s) from '{}'{}", result.getDeleted().size(), repository,
                config.isDryRun() ? " (dry run)" : "");
        Map<DeletionOutcome, Long> outcomes = new EnumMap<>(DeletionOutcome.class);
        boolean useAsset = format.get() == RepositoryFormat.RAW;
        for (Verdict verdict : result.getDeleted()) {
            DeletionOutcome outcome = nexusApiClient.delete(verdict.getComponentId(), label(verdict), useAsset, config.isDryRun());
            outcomes.merge(outcome, 1L, Long::sum);
        }
        return report(repository, rawFormat.get(), config, RepositoryStatus.CLEANED,
                result.getDeleted().size() + " component(s) marked for deletion")
                .evaluation(result)
                .deletions(outcomes)
                .build();
    }

    private CleanupReport empty(String repository, String format, CleanupConfig config) {
        log.info("Repository '{}' is empty", repository);
        return report(repository, format, config, RepositoryStatus.EMPTY, "repository is empty").build();
    }

    private CleanupReport.CleanupReportBuilder report(String repository, String format, CleanupConfig config,
                                                      RepositoryStatus status, String message) {
        return CleanupReport.builder()
                .repository(repository)
                .format(format)
                .status(status)
                .dryRun(config != null && config.isDryRun())
                .message(message)
                .finishedAt(clock.instant());
    }

    private static String label(Verdict verdict) {
        String name = verdict.getGroup() != null && !verdict.getGroup().isEmpty()
                ? verdict.getGroup() + ":" + verdict.getName()
                : verdict.getName();
        return name + ":" + verdict.getVersion();
    }
}
