package com.csd.repocleaner.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
public class CleanupReport {
    private String repository;
    private String format;
    private RepositoryStatus status;
    private boolean dryRun;
    private String message;
    private Instant finishedAt;
    private EvaluationResult evaluation;           // null unless the repository was evaluated
    private Map<DeletionOutcome, Long> deletions;  // outcome counts for the delete list
}
