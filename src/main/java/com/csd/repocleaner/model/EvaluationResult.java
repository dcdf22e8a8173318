package com.csd.repocleaner.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class EvaluationResult {
    private Instant evaluatedAt;
    private List<Verdict> kept;
    private List<Verdict> deleted;
    private List<SkippedComponent> skipped;
}
