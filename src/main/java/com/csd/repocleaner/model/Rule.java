package com.csd.repocleaner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Retention thresholds attached to one version pattern. Every field is optional;
 * a null field means the corresponding protection is not configured.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Rule {
    private Integer retentionDays;
    private Integer reserved;
    private Integer minDaysSinceLastDownload;

    public boolean isEmpty() {
        return retentionDays == null && reserved == null && minDaysSinceLastDownload == null;
    }
}
