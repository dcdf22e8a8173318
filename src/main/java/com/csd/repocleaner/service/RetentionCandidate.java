package com.csd.repocleaner.service;

import com.csd.repocleaner.model.Component;
import com.csd.repocleaner.model.MatchedRule;
import com.csd.repocleaner.model.MavenType;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * A component prepared for one evaluation run: effective timestamps, retention name and
 * matched rule are computed once and never written back to the caller's {@link Component}.
 */
@Data
@Builder
public class RetentionCandidate {
    private Component component;
    private String retentionName;
    private Instant lastModified;
    private Instant lastDownload;
    private MatchedRule matchedRule;
    private MavenType mavenType;

    public String getVersion() {
        return component.getVersion();
    }

    public String displayName() {
        if (mavenType != null) {
            return retentionName + ":" + component.getVersion();
        }
        return (retentionName + "/" + component.getVersion()).replace('\\', '/');
    }
}
