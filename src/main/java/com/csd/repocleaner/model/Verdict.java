package com.csd.repocleaner.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class Verdict {
    private String componentId;
    private String group;
    private String name;
    private String version;
    private String retentionName;  // folder path for raw, group:artifact for maven
    private String matchedPattern; // regex, "no-match" or "latest"
    private MavenType mavenType;   // null outside maven2
    private Integer position;      // 1-based rank inside the retention group
    private Instant lastModified;
    private Instant lastDownload;
    private Long ageDays;
    private Long daysSinceDownload;
    private boolean willDelete;
    private String reason;
}
