package com.csd.repocleaner.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SkippedComponent {
    private String componentId;
    private String name;
    private String version;
    private String reason;
}
