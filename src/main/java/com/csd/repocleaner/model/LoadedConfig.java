package com.csd.repocleaner.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LoadedConfig {
    private String source; // file the config was read from
    private CleanupConfig config;
}
