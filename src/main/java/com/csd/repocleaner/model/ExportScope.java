package com.csd.repocleaner.model;

public enum ExportScope {
    PER_REPO,   // One sheet per repository
    COMBINED    // Single sheet for all repositories
}
