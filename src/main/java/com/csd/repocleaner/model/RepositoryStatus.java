package com.csd.repocleaner.model;

public enum RepositoryStatus {
    CLEANED,
    NOTHING_TO_DELETE,
    EMPTY,
    SKIPPED,   // unknown or unsupported format
    FAILED     // Nexus or rule error, other repositories still run
}
