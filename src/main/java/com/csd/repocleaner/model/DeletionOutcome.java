package com.csd.repocleaner.model;

public enum DeletionOutcome {
    DELETED,
    DRY_RUN,    // logged only
    NOT_FOUND,  // 404, already gone
    CONFLICT,   // 409, Nexus refused
    FAILED
}
