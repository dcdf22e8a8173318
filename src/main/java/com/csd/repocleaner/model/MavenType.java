package com.csd.repocleaner.model;

public enum MavenType {
    SNAPSHOT,
    RELEASE;

    public String label() {
        return name().toLowerCase();
    }
}
