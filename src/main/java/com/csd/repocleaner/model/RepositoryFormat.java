package com.csd.repocleaner.model;

import java.util.Arrays;
import java.util.Optional;

public enum RepositoryFormat {
    RAW("raw"),       // assets only, components synthesized from folder paths
    DOCKER("docker"),
    MAVEN2("maven2"); // snapshot and release rule sets

    private final String value;

    RepositoryFormat(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<RepositoryFormat> fromValue(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(f -> f.value.equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
