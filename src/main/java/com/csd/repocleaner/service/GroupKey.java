package com.csd.repocleaner.service;

import com.csd.repocleaner.model.MavenType;
import lombok.Data;

/**
 * Retention group identity. {@code name} is null for the pooled maven no-match group.
 */
@Data
public class GroupKey {
    private final String name;
    private final String pattern;
    private final MavenType mavenType;

    public String label() {
        StringBuilder sb = new StringBuilder();
        sb.append(name == null ? "*" : name).append(" [").append(pattern);
        if (mavenType != null) sb.append(", ").append(mavenType.label());
        return sb.append(']').toString();
    }
}
