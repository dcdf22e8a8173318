package com.csd.repocleaner.service;

import com.csd.repocleaner.model.MavenType;
import org.apache.maven.artifact.ArtifactUtils;

import java.util.Locale;
import java.util.regex.Pattern;

public final class MavenTypeClassifier {

    // 1.0-20250829.123456-1, anywhere after the start of the version
    private static final Pattern TIMESTAMPED_SNAPSHOT = Pattern.compile(".*-\\d{8}\\.\\d{6}-\\d+");

    private MavenTypeClassifier() {}

    public static MavenType classify(String version) {
        if (version == null || version.isBlank()) return MavenType.RELEASE;
        if (ArtifactUtils.isSnapshot(version)) return MavenType.SNAPSHOT;

        // Nexus also lists snapshot versions ArtifactUtils rejects: lower-case or mid-version
        // "snapshot", and timestamped versions followed by a classifier (1.0-20250829.123456-1-sources).

        String normalized = version.toLowerCase(Locale.ROOT);
        if (normalized.contains("snapshot")) return MavenType.SNAPSHOT;
        if (TIMESTAMPED_SNAPSHOT.matcher(normalized).lookingAt()) return MavenType.SNAPSHOT;
        return MavenType.RELEASE;
    }
}
