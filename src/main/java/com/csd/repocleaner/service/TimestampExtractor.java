package com.csd.repocleaner.service;

import com.csd.repocleaner.model.Asset;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Effective timestamps of a component, taken over all of its assets.
 * Unparseable values count as absent for the asset they belong to.
 */
@Slf4j
public final class TimestampExtractor {

    private static final long SECONDS_PER_DAY = 86_400L;

    private TimestampExtractor() {}

    public static Optional<Instant> lastModified(List<Asset> assets) {
        return latest(assets, Asset::getLastModified);
    }

    public static Optional<Instant> lastDownload(List<Asset> assets) {
        return latest(assets, Asset::getLastDownloaded);
    }

    public static Optional<Instant> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            return Optional.of(OffsetDateTime.parse(value.trim()).toInstant());
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable timestamp '{}': {}", value, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Whole days elapsed from {@code from} to {@code to}, rounded towards negative infinity.
     */
    public static long wholeDaysBetween(Instant from, Instant to) {
        return Math.floorDiv(Duration.between(from, to).getSeconds(), SECONDS_PER_DAY);
    }

    private static Optional<Instant> latest(List<Asset> assets, Function<Asset, String> field) {
        if (assets == null) return Optional.empty();
        return assets.stream()
                .filter(Objects::nonNull)
                .map(field)
                .map(TimestampExtractor::parse)
                .flatMap(Optional::stream)
                .max(Instant::compareTo);
    }
}
