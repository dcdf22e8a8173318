package com.csd.repocleaner.service;

import com.csd.repocleaner.model.Asset;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class TimestampExtractorTest {

    @Test
    void latestLastModifiedAcrossAssets() {
        List<Asset> assets = List.of(
                Asset.builder().lastModified("2024-01-01T00:00:00Z").build(),
                Asset.builder().lastModified("2024-03-01T12:00:00.000+00:00").build(),
                Asset.builder().lastModified("2024-02-01T00:00:00Z").build());
        assertEquals(Instant.parse("2024-03-01T12:00:00Z"), TimestampExtractor.lastModified(assets).orElseThrow());
    }

    @Test
    void offsetsAreComparedAsInstants() {
        List<Asset> assets = List.of(
                Asset.builder().lastModified("2024-01-01T02:00:00+03:00").build(), // 2023-12-31T23:00Z
                Asset.builder().lastModified("2024-01-01T00:00:00Z").build());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), TimestampExtractor.lastModified(assets).orElseThrow());
    }

    @Test
    void unparseableValueOnlyDropsThatAsset() {
        List<Asset> assets = List.of(
                Asset.builder().lastModified("not a date").build(),
                Asset.builder().lastModified("2024-02-01T00:00:00Z").build());
        assertEquals(Instant.parse("2024-02-01T00:00:00Z"), TimestampExtractor.lastModified(assets).orElseThrow());
    }

    @Test
    void noParseableLastModifiedIsEmpty() {
        List<Asset> assets = List.of(
                Asset.builder().lastModified("yesterday").build(),
                Asset.builder().build());
        assertTrue(TimestampExtractor.lastModified(assets).isEmpty());
        assertTrue(TimestampExtractor.lastModified(List.of()).isEmpty());
        assertTrue(TimestampExtractor.lastModified(null).isEmpty());
    }

    @Test
    void lastDownloadAbsentWhenNeverDownloaded() {
        List<Asset> assets = Arrays.asList(
                Asset.builder().lastModified("2024-01-01T00:00:00Z").build(),
                null);
        assertEquals(Optional.empty(), TimestampExtractor.lastDownload(assets));
    }

    @Test
    void lastDownloadIsMaximum() {
        List<Asset> assets = List.of(
                Asset.builder().lastDownloaded("2024-05-01T00:00:00Z").build(),
                Asset.builder().lastDownloaded("2024-06-01T00:00:00Z").build());
        assertEquals(Instant.parse("2024-06-01T00:00:00Z"), TimestampExtractor.lastDownload(assets).orElseThrow());
    }

    @Test
    void timestampWithoutOffsetIsRejected() {
        assertTrue(TimestampExtractor.parse("2024-01-01T00:00:00").isEmpty());
    }

    @Test
    void wholeDaysAreFloored() {
        Instant now = Instant.parse("2025-01-10T00:00:00Z");
        assertEquals(7, TimestampExtractor.wholeDaysBetween(Instant.parse("2025-01-03T00:00:00Z"), now));
        assertEquals(6, TimestampExtractor.wholeDaysBetween(Instant.parse("2025-01-03T00:00:01Z"), now));
        assertEquals(-1, TimestampExtractor.wholeDaysBetween(Instant.parse("2025-01-10T06:00:00Z"), now));
    }
}
