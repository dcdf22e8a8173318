package com.csd.repocleaner.service;

import com.csd.repocleaner.config.CleanerProperties;
import com.csd.repocleaner.model.CleanupConfig;
import com.csd.repocleaner.model.LoadedConfig;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads rule files (snake_case YAML) from the configured directory and its subdirectories.
 * A file that cannot be read is logged and left out; the others still load.
 */
@Slf4j
@Service
public class CleanupConfigLoader {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final CleanerProperties properties;

    public CleanupConfigLoader(CleanerProperties properties) {
        this.properties = properties;
    }

    public List<LoadedConfig> loadAll() {
        return loadAll(Path.of(properties.getConfigDir()));
    }

    public List<LoadedConfig> loadAll(Path dir) {
        List<LoadedConfig> configs = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            log.warn("Config directory '{}' does not exist", dir.toAbsolutePath());
            return configs;
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(dir)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(CleanupConfigLoader::isYaml)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.error("Failed to scan config directory '{}'", dir, e);
            return configs;
        }
        for (Path file : files) {
            load(file).ifPresent(cfg -> configs.add(LoadedConfig.builder()
                    .source(file.toString())
                    .config(cfg)
                    .build()));
        }
        return configs;
    }

    public Optional<CleanupConfig> load(Path file) {
        try {
            CleanupConfig config = yamlMapper.readValue(file.toFile(), CleanupConfig.class);
            if (config == null) {
                log.warn("Config '{}' is empty", file);
            }
            return Optional.ofNullable(config);
        } catch (IOException e) {
            log.error("Failed to load config '{}': {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean isYaml(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}
