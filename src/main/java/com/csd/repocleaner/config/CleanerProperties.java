package com.csd.repocleaner.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the cleanup run and the Nexus connection.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "cleaner")
public class CleanerProperties {

    /**
     * Directory searched recursively for *.yaml / *.yml rule files.
     */
    private String configDir = "configs";

    /**
     * Run every configured repository once when the application starts.
     */
    private boolean runOnStartup = false;

    private Nexus nexus = new Nexus();

    @Getter
    @Setter
    public static class Nexus {

        /**
         * Base URL of the Nexus instance, e.g. https://nexus.example.com/
         */
        private String baseUrl;

        private String username;

        private String password;

        /**
         * Timeout for a single HTTP call.
         */
        private int timeoutSeconds = 10;
    }
}
