package com.csd.repocleaner.config;

import com.csd.repocleaner.model.CleanupReport;
import com.csd.repocleaner.service.CleanupService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "cleaner", name = "run-on-startup", havingValue = "true")
public class StartupCleanupRunner implements ApplicationRunner {

    private final CleanupService cleanupService;

    public StartupCleanupRunner(CleanupService cleanupService) {
        this.cleanupService = cleanupService;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<CleanupReport> reports = cleanupService.runAll();
        log.info("Startup cleanup finished for {} repositories", reports.size());
    }
}
