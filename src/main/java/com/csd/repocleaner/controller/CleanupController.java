package com.csd.repocleaner.controller;

import com.csd.repocleaner.model.CleanupReport;
import com.csd.repocleaner.model.ExportScope;
import com.csd.repocleaner.service.CleanupService;
import com.csd.repocleaner.service.ExportService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/cleanup")
public class CleanupController {

    private final CleanupService cleanupService;
    private final ExportService exportService;

    public CleanupController(CleanupService cleanupService, ExportService exportService) {
        this.cleanupService = cleanupService;
        this.exportService = exportService;
    }

    @PostMapping("/run")
    public List<CleanupReport> run() {
        log.info("Cleanup run requested");
        return cleanupService.runAll();
    }

    @GetMapping("/reports")
    public List<CleanupReport> reports() {
        return cleanupService.getLastReports();
    }

    @GetMapping(value = "/reports/csv", produces = "text/csv")
    public ResponseEntity<String> reportsCsv() {
        String csv = exportService.exportCsv(cleanupService.getLastReports());
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"cleanup-report.csv\"")
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(csv);
    }

    @GetMapping("/reports/xlsx")
    public ResponseEntity<byte[]> reportsXlsx(@RequestParam(defaultValue = "combined") String scope) throws IOException {
        ExportScope exportScope = scope.equalsIgnoreCase("per_repo") ? ExportScope.PER_REPO : ExportScope.COMBINED;
        byte[] data = exportService.exportExcel(cleanupService.getLastReports(), exportScope);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"cleanup-report.xlsx\"")
                .contentType(MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"))
                .body(data);
    }

    @GetMapping(value = "/reports/json", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> reportsJson() throws IOException {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(exportService.exportJson(cleanupService.getLastReports()));
    }
}
