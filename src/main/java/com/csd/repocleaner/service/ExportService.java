package com.csd.repocleaner.service;

import com.csd.repocleaner.model.CleanupReport;
import com.csd.repocleaner.model.EvaluationResult;
import com.csd.repocleaner.model.ExportScope;
import com.csd.repocleaner.model.SkippedComponent;
import com.csd.repocleaner.model.Verdict;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.*;

/**
 * Audit export of cleanup verdicts: one row per kept, deleted or skipped component.
 */
@Slf4j
@Service
public class ExportService {

    static final String[] HEADERS = {
            "Repository", "Component", "Version", "Retention Group", "Pattern", "Maven Type",
            "Position", "Last Modified", "Last Download", "Age (days)", "Days Since Download",
            "Action", "Reason"
    };

    private final ObjectMapper objectMapper;

    public ExportService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String exportCsv(List<CleanupReport> reports) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.join(",", HEADERS)).append("\n");
        for (CleanupReport report : reports) {
            for (List<String> row : rows(report)) {
                StringJoiner line = new StringJoiner(",");
                row.forEach(cell -> line.add(escapeCsv(cell)));
                sb.append(line).append("\n");
            }
        }
        return sb.toString();
    }

    public byte[] exportExcel(List<CleanupReport> reports, ExportScope scope) throws IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            CellStyle headerStyle = workbook.createCellStyle();
            Font headerFont = workbook.createFont();
            headerFont.setBold(true);
            headerStyle.setFont(headerFont);

            if (scope == ExportScope.PER_REPO) {
                Set<String> usedNames = new HashSet<>();
                for (CleanupReport report : reports) {
                    Sheet sheet = workbook.createSheet(uniqueSheetName(report.getRepository(), usedNames));
                    fillSheet(sheet, headerStyle, rows(report));
                }
            } else {
                Sheet sheet = workbook.createSheet("Cleanup");
                List<List<String>> all = new ArrayList<>();
                reports.forEach(r -> all.addAll(rows(r)));
                fillSheet(sheet, headerStyle, all);
            }

            ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
            workbook.write(outputStream);
            return outputStream.toByteArray();
        }
    }

    public String exportJson(List<CleanupReport> reports) throws IOException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(reports);
    }

    List<List<String>> rows(CleanupReport report) {
        List<List<String>> rows = new ArrayList<>();
        EvaluationResult evaluation = report.getEvaluation();
        if (evaluation == null) return rows;
        for (Verdict v : evaluation.getDeleted()) rows.add(verdictRow(report.getRepository(), v));
        for (Verdict v : evaluation.getKept()) rows.add(verdictRow(report.getRepository(), v));
        for (SkippedComponent s : evaluation.getSkipped()) {
            rows.add(Arrays.asList(report.getRepository(), s.getName(), s.getVersion(),
                    "", "", "", "", "", "", "", "", "SKIP", s.getReason()));
        }
        return rows;
    }

    private List<String> verdictRow(String repository, Verdict v) {
        return Arrays.asList(
                repository,
                v.getName(),
                v.getVersion(),
                v.getRetentionName(),
                v.getMatchedPattern(),
                v.getMavenType() == null ? "" : v.getMavenType().label(),
                str(v.getPosition()),
                str(v.getLastModified()),
                str(v.getLastDownload()),
                str(v.getAgeDays()),
                str(v.getDaysSinceDownload()),
                v.isWillDelete() ? "DELETE" : "KEEP",
                v.getReason());
    }

    private void fillSheet(Sheet sheet, CellStyle headerStyle, List<List<String>> rows) {
        Row headerRow = sheet.createRow(0);
        for (int i = 0; i < HEADERS.length; i++) {
            Cell cell = headerRow.createCell(i);
            cell.setCellValue(HEADERS[i]);
            cell.setCellStyle(headerStyle);
        }
        int rowNum = 1;
        for (List<String> values : rows) {
            Row row = sheet.createRow(rowNum++);
            for (int i = 0; i < values.size(); i++) {
                row.createCell(i).setCellValue(values.get(i) == null ? "" : values.get(i));
            }
        }
        for (int i = 0; i < HEADERS.length; i++) {
            sheet.autoSizeColumn(i);
        }
    }

    private static String str(Object value) {
        if (value == null) return "";
        if (value instanceof Instant) return value.toString();
        return String.valueOf(value);
    }

    private String escapeCsv(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private String uniqueSheetName(String name, Set<String> used) {
        // Excel sheet names can't contain: \ / ? * [ ] and are at most 31 characters
        String base = (name == null || name.isBlank() ? "repository" : name).replaceAll("[\\\\/:*?\\[\\]]", "_");
        if (base.length() > 31) base = base.substring(0, 31);
        String candidate = base;
        int n = 2;
        while (!used.add(candidate.toLowerCase(Locale.ROOT))) {
            String suffix = "~" + n++;
            candidate = base.substring(0, Math.min(base.length(), 31 - suffix.length())) + suffix;
        }
        return candidate;
    }
}
