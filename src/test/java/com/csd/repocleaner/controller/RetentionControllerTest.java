package com.csd.repocleaner.controller;

import com.csd.repocleaner.exception.GlobalExceptionHandler;
import com.csd.repocleaner.service.RetentionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class RetentionControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        RetentionService service = new RetentionService(Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC));
        mockMvc = MockMvcBuilders.standaloneSetup(new RetentionController(service))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void evaluatesComponents() throws Exception {
        String body = "{"
                + "\"components\":["
                + "{\"id\":\"c1\",\"name\":\"pkg\",\"version\":\"dev-1\",\"assets\":[{\"lastModified\":\"2024-12-22T00:00:00Z\",\"lastDownloaded\":\"2024-12-27T00:00:00Z\"}]},"
                + "{\"id\":\"c2\",\"name\":\"pkg\",\"version\":\"dev-2\",\"assets\":[{\"lastModified\":\"2024-12-31T00:00:00Z\"}]}"
                + "],"
                + "\"rules\":{\"regexRules\":{\"^dev-\":{\"retentionDays\":7,\"reserved\":1,\"minDaysSinceLastDownload\":3}}}"
                + "}";

        mockMvc.perform(post("/api/retention/evaluate").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted[0].componentId").value("c1"))
                .andExpect(jsonPath("$.kept[0].componentId").value("c2"))
                .andExpect(jsonPath("$.kept[0].reason").value("reserved (position 1/1)"));
    }

    @Test
    void evaluatesRawAssetsAtGivenTime() throws Exception {
        String body = "{"
                + "\"assets\":["
                + "{\"id\":\"1\",\"path\":\"a/b/file1.zip\",\"lastModified\":\"2024-01-01T00:00:00Z\"},"
                + "{\"id\":\"2\",\"path\":\"a/b/file2.zip\",\"lastModified\":\"2024-02-01T00:00:00Z\"}"
                + "],"
                + "\"rules\":{\"regexRules\":{\".*\":{\"retentionDays\":30}}},"
                + "\"now\":\"2024-02-15T00:00:00Z\""
                + "}";

        mockMvc.perform(post("/api/retention/evaluate/raw").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted[0].version").value("file1.zip"))
                .andExpect(jsonPath("$.kept[0].version").value("file2.zip"))
                .andExpect(jsonPath("$.kept[0].ageDays").value(14));
    }

    @Test
    void evaluatesMavenSections() throws Exception {
        String body = "{"
                + "\"components\":["
                + "{\"id\":\"m1\",\"group\":\"com.acme\",\"name\":\"core\",\"version\":\"1.0-SNAPSHOT\",\"assets\":[{\"lastModified\":\"2024-12-01T00:00:00Z\"}]},"
                + "{\"id\":\"m2\",\"group\":\"com.acme\",\"name\":\"core\",\"version\":\"1.1-SNAPSHOT\",\"assets\":[{\"lastModified\":\"2024-12-30T00:00:00Z\"}]}"
                + "],"
                + "\"mavenRules\":{\"snapshot\":{\"regexRules\":{\".*\":{\"reserved\":1}}}}"
                + "}";

        mockMvc.perform(post("/api/retention/evaluate/maven").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted[0].componentId").value("m1"))
                .andExpect(jsonPath("$.deleted[0].mavenType").value("SNAPSHOT"))
                .andExpect(jsonPath("$.kept[0].retentionName").value("com.acme:core"));
    }

    @Test
    void invalidPatternIsABadRequest() throws Exception {
        String body = "{\"components\":[],\"rules\":{\"regexRules\":{\"[dev\":{\"reserved\":1}}}}";

        mockMvc.perform(post("/api/retention/evaluate").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_RULE"))
                .andExpect(jsonPath("$.details").value("[dev"));
    }

    @Test
    void malformedBodyIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/retention/evaluate").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }
}
