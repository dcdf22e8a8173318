package com.csd.repocleaner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Asset {
    private String id;
    private String path; // raw repositories derive the component from it
    private String downloadUrl;
    private String repository;
    private String format;
    private String lastModified;   // ISO-8601 with offset, as Nexus returns it
    private String lastDownloaded; // null when never downloaded
}
