package com.csd.repocleaner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Component {
    private String id;
    private String repository;
    private String format;
    private String group; // maven2 only
    private String name;
    private String version;
    private List<Asset> assets;
}
