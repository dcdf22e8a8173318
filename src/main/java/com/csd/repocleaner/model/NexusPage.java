package com.csd.repocleaner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One page of a Nexus listing; the last page has no continuation token.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NexusPage<T> {
    private List<T> items = new ArrayList<>();
    private String continuationToken;
}
