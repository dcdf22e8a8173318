package com.csd.repocleaner.service;

import com.csd.repocleaner.config.CleanerProperties;
import com.csd.repocleaner.exception.NexusApiException;
import com.csd.repocleaner.model.Asset;
import com.csd.repocleaner.model.Component;
import com.csd.repocleaner.model.DeletionOutcome;
import com.csd.repocleaner.model.NexusPage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Client for the Nexus 3 REST API (service/rest/v1).
 * Listing follows continuation tokens until the last page; deletion honours dry-run.
 */
@Slf4j
@Service
public class NexusApiClient {

    static final String REPOSITORIES_PATH = "/service/rest/v1/repositories";
    static final String COMPONENTS_PATH = "/service/rest/v1/components";
    static final String ASSETS_PATH = "/service/rest/v1/assets";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public NexusApiClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper, CleanerProperties properties) {
        CleanerProperties.Nexus nexus = properties.getNexus();
        if (nexus.getBaseUrl() != null && !nexus.getBaseUrl().isBlank()) {
            webClientBuilder.baseUrl(stripTrailingSlash(nexus.getBaseUrl()));
        }
        if (nexus.getUsername() != null && !nexus.getUsername().isBlank()) {
            webClientBuilder.defaultHeaders(h -> h.setBasicAuth(nexus.getUsername(),
                    nexus.getPassword() == null ? "" : nexus.getPassword()));
        }
        this.webClient = webClientBuilder.build();
        this.objectMapper = objectMapper;
        this.timeout = Duration.ofSeconds(nexus.getTimeoutSeconds());
    }

    /**
     * Format of the named repository ("raw", "docker", "maven2", ...), empty when Nexus does
     * not know the repository.
     */
    public Optional<String> getRepositoryFormat(String repository) {
        String body = fetchRepositories();
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isArray()) {
                throw new NexusApiException("Unexpected repositories response from Nexus");
            }
            for (JsonNode repo : root) {
                if (repository.equals(repo.path("name").asText())) {
                    return Optional.ofNullable(repo.path("format").textValue());
                }
            }
            return Optional.empty();
        } catch (JsonProcessingException e) {
            throw new NexusApiException("Could not parse repositories response: " + e.getOriginalMessage(), e);
        }
    }

    public List<Component> listComponents(String repository) {
        return listAll(COMPONENTS_PATH, repository, Component.class);
    }

    public List<Asset> listAssets(String repository) {
        return listAll(ASSETS_PATH, repository, Asset.class);
    }

    /**
     * Deletes a component, or an asset for raw repositories. Failures are logged and reported
     * through the outcome; they never abort the caller's run.
     */
    public DeletionOutcome delete(String id, String label, boolean asset, boolean dryRun) {
        if (dryRun) {
            log.info("[DRY_RUN] Deletion skipped: {} (id {})", label, id);
            return DeletionOutcome.DRY_RUN;
        }
        String path = (asset ? ASSETS_PATH : COMPONENTS_PATH) + "/" + id;
        try {
            sendDelete(path);
            log.info("Deleted: {} (id {})", label, id);
            return DeletionOutcome.DELETED;
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 404) {
                log.warn("Not found (404), already removed? {} (id {})", label, id);
                return DeletionOutcome.NOT_FOUND;
            }
            if (status == 409) {
                log.warn("Nexus refused deletion (409): {} (id {})", label, id);
                return DeletionOutcome.CONFLICT;
            }
            log.error("HTTP {} deleting {} (id {}): {}", status, label, id, e.getMessage());
            return DeletionOutcome.FAILED;
        } catch (RuntimeException e) {
            log.error("Error deleting {} (id {}): {}", label, id, e.getMessage());
            return DeletionOutcome.FAILED;
        }
    }

    <T> List<T> listAll(String path, String repository, Class<T> type) {
        List<T> items = new ArrayList<>();
        String token = null;
        int pages = 0;
        do {
            NexusPage<T> page = parsePage(fetchPage(path, repository, token), type);
            items.addAll(page.getItems());
            token = page.getContinuationToken();
            pages++;
        } while (token != null && !token.isBlank());
        log.info("Listed {} item(s) from '{}' in {} page(s)", items.size(), repository, pages);
        return items;
    }

    <T> NexusPage<T> parsePage(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            throw new NexusApiException("Empty listing response from Nexus");
        }
        try {
            JavaType pageType = objectMapper.getTypeFactory().constructParametricType(NexusPage.class, type);
            NexusPage<T> page = objectMapper.readValue(json, pageType);
            if (page.getItems() == null) page.setItems(new ArrayList<>());
            return page;
        } catch (JsonProcessingException e) {
            throw new NexusApiException("Could not parse listing page: " + e.getOriginalMessage(), e);
        }
    }

    protected String fetchRepositories() {
        try {
            return webClient.get()
                    .uri(REPOSITORIES_PATH)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            throw new NexusApiException("Failed to fetch repositories: " + e.getMessage(), e);
        }
    }

    protected String fetchPage(String path, String repository, String continuationToken) {
        try {
            return webClient.get()
                    .uri(b -> {
                        b.path(path).queryParam("repository", repository);
                        if (continuationToken != null) b.queryParam("continuationToken", continuationToken);
                        return b.build();
                    })
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            throw new NexusApiException("Failed to list " + path + " for '" + repository + "': " + e.getMessage(), e);
        }
    }

    protected void sendDelete(String path) {
        webClient.delete()
                .uri(path)
                .retrieve()
                .toBodilessEntity()
                .timeout(timeout)
                .block();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
