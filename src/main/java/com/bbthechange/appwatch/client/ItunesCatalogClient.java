package com.bbthechange.appwatch.client;

import com.bbthechange.appwatch.config.CatalogProperties;
import com.bbthechange.appwatch.dto.itunes.ItunesLookupResponse;
import com.bbthechange.appwatch.dto.itunes.ItunesLookupResponse.ItunesApp;
import com.bbthechange.appwatch.exception.CatalogException;
import com.bbthechange.appwatch.model.AppMetadata;
import com.bbthechange.appwatch.model.FetchOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Client for the iTunes lookup API.
 * Fetches the current App Store listing for one app id per request. No retries: a failed
 * lookup is reported as a fetch failure and retried naturally on the next cycle.
 */
@Component
public class ItunesCatalogClient implements CatalogClient {

    private static final Logger logger = LoggerFactory.getLogger(ItunesCatalogClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String country;
    private final String userAgent;
    private final Duration requestTimeout;

    @Autowired
    public ItunesCatalogClient(HttpClient httpClient, ObjectMapper objectMapper, CatalogProperties properties) {
        this(httpClient, objectMapper, properties.getBaseUrl(), properties.getCountry(),
                properties.getUserAgent(), properties.getRequestTimeout());
    }

    /**
     * Constructor for testing with custom HttpClient.
     */
    ItunesCatalogClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl, String country,
                        String userAgent, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.country = country;
        this.userAgent = userAgent;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public FetchOutcome fetch(String appId) {
        try {
            return FetchOutcome.success(lookup(appId));
        } catch (CatalogException e) {
            if (e.getErrorType() == CatalogException.ErrorType.APP_NOT_FOUND) {
                logger.warn("No app found with ID: {}", appId);
                return FetchOutcome.notFound(appId);
            }
            logger.error("Error fetching app info for {}: {}", appId, e.getMessage());
            return FetchOutcome.error(appId, e.getMessage());
        }
    }

    /**
     * Look up one app and map the first result to {@link AppMetadata}.
     *
     * @throws CatalogException if the app does not exist, the API is unavailable or the body is unusable
     */
    public AppMetadata lookup(String appId) {
        String url = baseUrl + "/lookup?id=" + URLEncoder.encode(appId, StandardCharsets.UTF_8)
                + "&country=" + country;

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("User-Agent", userAgent)
                .timeout(requestTimeout)
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw CatalogException.serviceUnavailable(appId, "Catalog request failed for app " + appId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw CatalogException.serviceUnavailable(appId, "Interrupted while fetching app " + appId, e);
        }

        int statusCode = response.statusCode();
        logger.debug("Catalog response status: {} for URL: {}", statusCode, url);

        if (statusCode < 200 || statusCode >= 300) {
            throw CatalogException.serviceUnavailable(appId, statusCode);
        }

        ItunesLookupResponse lookup;
        try {
            lookup = objectMapper.readValue(response.body(), ItunesLookupResponse.class);
        } catch (JsonProcessingException e) {
            throw CatalogException.malformedResponse(appId, e);
        }

        if (lookup.getResultCount() == 0 || lookup.getResults() == null || lookup.getResults().isEmpty()) {
            throw CatalogException.appNotFound(appId);
        }

        return toMetadata(appId, lookup.getResults().get(0));
    }

    private AppMetadata toMetadata(String appId, ItunesApp app) {
        if (app.getVersion() == null || app.getVersion().isBlank()) {
            throw CatalogException.malformedResponse(appId, "missing version");
        }
        return AppMetadata.builder()
                .appId(appId)
                .name(app.getTrackName())
                .developer(app.getArtistName())
                .version(app.getVersion())
                .lastUpdated(parseReleaseDate(app.getCurrentVersionReleaseDate()))
                .url(app.getTrackViewUrl())
                .releaseNotes(app.getReleaseNotes() == null ? "" : app.getReleaseNotes())
                .build();
    }

    /**
     * Convert the catalog's release timestamp (ISO 8601) to an Instant.
     *
     * @param releaseDate e.g. "2024-05-01T07:00:00Z"
     * @return the instant, or null if the value is missing or unparseable
     */
    static Instant parseReleaseDate(String releaseDate) {
        if (releaseDate == null || releaseDate.isEmpty()) {
            return null;
        }

        try {
            return Instant.parse(releaseDate);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(releaseDate).toInstant();
            } catch (DateTimeParseException e2) {
                logger.warn("Failed to parse release date: {}", releaseDate);
                return null;
            }
        }
    }
}
