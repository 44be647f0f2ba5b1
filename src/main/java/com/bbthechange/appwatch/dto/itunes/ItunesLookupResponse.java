package com.bbthechange.appwatch.dto.itunes;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * DTO for the iTunes lookup API response.
 * Maps the JSON response from GET /lookup?id={appId}&country={country}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ItunesLookupResponse {

    /**
     * Number of entries in {@link #results}; zero when the id is unknown.
     */
    private int resultCount;

    @Builder.Default
    private List<ItunesApp> results = new ArrayList<>();

    /**
     * One software entry from the lookup results.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ItunesApp {

        private Long trackId;

        /**
         * App display name.
         */
        private String trackName;

        /**
         * Developer or publisher name.
         */
        private String artistName;

        private String version;

        /**
         * ISO 8601 timestamp of the current version's release (e.g., "2024-05-01T07:00:00Z").
         */
        private String currentVersionReleaseDate;

        private String trackViewUrl;

        private String releaseNotes;
    }
}
