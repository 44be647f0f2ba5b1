package com.bbthechange.appwatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "monitor")
public class MonitorProperties {

    /**
     * YouTube, Instagram and TikTok.
     */
    private List<String> trackedAppIds = new ArrayList<>(List.of("544007664", "389801252", "835599320"));

    private String trackedAppsFile = "competitors.json";

    private String stateFile = "last_check.json";

    @DurationUnit(ChronoUnit.MINUTES)
    private Duration pollInterval = Duration.ofMinutes(60);

    @DurationUnit(ChronoUnit.SECONDS)
    private Duration cycleTimeout = Duration.ofMinutes(2);

    private int fetchParallelism = 4;

    private int releaseNotesMaxLength = 500;

    public List<String> getTrackedAppIds() {
        return trackedAppIds;
    }

    public void setTrackedAppIds(List<String> trackedAppIds) {
        this.trackedAppIds = trackedAppIds;
    }

    public String getTrackedAppsFile() {
        return trackedAppsFile;
    }

    public void setTrackedAppsFile(String trackedAppsFile) {
        this.trackedAppsFile = trackedAppsFile;
    }

    public String getStateFile() {
        return stateFile;
    }

    public void setStateFile(String stateFile) {
        this.stateFile = stateFile;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getCycleTimeout() {
        return cycleTimeout;
    }

    public void setCycleTimeout(Duration cycleTimeout) {
        this.cycleTimeout = cycleTimeout;
    }

    public int getFetchParallelism() {
        return fetchParallelism;
    }

    public void setFetchParallelism(int fetchParallelism) {
        this.fetchParallelism = fetchParallelism;
    }

    public int getReleaseNotesMaxLength() {
        return releaseNotesMaxLength;
    }

    public void setReleaseNotesMaxLength(int releaseNotesMaxLength) {
        this.releaseNotesMaxLength = releaseNotesMaxLength;
    }
}
