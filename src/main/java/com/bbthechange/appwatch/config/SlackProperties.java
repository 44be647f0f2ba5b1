package com.bbthechange.appwatch.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Slack destination for the consolidated release notification.
 * Startup fails when the bot token or channel is missing.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "slack")
public class SlackProperties {

    @NotBlank(message = "slack.bot-token (SLACK_BOT_TOKEN) must be set")
    private String botToken;

    @NotBlank(message = "slack.channel (SLACK_CHANNEL) must be set")
    private String channel;

    private String baseUrl = "https://slack.com/api";

    private Duration requestTimeout = Duration.ofSeconds(10);

    public String getBotToken() {
        return botToken;
    }

    public void setBotToken(String botToken) {
        this.botToken = botToken;
    }

    public String getChannel() {
        return channel;
    }

    public void setChannel(String channel) {
        this.channel = channel;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }
}
