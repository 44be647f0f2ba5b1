package com.bbthechange.appwatch.client;

import com.bbthechange.appwatch.config.SlackProperties;
import com.bbthechange.appwatch.dto.NotificationPayload;
import com.bbthechange.appwatch.dto.slack.SlackApiResponse;
import com.bbthechange.appwatch.dto.slack.SlackPostMessageRequest;
import com.bbthechange.appwatch.exception.DeliveryException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Delivers notifications to a Slack channel through the chat.postMessage Web API.
 *
 * Slack reports most failures (invalid_auth, channel_not_found, not_in_channel, ...) with
 * HTTP 200 and {@code "ok": false}, so the body is always inspected.
 *
 * @see <a href="https://api.slack.com/methods/chat.postMessage">chat.postMessage</a>
 */
@Component
public class SlackNotificationChannel implements NotificationChannel {

    private static final Logger logger = LoggerFactory.getLogger(SlackNotificationChannel.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String botToken;
    private final String channel;
    private final Duration requestTimeout;

    @Autowired
    public SlackNotificationChannel(HttpClient httpClient, ObjectMapper objectMapper, SlackProperties properties) {
        this(httpClient, objectMapper, properties.getBaseUrl(), properties.getBotToken(),
                properties.getChannel(), properties.getRequestTimeout());
    }

    /**
     * Constructor for testing with custom HttpClient.
     */
    SlackNotificationChannel(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl,
                             String botToken, String channel, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.botToken = botToken;
        this.channel = channel;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public void deliver(NotificationPayload payload) {
        String body;
        try {
            body = objectMapper.writeValueAsString(
                    new SlackPostMessageRequest(channel, payload.getText(), payload.getBlocks()));
        } catch (JsonProcessingException e) {
            throw new DeliveryException("Could not serialize Slack message", e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/chat.postMessage"))
                .header("Authorization", "Bearer " + botToken)
                .header("Content-Type", "application/json; charset=utf-8")
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DeliveryException("Slack request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException("Interrupted while posting to Slack", e);
        }

        int statusCode = response.statusCode();
        if (statusCode < 200 || statusCode >= 300) {
            throw new DeliveryException("Slack API returned status " + statusCode);
        }

        SlackApiResponse apiResponse;
        try {
            apiResponse = objectMapper.readValue(response.body(), SlackApiResponse.class);
        } catch (JsonProcessingException e) {
            throw new DeliveryException("Unreadable Slack API response", e);
        }

        if (!apiResponse.isOk()) {
            throw new DeliveryException("Slack API error: " + apiResponse.getError());
        }

        logger.info("Slack message posted to {} (ts={})", channel, apiResponse.getTs());
    }
}
