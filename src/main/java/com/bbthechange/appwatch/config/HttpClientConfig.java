package com.bbthechange.appwatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;

@Configuration
public class HttpClientConfig {

    private final CatalogProperties properties;

    public HttpClientConfig(CatalogProperties properties) {
        this.properties = properties;
    }

    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getConnectionTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }
}
