package com.phonos.commerce.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * One {@link RestClient} per outbound provider, each with its own base URL and timeouts.
 */
@Configuration
public class RestClientConfig {

    @Value("${app.maps.base-url:https://maps.googleapis.com/maps/api}")
    private String mapsBaseUrl;

    @Value("${app.maps.connect-timeout-ms:2000}")
    private int mapsConnectTimeoutMs;

    @Value("${app.maps.read-timeout-ms:8000}")
    private int mapsReadTimeoutMs;

    @Value("${app.voice.base-url:https://api.vapi.ai}")
    private String voiceBaseUrl;

    @Value("${app.voice.api-key:}")
    private String voiceApiKey;

    @Value("${app.voice.connect-timeout-ms:2000}")
    private int voiceConnectTimeoutMs;

    @Value("${app.voice.read-timeout-ms:15000}")
    private int voiceReadTimeoutMs;

    @Value("${app.logistics.base-url:https://preprod.logistics-buyer.mp2.in}")
    private String logisticsBaseUrl;

    @Value("${app.logistics.api-key:}")
    private String logisticsApiKey;

    @Value("${app.logistics.connect-timeout-ms:2000}")
    private int logisticsConnectTimeoutMs;

    @Value("${app.logistics.read-timeout-ms:20000}")
    private int logisticsReadTimeoutMs;

    @Bean
    public RestClient mapsRestClient() {
        return RestClient.builder()
                .baseUrl(mapsBaseUrl)
                .requestFactory(requestFactory(mapsConnectTimeoutMs, mapsReadTimeoutMs))
                .build();
    }

    @Bean
    public RestClient voiceRestClient() {
        return RestClient.builder()
                .baseUrl(voiceBaseUrl)
                .requestFactory(requestFactory(voiceConnectTimeoutMs, voiceReadTimeoutMs))
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + voiceApiKey)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Bean
    public RestClient logisticsRestClient() {
        return RestClient.builder()
                .baseUrl(logisticsBaseUrl)
                .requestFactory(requestFactory(logisticsConnectTimeoutMs, logisticsReadTimeoutMs))
                .defaultHeader("x-pro-api-key", logisticsApiKey)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    private JdkClientHttpRequestFactory requestFactory(int connectTimeoutMs, int readTimeoutMs) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));
        return requestFactory;
    }
}
