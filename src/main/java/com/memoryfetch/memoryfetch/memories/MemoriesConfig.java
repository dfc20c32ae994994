package com.memoryfetch.memoryfetch.memories;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Clock;

/**
 * Enables memories configuration binding and wires the shared HTTP client.
 */
@Configuration
@EnableConfigurationProperties(MemoriesProperties.class)
public class MemoriesConfig {

    /**
     * One client for all workers. Default headers are fixed here and never mutated per request.
     */
    @Bean
    public RestClient memoriesRestClient(RestClient.Builder builder, MemoriesProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.getReadTimeout());

        return builder
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.USER_AGENT, properties.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, "*/*")
                .build();
    }

    @Bean
    public Sleeper memoriesSleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public Clock memoriesClock() {
        return Clock.systemDefaultZone();
    }
}
