package com.gamewright.core.upload;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class UploadConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }

    @Bean
    public FilesClientFactory filesClientFactory(UploadProperties properties) {
        // one HttpClient for the process; the API key travels per client instance
        var httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .build();
        return apiKey -> new GoogleFilesApiClient(properties.getApiBaseUrl(), apiKey, httpClient);
    }
}
