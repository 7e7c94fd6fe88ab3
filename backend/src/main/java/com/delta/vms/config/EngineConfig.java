package com.delta.vms.config;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "alertExecutor", destroyMethod = "shutdown")
    public ExecutorService alertExecutor() {
        return Executors.newFixedThreadPool(2);
    }

    @Bean
    public HttpClient alertHttpClient(EngineProperties properties) {
        return HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getAlerts().getWebhookTimeoutSeconds()))
            .build();
    }

    /**
     * Applied to Boot's shared mapper, so stored JSON and HTTP payloads carry ISO-8601 dates.
     */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer engineJacksonCustomizer() {
        return builder -> builder
            .modulesToInstall(new JavaTimeModule())
            .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
