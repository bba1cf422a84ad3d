package com.edurange.ctf.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class OrchestratorClientConfig {

    @Bean
    public RestTemplate orchestratorRestTemplate(RestTemplateBuilder builder,
            @Value("${orchestrator.connect-timeout-ms:3000}") long connectTimeoutMs,
            @Value("${orchestrator.read-timeout-ms:30000}") long readTimeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }
}
