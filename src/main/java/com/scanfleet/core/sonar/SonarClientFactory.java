package com.scanfleet.core.sonar;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scanfleet.core.config.ScanfleetProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds a fresh {@link SonarApi} client for each worker.
 */
@Component
public class SonarClientFactory {

    private final ScanfleetProperties properties;
    private final ObjectMapper objectMapper;

    public SonarClientFactory(ScanfleetProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public SonarApi create() {
        var sonar = properties.getSonar();
        return SonarClient.builder()
                .baseUrl(sonar.getHost())
                .token(sonar.getToken())
                .maxRetries(sonar.getMaxRetries())
                .connectTimeout(Duration.ofSeconds(sonar.getConnectTimeoutSeconds()))
                .requestTimeout(Duration.ofSeconds(sonar.getRequestTimeoutSeconds()))
                .metadataEndpoint(sonar.getMetadataEndpoint())
                .objectMapper(objectMapper)
                .build();
    }
}
