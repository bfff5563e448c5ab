package com.growthpilot.platform.scheduler.client;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.UUID;

/**
 * Talks to the platform-connector service, which holds the user's platform credentials.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConnectorPlatformClient implements PlatformClient {

    private final WebClient.Builder webClientBuilder;

    @Value("${platform-connector.url}")
    private String platformConnectorUrl;

    @Value("${platform-connector.timeout:PT30S}")
    private Duration timeout;

    @Override
    public PlatformSession openSession(UUID userId) {
        WebClient client = webClientBuilder.clone()
                .baseUrl(platformConnectorUrl)
                .defaultHeader("X-User-Id", userId.toString())
                .build();
        log.debug("Opened platform session for user {}", userId);
        return new ConnectorSession(userId, client, timeout);
    }
}
