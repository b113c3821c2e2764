package com.keer.seating.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "seating")
public class SeatingProperties {

    private Admin admin = new Admin();
    private Token token = new Token();
    private Engine engine = new Engine();
    private Store store = new Store();
    private Broadcast broadcast = new Broadcast();

    @Data
    public static class Admin {
        /** Bearer credential expected on every /api/admin request. */
        private String token;
    }

    @Data
    public static class Token {
        /** HMAC secret used to sign guest lookup tokens. */
        private String secret;
        private String portalBaseUrl = "http://localhost:8080";
    }

    @Data
    public static class Engine {
        private Duration lockTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Store {
        private Duration commitTimeout = Duration.ofSeconds(5);
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(100);
    }

    @Data
    public static class Broadcast {
        /** Deltas retained per event for catch-up replay. */
        private int logCapacity = 1000;
        private int subscriberQueueCapacity = 256;
        private int deliveryThreads = 4;
    }
}
