package com.rebenew.watchParty.syncserver.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Parámetros del servidor de sincronización, enlazados desde {@code watchparty.*}.
 * Los valores por defecto son los que esperan los clientes.
 */
@Configuration
@ConfigurationProperties(prefix = "watchparty")
@Data
@Validated
public class SyncProperties {

    private final Sync sync = new Sync();
    private final Presence presence = new Presence();
    private final Rooms rooms = new Rooms();
    private final WebSocket websocket = new WebSocket();
    private final Media media = new Media();

    @Data
    public static class Sync {
        // un |Δt| mayor (segundos) cuenta como seek real
        @Positive
        private double seekThresholdSeconds = 0.5;
        @NotNull
        private Duration fallbackFreshness = Duration.ofMinutes(2);
    }

    @Data
    public static class Presence {
        @NotNull
        private Duration gracePeriod = Duration.ofSeconds(30);
        @NotNull
        private Duration sweepInterval = Duration.ofSeconds(15);
        @NotNull
        private Duration deadConnectionThreshold = Duration.ofSeconds(30);
        @NotNull
        private Duration participantRetention = Duration.ofMinutes(5);
        @NotNull
        private Duration connectionRetention = Duration.ofMinutes(5);
        @NotNull
        private Duration roomInactivityTimeout = Duration.ofMinutes(30);
        @NotNull
        private Duration removalTick = Duration.ofSeconds(1);
    }

    @Data
    public static class Rooms {
        @Positive
        private int idLength = 6;
        @NotBlank
        private String idAlphabet = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    }

    @Data
    public static class WebSocket {
        @NotBlank
        private String path = "/ws/watch-sync";
        @NotNull
        private String[] allowedOrigins = {"*"};
        @Positive
        private int maxTextMessageBufferSize = 65536;
    }

    @Data
    public static class Media {
        @NotBlank
        private String basePath = "/uploads/";
    }
}
