package com.rebenew.watchParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * Posición de reproducción autoritativa de una sala. Inmutable; cada cambio aceptado produce un
 * snapshot nuevo que sustituye al anterior.
 *
 * @param currentTime posición en segundos
 * @param producedAt  hora del servidor al aceptarlo, epoch millis
 * @param producerId  conexión que lo produjo
 * @param seek        presente si viene de un seek explícito
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncSnapshot(
        double currentTime,
        @JsonProperty("isPlaying") boolean isPlaying,
        long producedAt,
        String producerId,
        Boolean seek
) {

    public boolean isFresh(Instant now, Duration maxAge) {
        return now.toEpochMilli() - producedAt < maxAge.toMillis();
    }

    /**
     * Si sustituir este snapshot por uno en {@code newTime}/{@code newPlaying} merece llegar a
     * los seguidores.
     */
    public boolean differsSignificantly(double newTime, boolean newPlaying, double thresholdSeconds) {
        return isPlaying != newPlaying || Math.abs(newTime - currentTime) > thresholdSeconds;
    }
}
