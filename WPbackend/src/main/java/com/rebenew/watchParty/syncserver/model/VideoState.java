package com.rebenew.watchParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Estado de reproducción reportado por el reproductor del host.
 */
public record VideoState(
        Double currentTime,
        @JsonProperty("isPlaying") Boolean isPlaying,
        Boolean seek
) {
}
