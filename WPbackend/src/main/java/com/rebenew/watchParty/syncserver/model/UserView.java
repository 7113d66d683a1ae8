package com.rebenew.watchParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Participante tal como aparece en los avisos de membresía.
 */
public record UserView(
        String id,
        String username,
        @JsonProperty("isHost") boolean isHost,
        @JsonProperty("isChatOnly") boolean isChatOnly,
        boolean active
) {
}
