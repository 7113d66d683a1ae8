package com.rebenew.watchParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StreamingInfo(
        @JsonProperty("isStreaming") boolean isStreaming,
        String fileName,
        String fileType
) {
    public static final StreamingInfo STOPPED = new StreamingInfo(false, null, null);
}
