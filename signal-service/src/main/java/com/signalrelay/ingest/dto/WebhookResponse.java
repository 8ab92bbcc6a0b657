package com.signalrelay.ingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record WebhookResponse(
    @JsonProperty("status")  String status,
    @JsonProperty("message") String message
) {
    public static WebhookResponse received() {
        return new WebhookResponse("success", "Signal received");
    }
}
