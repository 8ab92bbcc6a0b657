package com.signalrelay.ingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Error body, {@code {"detail": "..."}}. */
public record ErrorResponse(@JsonProperty("detail") String detail) {}
