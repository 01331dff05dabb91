package com.example.inference.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OutcomeRequest(
    @NotBlank(message = "request_id is required") String requestId,
    @NotNull(message = "realized_label is required")
        @Min(value = 0, message = "realized_label must be 0 or 1")
        @Max(value = 1, message = "realized_label must be 0 or 1")
        Integer realizedLabel,
    Instant observedAt) {}
