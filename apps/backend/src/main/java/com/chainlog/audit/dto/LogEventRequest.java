package com.chainlog.audit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

public record LogEventRequest(
        @NotNull String action,
        Object result,              // 任意 JSON 值，只参与 result_hash，不落库
        @NotNull String authorization,
        @JsonProperty("task_id") String taskId
) {}
