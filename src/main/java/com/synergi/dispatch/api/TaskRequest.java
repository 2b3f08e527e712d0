package com.synergi.dispatch.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Body of {@code POST /api/v1/tasks}.
 */
public record TaskRequest(
    @JsonProperty("text") String text,
    @JsonProperty("budgetLimit") @JsonAlias("budget_limit") BigDecimal budgetLimit,
    @JsonProperty("requesterId") @JsonAlias("requester_id") String requesterId
) {}
