package com.barthel.tariffshock.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;

import java.util.List;

/**
 * One side of a comparison. A missing tariff means 0.
 */
public record ScenarioSpecDto(
        @JsonProperty("tariff_percent")
        @DecimalMin(value = "0.0", message = "tariff_percent must be in range [0, 25]")
        @DecimalMax(value = "25.0", message = "tariff_percent must be in range [0, 25]")
        Double tariffPercent,

        @JsonProperty("target_partners")
        List<String> targetPartners) {
}
