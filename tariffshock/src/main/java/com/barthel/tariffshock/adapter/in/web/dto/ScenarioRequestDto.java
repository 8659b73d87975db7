package com.barthel.tariffshock.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ScenarioRequestDto(
        @JsonProperty("tariff_percent")
        @NotNull(message = "tariff_percent is required")
        @DecimalMin(value = "0.0", message = "tariff_percent must be in range [0, 25]")
        @DecimalMax(value = "25.0", message = "tariff_percent must be in range [0, 25]")
        Double tariffPercent,

        @JsonProperty("target_partners")
        List<String> targetPartners,

        @JsonProperty("sector_filter")
        List<String> sectorFilter) {
}
