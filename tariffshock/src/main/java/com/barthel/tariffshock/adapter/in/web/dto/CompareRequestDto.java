package com.barthel.tariffshock.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record CompareRequestDto(
        @JsonProperty("baseline")
        @Valid
        ScenarioSpecDto baseline,

        @JsonProperty("scenario")
        @Valid
        @NotNull(message = "scenario is required")
        ScenarioSpecDto scenario,

        @JsonProperty("sector_filter")
        List<String> sectorFilter) {
}
