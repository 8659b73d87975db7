package com.barthel.tariffshock.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EvaluationMode {
    SCENARIO("scenario"),
    BASELINE("baseline"),
    ACTUAL_TARIFFS("actual_tariffs");

    private final String label;

    EvaluationMode(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
