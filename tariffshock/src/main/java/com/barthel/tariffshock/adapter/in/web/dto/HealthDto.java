package com.barthel.tariffshock.adapter.in.web.dto;

public record HealthDto(String status, boolean engineLoaded) {
}
