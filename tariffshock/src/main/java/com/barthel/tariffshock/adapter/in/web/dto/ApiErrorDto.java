package com.barthel.tariffshock.adapter.in.web.dto;

import lombok.Builder;

import java.time.Instant;

@Builder
public record ApiErrorDto(Instant timestamp, int status, String error, String message, String path) {
}
