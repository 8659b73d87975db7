package com.barthel.tariffshock.adapter.in.web.dto;

import java.util.List;

public record TariffRatesDto(String description, String note, List<TariffRateDto> tariffs, int totalTariffedSectors) {
}
