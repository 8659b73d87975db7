package com.barthel.tariffshock.adapter.in.web.dto;

import java.util.List;

public record SectorListDto(int count, List<SectorDto> sectors) {
}
