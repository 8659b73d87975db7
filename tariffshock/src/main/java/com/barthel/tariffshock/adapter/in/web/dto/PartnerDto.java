package com.barthel.tariffshock.adapter.in.web.dto;

import java.util.List;

public record PartnerDto(String id, String name) {

    public record PartnerListDto(List<PartnerDto> partners, String note) {}
}
