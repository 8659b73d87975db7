package com.barthel.tariffshock.adapter.in.web.dto;

import com.barthel.tariffshock.domain.model.SectorSummary;

public record SectorDto(String sectorId, String sectorName, double totalExports, String topPartner, double topPartnerShare) {

    public static SectorDto from(SectorSummary sector) {
        return new SectorDto(
                sector.sectorId(),
                sector.sectorName(),
                sector.totalExports(),
                sector.topPartner().code(),
                sector.topPartnerShare());
    }
}
