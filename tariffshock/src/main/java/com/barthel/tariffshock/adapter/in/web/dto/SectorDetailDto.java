package com.barthel.tariffshock.adapter.in.web.dto;

import com.barthel.tariffshock.domain.model.SectorSummary;

import java.util.LinkedHashMap;
import java.util.Map;

public record SectorDetailDto(
        String sectorId,
        String sectorName,
        double totalExports,
        Map<String, Double> partnerShares,
        String topPartner,
        double topPartnerShare) {

    public static SectorDetailDto from(SectorSummary sector) {
        Map<String, Double> shares = new LinkedHashMap<>();
        sector.partnerShares().forEach((partner, share) -> shares.put(partner.code(), share));
        return new SectorDetailDto(
                sector.sectorId(),
                sector.sectorName(),
                sector.totalExports(),
                shares,
                sector.topPartner().code(),
                sector.topPartnerShare());
    }
}
