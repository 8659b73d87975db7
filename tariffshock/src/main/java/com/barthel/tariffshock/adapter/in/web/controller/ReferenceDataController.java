package com.barthel.tariffshock.adapter.in.web.controller;

import com.barthel.tariffshock.adapter.in.web.dto.PartnerDto;
import com.barthel.tariffshock.adapter.in.web.dto.SectorDetailDto;
import com.barthel.tariffshock.adapter.in.web.dto.SectorDto;
import com.barthel.tariffshock.adapter.in.web.dto.SectorListDto;
import com.barthel.tariffshock.adapter.in.web.dto.TariffRateDto;
import com.barthel.tariffshock.adapter.in.web.dto.TariffRatesDto;
import com.barthel.tariffshock.application.port.in.QueryReferenceDataUseCase;
import com.barthel.tariffshock.domain.model.Partner;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ReferenceDataController {

    private final QueryReferenceDataUseCase queryReferenceDataUseCase;

    @GetMapping("/sectors")
    public SectorListDto sectors() {
        List<SectorDto> sectors = queryReferenceDataUseCase.listSectors().stream()
                .map(SectorDto::from)
                .toList();
        return new SectorListDto(sectors.size(), sectors);
    }

    @GetMapping("/sector/{sectorId}")
    public SectorDetailDto sector(@PathVariable String sectorId) {
        return SectorDetailDto.from(queryReferenceDataUseCase.getSector(sectorId));
    }

    @GetMapping("/tariff-rates")
    public TariffRatesDto tariffRates() {
        List<TariffRateDto> tariffs = queryReferenceDataUseCase.tariffedSectors().stream()
                .map(TariffRateDto::from)
                .toList();
        return new TariffRatesDto(
                "Recorded tariff rates imposed on exports by sector",
                "Representative rates per partner; sectors without a recorded rate default to 0",
                tariffs,
                tariffs.size());
    }

    @GetMapping("/partners")
    public PartnerDto.PartnerListDto partners() {
        List<PartnerDto> partners = Partner.selectable().stream()
                .map(p -> new PartnerDto(p.code(), p.displayName()))
                .toList();
        return new PartnerDto.PartnerListDto(partners, "All other countries are aggregated as 'Other'");
    }
}
