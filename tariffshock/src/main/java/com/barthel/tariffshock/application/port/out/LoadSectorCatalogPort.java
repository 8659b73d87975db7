package com.barthel.tariffshock.application.port.out;

import com.barthel.tariffshock.domain.model.SectorSummary;

import java.util.Map;
import java.util.Optional;

/**
 * Port for reading the sector trade profiles loaded at startup.
 */
public interface LoadSectorCatalogPort {
    /**
     * Look up one sector.
     *
     * @param sectorId the HS2 code
     * @return the sector, or empty when the id is unknown
     */
    Optional<SectorSummary> findSector(String sectorId);

    /**
     * All known sectors.
     *
     * @return sectors keyed by id, in a stable order
     */
    Map<String, SectorSummary> allSectors();

    /**
     * Whether the one-time load has completed.
     *
     * @return true once sectors can be served
     */
    boolean isLoaded();
}
