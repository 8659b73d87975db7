package com.barthel.tariffshock.domain.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A hypothetical uniform tariff applied to a set of partners.
 *
 * @param tariffPercent tariff rate in [0, {@value #MAX_TARIFF_PERCENT}]
 * @param targetPartners partners imposing the tariff, may be empty
 * @param sectorFilter sector ids to evaluate, {@code null} for all sectors
 */
public record ScenarioInput(double tariffPercent, Set<Partner> targetPartners, List<String> sectorFilter) {

    public static final double MAX_TARIFF_PERCENT = 25.0;

    public ScenarioInput {
        if (!(tariffPercent >= 0.0 && tariffPercent <= MAX_TARIFF_PERCENT)) {
            throw new IllegalArgumentException(
                    "tariff_percent must be in [0, 25], got " + tariffPercent);
        }
        targetPartners = copyPartners(targetPartners);
        sectorFilter = sectorFilter == null ? null : List.copyOf(sectorFilter);
    }

    public ScenarioInput(double tariffPercent, Collection<Partner> targetPartners, List<String> sectorFilter) {
        this(tariffPercent, copyPartners(targetPartners), sectorFilter);
    }

    public ScenarioInput(double tariffPercent, Collection<Partner> targetPartners) {
        this(tariffPercent, copyPartners(targetPartners), null);
    }

    /**
     * Zero-tariff scenario with no target partners.
     */
    public static ScenarioInput baseline(List<String> sectorFilter) {
        return new ScenarioInput(0.0, Set.of(), sectorFilter);
    }

    /**
     * Same tariff and partners, evaluated against a different sector filter.
     */
    public ScenarioInput withSectorFilter(List<String> filter) {
        return new ScenarioInput(tariffPercent, targetPartners, filter);
    }

    private static Set<Partner> copyPartners(Collection<Partner> partners) {
        if (partners == null || partners.isEmpty()) {
            return Collections.unmodifiableSet(EnumSet.noneOf(Partner.class));
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(partners));
    }
}
