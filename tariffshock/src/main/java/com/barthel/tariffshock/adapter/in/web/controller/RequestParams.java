package com.barthel.tariffshock.adapter.in.web.controller;

import com.barthel.tariffshock.domain.model.Partner;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Parsing of wire-level partner and sector lists.
 */
final class RequestParams {

    private RequestParams() {
    }

    /**
     * Strict conversion for request bodies: anything other than US, China or EU is rejected.
     */
    static Set<Partner> targetPartners(List<String> codes) {
        Set<Partner> partners = EnumSet.noneOf(Partner.class);
        if (codes == null) {
            return partners;
        }
        for (String code : codes) {
            partners.add(Partner.fromTargetCode(code));
        }
        return partners;
    }

    /**
     * Lenient conversion for query strings: unknown names are skipped.
     */
    static Set<Partner> targetPartnersOrSkip(String csv) {
        Set<Partner> partners = EnumSet.noneOf(Partner.class);
        for (String code : splitCsv(csv)) {
            Partner.fromCode(code)
                    .filter(Partner.selectable()::contains)
                    .ifPresent(partners::add);
        }
        return partners;
    }

    /**
     * @return the trimmed, non-blank entries, or {@code null} when the parameter is absent or blank
     */
    static List<String> sectorFilter(String csv) {
        List<String> sectors = splitCsv(csv);
        return sectors.isEmpty() ? null : sectors;
    }

    private static List<String> splitCsv(String csv) {
        List<String> values = new ArrayList<>();
        if (csv == null || csv.isBlank()) {
            return values;
        }
        Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(values::add);
        return values;
    }
}
