package com.barthel.tariffshock.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Trading partner bucket. Every country outside the US, China and the EU is
 * aggregated into {@link #OTHER} before it reaches the engine.
 */
public enum Partner {
    US("US", "United States"),
    CHINA("China", "China"),
    EU("EU", "European Union"),
    OTHER("Other", "Other");

    private static final Set<Partner> SELECTABLE = EnumSet.of(US, CHINA, EU);

    private final String code;
    private final String displayName;

    Partner(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Partners a caller may target in a scenario.
     *
     * @return US, China and EU in declaration order
     */
    public static Set<Partner> selectable() {
        return EnumSet.copyOf(SELECTABLE);
    }

    public static Optional<Partner> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String trimmed = code.trim();
        return Arrays.stream(values())
                .filter(p -> p.code.equals(trimmed))
                .findFirst();
    }

    /**
     * Resolve a wire-level partner code that may be used as a scenario target.
     *
     * @param code one of {@code US}, {@code China}, {@code EU}
     * @return the matching partner
     * @throws IllegalArgumentException for any other value, including {@code Other}
     */
    public static Partner fromTargetCode(String code) {
        return fromCode(code)
                .filter(SELECTABLE::contains)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid partner: " + code + ". Valid options: US, China, EU"));
    }
}
