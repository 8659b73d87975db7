package com.barthel.tariffshock.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "tariffshock")
@Data
@Validated
public class TariffShockProperties {

    @Valid
    private Weights weights = new Weights();

    @Valid
    private Sources data = new Sources();

    @Data
    public static class Weights {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double exposure = 0.6;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double concentration = 0.4;

        @Positive
        private double maxTariffPercent = 25.0;
    }

    /**
     * Spring resource locations of the reference tables, {@code classpath:} or {@code file:}.
     */
    @Data
    public static class Sources {
        @NotBlank
        private String partnerExports = "classpath:data/partner-exports.csv";

        @NotBlank
        private String sectorNames = "classpath:reference/hs2-sectors.yml";

        @NotBlank
        private String partnerCountries = "classpath:reference/partner-countries.yml";

        @NotBlank
        private String tariffRates = "classpath:reference/tariff-rates.yml";
    }
}
