package com.bmsedge.analytics.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings bound from the {@code analytics.*} properties.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsProperties {

    @Valid
    private Weather weather = new Weather();

    @Valid
    private Economic economic = new Economic();

    @Valid
    private Batch batch = new Batch();

    @Getter
    @Setter
    public static class Weather {
        @NotBlank
        private String defaultRegion = "130000";

        @Min(0)
        private int maxLagDays = 14;

        // distinct (region, start, end) ranges kept before the least recently used is evicted
        @Min(1)
        private int cacheMaxEntries = 256;
    }

    @Getter
    @Setter
    public static class Economic {
        @NotEmpty
        private List<String> symbols = new ArrayList<>(List.of("NIKKEI", "USDJPY", "WTI"));

        @Min(1)
        private int maxLagDays = 30;

        // relative CSV paths are resolved against this directory
        private String baseDir = "";

        private Map<String, String> symbolFiles = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Batch {
        @Min(1)
        private int poolSize = 4;

        @Min(1)
        private long timeoutSeconds = 120;
    }
}
