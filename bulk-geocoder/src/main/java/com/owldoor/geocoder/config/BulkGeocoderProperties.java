package com.owldoor.geocoder.config;

import com.owldoor.geocoder.model.ColumnMapping;
import com.owldoor.geocoder.model.GeocodeJob;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "bulk-geocoder")
@Data
public class BulkGeocoderProperties {

    private Job job = new Job();
    private Csv csv = new Csv();
    private Http http = new Http();

    /** Per-provider overrides keyed by provider id (nominatim, google, mapbox). */
    private Map<String, Provider> providers = new HashMap<>();

    /**
     * Command-line job. When {@code input} is set the job runs at startup and the process exits.
     */
    @Data
    public static class Job {
        private String input;
        private String output;
        private String provider = "nominatim";
        @ToString.Exclude
        private String apiKey;
        private String addressColumn;
        private String streetColumn;
        private String cityColumn;
        private String stateColumn;
        private String zipColumn;
        private boolean resume = false;
        private int chunkSize = GeocodeJob.DEFAULT_CHUNK_SIZE;

        public boolean isConfigured() {
            return input != null && !input.isBlank();
        }

        public GeocodeJob toJob() {
            return GeocodeJob.builder()
                    .input(input)
                    .output(output)
                    .provider(provider)
                    .apiKey(apiKey)
                    .columns(ColumnMapping.builder()
                            .addressColumn(addressColumn)
                            .streetColumn(streetColumn)
                            .cityColumn(cityColumn)
                            .stateColumn(stateColumn)
                            .zipColumn(zipColumn)
                            .build())
                    .resume(resume)
                    .chunkSize(chunkSize)
                    .build();
        }
    }

    @Data
    public static class Csv {
        private char delimiter = ',';
        private String charset = "UTF-8";
    }

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(10);
        /** Nominatim blocks clients that do not identify themselves. */
        private String userAgent = "OwlDoorGeocoder/1.0";
    }

    @Data
    public static class Provider {
        private String baseUrl;
        private Duration minInterval;
        private Integer maxRequests;
        private Duration window;
    }
}
