package com.owldoor.geocoder.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Everything a single run needs, supplied once at start.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeocodeJob {

    public static final int DEFAULT_CHUNK_SIZE = 1000;

    private String input;
    private String output;

    @Builder.Default
    private String provider = "nominatim";

    @ToString.Exclude
    private String apiKey;

    @Builder.Default
    private ColumnMapping columns = new ColumnMapping();

    private boolean resume;

    @Builder.Default
    private int chunkSize = DEFAULT_CHUNK_SIZE;
}
