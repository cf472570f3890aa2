package com.owldoor.geocoder.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * Raw DTO for the Google Geocoding API JSON response.
 * Kept separate from GeocodeResult to isolate API coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GoogleGeocodeResponse {

    /** OK, ZERO_RESULTS, OVER_QUERY_LIMIT, REQUEST_DENIED, INVALID_REQUEST, UNKNOWN_ERROR */
    private String status;

    @JsonProperty("error_message")
    private String errorMessage;

    private List<Result> results;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Result {

        @JsonProperty("formatted_address")
        private String formattedAddress;

        private Geometry geometry;

        @Data
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class Geometry {
            private Location location;
        }

        @Data
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class Location {
            private Double lat;
            private Double lng;
        }
    }
}
