package com.owldoor.geocoder.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * Raw DTO for the Mapbox {@code mapbox.places} GeoJSON feature collection.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class MapboxGeocodeResponse {

    private List<Feature> features;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Feature {

        /** [longitude, latitude] */
        private List<Double> center;

        @JsonProperty("place_name")
        private String placeName;
    }
}
