package com.owldoor.geocoder.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * One element of the Nominatim {@code /search?format=json} array.
 * Coordinates arrive as strings.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class NominatimPlace {

    private String lat;

    private String lon;

    @JsonProperty("display_name")
    private String displayName;
}
