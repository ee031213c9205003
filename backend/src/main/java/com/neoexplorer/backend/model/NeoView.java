package com.neoexplorer.backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Output fields of a near-Earth object. The name is empty rather than absent.
 */
@Data
@AllArgsConstructor
@JsonPropertyOrder({"designation", "name", "diameter_km", "potentially_hazardous"})
public class NeoView {

    private String designation;

    private String name;

    @JsonProperty("diameter_km")
    private double diameterKm;

    @JsonProperty("potentially_hazardous")
    private boolean potentiallyHazardous;

    // approach with no linked object
    public static NeoView unknown(String designation) {
        return new NeoView(designation, "", Double.NaN, false);
    }
}
