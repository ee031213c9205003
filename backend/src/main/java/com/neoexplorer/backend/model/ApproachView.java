package com.neoexplorer.backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
@JsonPropertyOrder({"datetime_utc", "distance_au", "velocity_km_s"})
public class ApproachView {

    @JsonProperty("datetime_utc")
    private String datetimeUtc;

    @JsonProperty("distance_au")
    private double distanceAu;

    @JsonProperty("velocity_km_s")
    private double velocityKmS;
}
