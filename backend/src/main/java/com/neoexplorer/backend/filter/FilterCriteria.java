package com.neoexplorer.backend.filter;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * User-supplied query criteria. Every field is optional; {@code null} means unconstrained.
 */
@Value
@Builder
public class FilterCriteria {

    LocalDate date;
    LocalDate startDate;
    LocalDate endDate;
    Double distanceMin;
    Double distanceMax;
    Double velocityMin;
    Double velocityMax;
    Double diameterMin;
    Double diameterMax;
    Boolean hazardous;

    public static FilterCriteria none() {
        return builder().build();
    }
}
