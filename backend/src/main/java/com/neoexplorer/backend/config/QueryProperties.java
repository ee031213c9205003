package com.neoexplorer.backend.config;

import com.neoexplorer.backend.filter.FilterCriteria;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.LocalDate;

/**
 * Criteria and output options of the {@code query} command, bound from {@code neo.query.*}.
 */
@Data
@ConfigurationProperties(prefix = "neo.query")
public class QueryProperties {

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate date;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate startDate;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate endDate;

    private Double distanceMin;
    private Double distanceMax;
    private Double velocityMin;
    private Double velocityMax;
    private Double diameterMin;
    private Double diameterMax;
    private Boolean hazardous;

    // unset: 10 when logging results, unlimited when writing a file
    private Integer limit;

    private String outfile;

    public FilterCriteria toCriteria() {
        return FilterCriteria.builder()
                .date(date)
                .startDate(startDate)
                .endDate(endDate)
                .distanceMin(distanceMin)
                .distanceMax(distanceMax)
                .velocityMin(velocityMin)
                .velocityMax(velocityMax)
                .diameterMin(diameterMin)
                .diameterMax(diameterMax)
                .hazardous(hazardous)
                .build();
    }
}
