package com.neoexplorer.backend.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

import static com.neoexplorer.backend.filter.ComparisonOperator.EQUAL;
import static com.neoexplorer.backend.filter.ComparisonOperator.GREATER_OR_EQUAL;
import static com.neoexplorer.backend.filter.ComparisonOperator.LESS_OR_EQUAL;

public final class Filters {

    private Filters() {
    }

    // one filter per criterion that is set; order: dates, distance, velocity, diameter, hazardous
    public static List<AttributeFilter> create(FilterCriteria criteria) {
        Objects.requireNonNull(criteria, "criteria");
        List<AttributeFilter> filters = new ArrayList<>();

        if (criteria.getDate() != null) {
            filters.add(AttributeFilter.date(EQUAL, criteria.getDate()));
        }
        if (criteria.getStartDate() != null) {
            filters.add(AttributeFilter.date(GREATER_OR_EQUAL, criteria.getStartDate()));
        }
        if (criteria.getEndDate() != null) {
            filters.add(AttributeFilter.date(LESS_OR_EQUAL, criteria.getEndDate()));
        }

        if (criteria.getDistanceMin() != null) {
            filters.add(AttributeFilter.distance(GREATER_OR_EQUAL, criteria.getDistanceMin()));
        }
        if (criteria.getDistanceMax() != null) {
            filters.add(AttributeFilter.distance(LESS_OR_EQUAL, criteria.getDistanceMax()));
        }

        if (criteria.getVelocityMin() != null) {
            filters.add(AttributeFilter.velocity(GREATER_OR_EQUAL, criteria.getVelocityMin()));
        }
        if (criteria.getVelocityMax() != null) {
            filters.add(AttributeFilter.velocity(LESS_OR_EQUAL, criteria.getVelocityMax()));
        }

        if (criteria.getDiameterMin() != null) {
            filters.add(AttributeFilter.diameter(GREATER_OR_EQUAL, criteria.getDiameterMin()));
        }
        if (criteria.getDiameterMax() != null) {
            filters.add(AttributeFilter.diameter(LESS_OR_EQUAL, criteria.getDiameterMax()));
        }

        if (criteria.getHazardous() != null) {
            filters.add(AttributeFilter.hazardous(criteria.getHazardous()));
        }
        return Collections.unmodifiableList(filters);
    }

    // null or 0 leaves the stream unbounded
    public static <T> Stream<T> limit(Stream<T> stream, Integer n) {
        Objects.requireNonNull(stream, "stream");
        if (n == null || n == 0) {
            return stream;
        }
        if (n < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + n);
        }
        return stream.limit(n);
    }
}
