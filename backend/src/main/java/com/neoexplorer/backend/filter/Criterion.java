package com.neoexplorer.backend.filter;

import com.neoexplorer.backend.model.CloseApproach;

import java.time.LocalDate;

/**
 * Attribute of a close approach (or of its linked object) that a filter compares.
 * Attributes of the linked object never match an approach without one.
 */
public enum Criterion {

    DISTANCE {
        @Override
        boolean supports(Object value) {
            return value instanceof Double;
        }

        @Override
        boolean matches(CloseApproach approach, ComparisonOperator operator, Object value) {
            return operator.test(approach.getDistance(), (Double) value);
        }
    },

    VELOCITY {
        @Override
        boolean supports(Object value) {
            return value instanceof Double;
        }

        @Override
        boolean matches(CloseApproach approach, ComparisonOperator operator, Object value) {
            return operator.test(approach.getVelocity(), (Double) value);
        }
    },

    DIAMETER {
        @Override
        boolean supports(Object value) {
            return value instanceof Double;
        }

        @Override
        boolean matches(CloseApproach approach, ComparisonOperator operator, Object value) {
            double reference = (Double) value;
            return approach.getNeo()
                    .map(neo -> operator.test(neo.getDiameter(), reference))
                    .orElse(false);
        }
    },

    HAZARDOUS {
        @Override
        boolean supports(Object value) {
            return value instanceof Boolean;
        }

        @Override
        boolean matches(CloseApproach approach, ComparisonOperator operator, Object value) {
            boolean reference = (Boolean) value;
            return approach.getNeo()
                    .map(neo -> operator.accepts(Boolean.compare(neo.isHazardous(), reference)))
                    .orElse(false);
        }
    },

    // calendar date only, time of day ignored
    DATE {
        @Override
        boolean supports(Object value) {
            return value instanceof LocalDate;
        }

        @Override
        boolean matches(CloseApproach approach, ComparisonOperator operator, Object value) {
            return operator.accepts(approach.getTime().toLocalDate().compareTo((LocalDate) value));
        }
    };

    abstract boolean supports(Object value);

    // value has passed supports()
    abstract boolean matches(CloseApproach approach, ComparisonOperator operator, Object value);
}
