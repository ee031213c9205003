package com.neoexplorer.backend.filter;

import com.neoexplorer.backend.model.CloseApproach;
import com.neoexplorer.backend.model.NearEarthObject;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static com.neoexplorer.backend.filter.ComparisonOperator.EQUAL;
import static com.neoexplorer.backend.filter.ComparisonOperator.GREATER_OR_EQUAL;
import static com.neoexplorer.backend.filter.ComparisonOperator.LESS_OR_EQUAL;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AttributeFilterTest {

    private static CloseApproach linked(String calendarDate, double distance, double velocity,
                                        Double diameter, boolean hazardous) {
        NearEarthObject neo = new NearEarthObject("433", "Eros", diameter, hazardous);
        CloseApproach approach = new CloseApproach("433", calendarDate, distance, velocity);
        neo.attach(approach);
        return approach;
    }

    @Test
    public void testDistanceBounds() {
        CloseApproach approach = linked("1900-Jan-01 00:00", 0.32, 5.5, 16.84, false);

        assertTrue(AttributeFilter.distance(LESS_OR_EQUAL, 0.5).test(approach));
        assertFalse(AttributeFilter.distance(LESS_OR_EQUAL, 0.1).test(approach));
        assertTrue(AttributeFilter.distance(GREATER_OR_EQUAL, 0.32).test(approach));
        assertTrue(AttributeFilter.distance(EQUAL, 0.32).test(approach));
    }

    @Test
    public void testVelocityBounds() {
        CloseApproach approach = linked("1900-Jan-01 00:00", 0.32, 5.5, 16.84, false);

        assertTrue(AttributeFilter.velocity(GREATER_OR_EQUAL, 5.0).test(approach));
        assertFalse(AttributeFilter.velocity(GREATER_OR_EQUAL, 6.0).test(approach));
        assertTrue(AttributeFilter.velocity(LESS_OR_EQUAL, 5.5).test(approach));
    }

    @Test
    public void testDiameterAndHazardousReadLinkedObject() {
        CloseApproach approach = linked("1900-Jan-01 00:00", 0.32, 5.5, 16.84, true);

        assertTrue(AttributeFilter.diameter(GREATER_OR_EQUAL, 10.0).test(approach));
        assertFalse(AttributeFilter.diameter(LESS_OR_EQUAL, 10.0).test(approach));
        assertTrue(AttributeFilter.hazardous(true).test(approach));
        assertFalse(AttributeFilter.hazardous(false).test(approach));
    }

    @Test
    public void testUnknownValuesNeverMatch() {
        CloseApproach approach = linked("1900-Jan-01 00:00", 0.32, 5.5, null, false);

        assertFalse(AttributeFilter.diameter(GREATER_OR_EQUAL, 0.0).test(approach));
        assertFalse(AttributeFilter.diameter(LESS_OR_EQUAL, 1000.0).test(approach));
        assertFalse(AttributeFilter.diameter(EQUAL, Double.NaN).test(approach));
    }

    @Test
    public void testObjectCriteriaDoNotMatchOrphanApproach() {
        CloseApproach orphan = new CloseApproach("99942", "2029-Apr-13 21:46", 0.000254, 7.42);

        assertFalse(AttributeFilter.diameter(GREATER_OR_EQUAL, 0.0).test(orphan));
        assertFalse(AttributeFilter.hazardous(false).test(orphan));
        assertFalse(AttributeFilter.hazardous(true).test(orphan));
        assertTrue(AttributeFilter.distance(LESS_OR_EQUAL, 0.01).test(orphan));
    }

    @Test
    public void testDateIgnoresTimeOfDay() {
        CloseApproach approach = linked("2020-Apr-05 17:21", 0.0118, 4.81, null, false);
        LocalDate day = LocalDate.of(2020, 4, 5);

        assertTrue(AttributeFilter.date(EQUAL, day).test(approach));
        assertTrue(AttributeFilter.date(GREATER_OR_EQUAL, day).test(approach));
        assertTrue(AttributeFilter.date(LESS_OR_EQUAL, day).test(approach));
        assertFalse(AttributeFilter.date(LESS_OR_EQUAL, day.minusDays(1)).test(approach));
        assertFalse(AttributeFilter.date(EQUAL, day.plusDays(1)).test(approach));
    }

    @Test
    public void testMismatchedReferenceValueIsUnsupported() {
        assertThrows(UnsupportedCriterionException.class,
                () -> AttributeFilter.of(Criterion.DATE, EQUAL, 0.5));
        assertThrows(UnsupportedCriterionException.class,
                () -> AttributeFilter.of(Criterion.HAZARDOUS, EQUAL, "yes"));
        assertThrows(UnsupportedCriterionException.class,
                () -> AttributeFilter.of(Criterion.DISTANCE, LESS_OR_EQUAL, 1));
    }

    @Test
    public void testEqualityAndDescription() {
        assertEquals(AttributeFilter.distance(LESS_OR_EQUAL, 0.5), AttributeFilter.distance(LESS_OR_EQUAL, 0.5));
        assertEquals("AttributeFilter(DISTANCE <= 0.5)", AttributeFilter.distance(LESS_OR_EQUAL, 0.5).toString());
    }
}
