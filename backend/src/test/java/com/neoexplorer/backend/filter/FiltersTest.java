package com.neoexplorer.backend.filter;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.neoexplorer.backend.filter.ComparisonOperator.EQUAL;
import static com.neoexplorer.backend.filter.ComparisonOperator.GREATER_OR_EQUAL;
import static com.neoexplorer.backend.filter.ComparisonOperator.LESS_OR_EQUAL;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FiltersTest {

    @Test
    public void testNoCriteriaNoFilters() {
        assertTrue(Filters.create(FilterCriteria.none()).isEmpty());
    }

    @Test
    public void testOneFilterPerCriterionInFixedOrder() {
        LocalDate day = LocalDate.of(2020, 1, 1);
        FilterCriteria criteria = FilterCriteria.builder()
                .hazardous(false)
                .diameterMax(2.0)
                .diameterMin(1.0)
                .velocityMax(20.0)
                .velocityMin(10.0)
                .distanceMax(0.5)
                .distanceMin(0.1)
                .endDate(day.plusDays(30))
                .startDate(day)
                .date(day.plusDays(1))
                .build();

        List<AttributeFilter> expected = List.of(
                AttributeFilter.date(EQUAL, day.plusDays(1)),
                AttributeFilter.date(GREATER_OR_EQUAL, day),
                AttributeFilter.date(LESS_OR_EQUAL, day.plusDays(30)),
                AttributeFilter.distance(GREATER_OR_EQUAL, 0.1),
                AttributeFilter.distance(LESS_OR_EQUAL, 0.5),
                AttributeFilter.velocity(GREATER_OR_EQUAL, 10.0),
                AttributeFilter.velocity(LESS_OR_EQUAL, 20.0),
                AttributeFilter.diameter(GREATER_OR_EQUAL, 1.0),
                AttributeFilter.diameter(LESS_OR_EQUAL, 2.0),
                AttributeFilter.hazardous(false));
        assertEquals(expected, Filters.create(criteria));
    }

    @Test
    public void testZeroBoundsStillProduceFilters() {
        List<AttributeFilter> filters = Filters.create(FilterCriteria.builder().distanceMin(0.0).build());

        assertEquals(List.of(AttributeFilter.distance(GREATER_OR_EQUAL, 0.0)), filters);
    }

    @Test
    public void testLimitZeroOrNullPassesThrough() {
        Stream<Integer> stream = Stream.of(1, 2, 3);
        assertSame(stream, Filters.limit(stream, 0));

        assertEquals(List.of(1, 2, 3), Filters.limit(Stream.of(1, 2, 3), null).collect(Collectors.toList()));
    }

    @Test
    public void testLimitTruncates() {
        assertEquals(List.of(1, 2), Filters.limit(Stream.of(1, 2, 3), 2).collect(Collectors.toList()));
        assertEquals(List.of(1, 2, 3), Filters.limit(Stream.of(1, 2, 3), 5).collect(Collectors.toList()));
    }

    @Test
    public void testLimitIsLazy() {
        AtomicInteger pulled = new AtomicInteger();
        Stream<Integer> endless = Stream.iterate(0, i -> i + 1).peek(i -> pulled.incrementAndGet());

        assertEquals(List.of(0, 1, 2), Filters.limit(endless, 3).collect(Collectors.toList()));
        assertEquals(3, pulled.get());
    }

    @Test
    public void testNegativeLimitRejected() {
        assertThrows(IllegalArgumentException.class, () -> Filters.limit(Stream.of(1), -1));
    }
}
