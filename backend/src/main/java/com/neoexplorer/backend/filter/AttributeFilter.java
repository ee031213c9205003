package com.neoexplorer.backend.filter;

import com.neoexplorer.backend.model.CloseApproach;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.LocalDate;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Evaluates {@code criterion(approach) operator value} for a close approach.
 * Instances are immutable.
 */
@Getter
@EqualsAndHashCode
public final class AttributeFilter implements Predicate<CloseApproach> {

    private final Criterion criterion;
    private final ComparisonOperator operator;
    private final Object value;

    private AttributeFilter(Criterion criterion, ComparisonOperator operator, Object value) {
        this.criterion = criterion;
        this.operator = operator;
        this.value = value;
    }

    // throws UnsupportedCriterionException if value is not of the criterion's type
    public static AttributeFilter of(Criterion criterion, ComparisonOperator operator, Object value) {
        Objects.requireNonNull(criterion, "criterion");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(value, "value");
        if (!criterion.supports(value)) {
            throw new UnsupportedCriterionException(criterion + " cannot compare against "
                    + value.getClass().getSimpleName() + " value " + value);
        }
        return new AttributeFilter(criterion, operator, value);
    }

    public static AttributeFilter distance(ComparisonOperator operator, double au) {
        return of(Criterion.DISTANCE, operator, au);
    }

    public static AttributeFilter velocity(ComparisonOperator operator, double kmPerSecond) {
        return of(Criterion.VELOCITY, operator, kmPerSecond);
    }

    public static AttributeFilter diameter(ComparisonOperator operator, double km) {
        return of(Criterion.DIAMETER, operator, km);
    }

    public static AttributeFilter hazardous(boolean hazardous) {
        return of(Criterion.HAZARDOUS, ComparisonOperator.EQUAL, hazardous);
    }

    public static AttributeFilter date(ComparisonOperator operator, LocalDate date) {
        return of(Criterion.DATE, operator, date);
    }

    @Override
    public boolean test(CloseApproach approach) {
        return criterion.matches(approach, operator, value);
    }

    @Override
    public String toString() {
        return "AttributeFilter(" + criterion + " " + operator.getSymbol() + " " + value + ")";
    }
}
