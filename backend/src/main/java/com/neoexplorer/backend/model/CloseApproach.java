package com.neoexplorer.backend.model;

import lombok.Getter;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

public class CloseApproach {

    @Getter
    private final String designation;

    @Getter
    private final LocalDateTime time;

    // au, NaN when unknown
    @Getter
    private final double distance;

    // km/s, NaN when unknown
    @Getter
    private final double velocity;

    // set once by NearEarthObject.attach
    private NearEarthObject neo;

    public CloseApproach(String designation, LocalDateTime time, Double distance, Double velocity) {
        this.designation = Objects.requireNonNull(designation, "designation");
        this.time = Objects.requireNonNull(time, "time");
        this.distance = nanIfUnset(distance);
        this.velocity = nanIfUnset(velocity);
    }

    public CloseApproach(String designation, String calendarDate, Double distance, Double velocity) {
        this(designation, ApproachTimes.parse(calendarDate), distance, velocity);
    }

    private static double nanIfUnset(Double value) {
        return value == null || value == 0.0 ? Double.NaN : value;
    }

    public Optional<NearEarthObject> getNeo() {
        return Optional.ofNullable(neo);
    }

    public boolean isLinked() {
        return neo != null;
    }

    public String getTimeString() {
        return ApproachTimes.format(time);
    }

    void linkTo(NearEarthObject owner) {
        if (neo != null) {
            throw new IllegalStateException("approach of " + designation + " at " + getTimeString()
                    + " is already linked");
        }
        neo = owner;
    }

    public ApproachView toView() {
        return new ApproachView(getTimeString(), distance, velocity);
    }

    @Override
    public String toString() {
        return String.format("CloseApproach(time=%s, distance=%.2f, velocity=%.2f, neo=%s)",
                getTimeString(), distance, velocity, neo == null ? designation : neo.getFullName());
    }
}
