package com.neoexplorer.backend.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A near-Earth object identified by its primary designation.
 * <p>
 * Scalar attributes are fixed at construction. The list of close approaches is
 * filled once, while the owning {@code NeoDatabase} links approaches to objects,
 * and is frozen afterwards.
 */
public class NearEarthObject {

    @Getter
    private final String designation;

    private final String name;

    // kilometers, NaN when unknown
    @Getter
    private final double diameter;

    @Getter
    private final boolean hazardous;

    private final List<CloseApproach> approaches = new ArrayList<>();

    private boolean frozen;

    public NearEarthObject(String designation, String name, Double diameter, boolean hazardous) {
        this.designation = Objects.requireNonNull(designation, "designation");
        if (designation.isBlank()) {
            throw new IllegalArgumentException("designation must not be blank");
        }
        this.name = name == null || name.isBlank() ? null : name;
        this.diameter = diameter == null || diameter == 0.0 ? Double.NaN : diameter;
        this.hazardous = hazardous;
    }

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    // read-only, input order
    public List<CloseApproach> getApproaches() {
        return Collections.unmodifiableList(approaches);
    }

    public String getFullName() {
        return name == null ? designation : designation + " " + name;
    }

    /**
     * Link an approach to this object: set its back-reference and append it
     * to {@link #getApproaches()}. Only valid until {@link #freeze()}.
     *
     * @throws IllegalArgumentException if the designations differ
     * @throws IllegalStateException    if the approach is already linked or this object is frozen
     */
    public void attach(CloseApproach approach) {
        Objects.requireNonNull(approach, "approach");
        if (frozen) {
            throw new IllegalStateException("approaches of " + designation + " are frozen");
        }
        if (!designation.equals(approach.getDesignation())) {
            throw new IllegalArgumentException("approach for " + approach.getDesignation()
                    + " cannot be attached to " + designation);
        }
        approach.linkTo(this);
        approaches.add(approach);
    }

    // end of the load phase; attach is rejected from here on
    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public NeoView toView() {
        return new NeoView(designation, name == null ? "" : name, diameter, hazardous);
    }

    @Override
    public String toString() {
        return "NearEarthObject(designation=" + designation + ", name=" + name
                + ", diameter=" + String.format("%.3f", diameter) + ", hazardous=" + hazardous + ")";
    }
}
