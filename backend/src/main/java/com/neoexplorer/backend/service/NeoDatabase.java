package com.neoexplorer.backend.service;

import com.neoexplorer.backend.model.CloseApproach;
import com.neoexplorer.backend.model.NearEarthObject;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * In-memory database of near-Earth objects and their close approaches.
 * <p>
 * The constructor links every approach to the object sharing its designation.
 * After that the contents are read-only: lookups scan the objects, queries
 * stream the approaches in input order.
 */
@Slf4j
public class NeoDatabase {

    private final List<NearEarthObject> neos;
    private final List<CloseApproach> approaches;

    // throws DuplicateDesignationException if two objects share a designation
    public NeoDatabase(Collection<NearEarthObject> neos, Collection<CloseApproach> approaches) {
        this.neos = List.copyOf(Objects.requireNonNull(neos, "neos"));
        this.approaches = List.copyOf(Objects.requireNonNull(approaches, "approaches"));

        Map<String, NearEarthObject> byDesignation = new HashMap<>();
        for (NearEarthObject neo : this.neos) {
            if (byDesignation.putIfAbsent(neo.getDesignation(), neo) != null) {
                throw new DuplicateDesignationException(neo.getDesignation());
            }
        }

        int orphans = 0;
        for (CloseApproach approach : this.approaches) {
            NearEarthObject neo = byDesignation.get(approach.getDesignation());
            if (neo == null) {
                orphans++;
                continue;
            }
            neo.attach(approach);
        }
        this.neos.forEach(NearEarthObject::freeze);
        log.info("Linked {} close approaches to {} NEOs ({} without a matching NEO)",
                this.approaches.size() - orphans, this.neos.size(), orphans);
    }

    // exact match after upper-casing, e.g. "2020 fk" finds 2020 FK
    public Optional<NearEarthObject> getNeoByDesignation(String designation) {
        Objects.requireNonNull(designation, "designation");
        String wanted = designation.toUpperCase(Locale.ROOT);
        for (NearEarthObject neo : neos) {
            if (neo.getDesignation().equals(wanted)) {
                return Optional.of(neo);
            }
        }
        return Optional.empty();
    }

    // exact match after upper-casing the first letter only
    public Optional<NearEarthObject> getNeoByName(String name) {
        Objects.requireNonNull(name, "name");
        String wanted = capitalize(name);
        for (NearEarthObject neo : neos) {
            if (neo.getName().filter(wanted::equals).isPresent()) {
                return Optional.of(neo);
            }
        }
        return Optional.empty();
    }

    /**
     * Lazy stream of the approaches passing every filter, in input order.
     * Each call starts a new scan; no filters means every approach.
     */
    public Stream<CloseApproach> query(Collection<? extends Predicate<? super CloseApproach>> filters) {
        Objects.requireNonNull(filters, "filters");
        if (filters.isEmpty()) {
            return approaches.stream();
        }
        List<Predicate<? super CloseApproach>> conjunction = List.copyOf(filters);
        return approaches.stream().filter(approach -> matchesAll(approach, conjunction));
    }

    public Stream<CloseApproach> query() {
        return query(List.of());
    }

    public List<NearEarthObject> getNeos() {
        return neos;
    }

    public List<CloseApproach> getApproaches() {
        return approaches;
    }

    private static boolean matchesAll(CloseApproach approach, List<Predicate<? super CloseApproach>> filters) {
        for (Predicate<? super CloseApproach> filter : filters) {
            if (!filter.test(approach)) {
                return false;
            }
        }
        return true;
    }

    private static String capitalize(String name) {
        if (name.isEmpty()) {
            return name;
        }
        return name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1);
    }
}
