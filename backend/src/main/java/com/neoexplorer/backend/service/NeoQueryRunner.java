package com.neoexplorer.backend.service;

import com.neoexplorer.backend.config.QueryProperties;
import com.neoexplorer.backend.filter.AttributeFilter;
import com.neoexplorer.backend.filter.Filters;
import com.neoexplorer.backend.model.CloseApproach;
import com.neoexplorer.backend.model.NearEarthObject;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs the configured {@code neo.command} once the database is loaded.
 * <ul>
 *   <li>{@code inspect}: look up one object by {@code neo.inspect.designation} or {@code neo.inspect.name}</li>
 *   <li>{@code query}: filter close approaches by {@code neo.query.*}, then log them or write them to a file</li>
 *   <li>{@code none}: load only</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "neo.runner.enabled", havingValue = "true", matchIfMissing = true)
public class NeoQueryRunner implements ApplicationRunner {

    static final int DEFAULT_DISPLAY_LIMIT = 10;

    private final NeoDatabase database;

    private final QueryProperties queryProperties;

    private final ApproachWriter approachWriter;

    @Value("${neo.command:none}")
    private String command;

    @Value("${neo.inspect.designation:}")
    private String inspectDesignation;

    @Value("${neo.inspect.name:}")
    private String inspectName;

    @Value("${neo.inspect.verbose:false}")
    private boolean inspectVerbose;

    @Override
    public void run(ApplicationArguments args) {
        switch (command.trim().toLowerCase(Locale.ROOT)) {
            case "inspect":
                inspect(inspectDesignation, inspectName, inspectVerbose);
                break;
            case "query":
                query(queryProperties);
                break;
            case "none":
            case "":
                log.info("No command configured; {} NEOs and {} close approaches loaded",
                        database.getNeos().size(), database.getApproaches().size());
                break;
            default:
                throw new IllegalArgumentException("Unknown neo.command '" + command
                        + "', expected inspect, query or none");
        }
    }

    // designation takes precedence over name
    public Optional<NearEarthObject> inspect(String designation, String name, boolean verbose) {
        Optional<NearEarthObject> neo;
        if (designation != null && !designation.isBlank()) {
            neo = database.getNeoByDesignation(designation.trim());
        } else if (name != null && !name.isBlank()) {
            neo = database.getNeoByName(name.trim());
        } else {
            throw new IllegalArgumentException("inspect needs neo.inspect.designation or neo.inspect.name");
        }

        if (neo.isEmpty()) {
            log.warn("No matching NEOs exist in the database.");
            return neo;
        }
        NearEarthObject found = neo.get();
        log.info("NEO {} has a diameter of {} km and is {}potentially hazardous.",
                found.getFullName(), String.format("%.3f", found.getDiameter()), found.isHazardous() ? "" : "not ");
        if (verbose) {
            for (CloseApproach approach : found.getApproaches()) {
                log.info("- {}", describe(approach));
            }
        }
        return neo;
    }

    public int query(QueryProperties properties) {
        List<AttributeFilter> filters = Filters.create(properties.toCriteria());
        log.info("Querying close approaches with {}", filters);
        Stream<CloseApproach> results = database.query(filters);

        String outfile = properties.getOutfile();
        if (outfile != null && !outfile.isBlank()) {
            return approachWriter.write(Filters.limit(results, properties.getLimit()), Path.of(outfile.trim()));
        }

        Integer limit = properties.getLimit() == null ? DEFAULT_DISPLAY_LIMIT : properties.getLimit();
        List<CloseApproach> shown = Filters.limit(results, limit).collect(Collectors.toList());
        if (shown.isEmpty()) {
            log.info("No close approaches match the query.");
        }
        shown.forEach(approach -> log.info("{}", describe(approach)));
        return shown.size();
    }

    private static String describe(CloseApproach approach) {
        String who = approach.getNeo().map(NearEarthObject::getFullName).orElse(approach.getDesignation());
        return String.format("On %s, '%s' approaches Earth at a distance of %.2f au and a velocity of %.2f km/s.",
                approach.getTimeString(), who, approach.getDistance(), approach.getVelocity());
    }
}
