package com.neoexplorer.backend.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.neoexplorer.backend.model.ApproachView;
import com.neoexplorer.backend.model.CloseApproach;
import com.neoexplorer.backend.model.NearEarthObject;
import com.neoexplorer.backend.model.NeoView;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.stream.Stream;

@Service
@RequiredArgsConstructor
@Slf4j
public class ApproachWriter {

    private final CsvMapper csvMapper = new CsvMapper();

    private final ObjectMapper objectMapper;

    // format follows the extension, .csv or .json; returns the number of approaches written
    public int write(Stream<CloseApproach> results, Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".csv")) {
            return writeCsv(results, path);
        }
        if (fileName.endsWith(".json")) {
            return writeJson(results, path);
        }
        throw new IllegalArgumentException("Unsupported output file extension: " + path);
    }

    public int writeCsv(Stream<CloseApproach> results, Path path) {
        CsvSchema schema = csvMapper.schemaFor(CsvRow.class).withHeader();
        int count = 0;
        try (SequenceWriter writer = csvMapper.writer(schema).writeValues(path.toFile())) {
            for (Iterator<CloseApproach> it = results.iterator(); it.hasNext(); ) {
                CloseApproach approach = it.next();
                writer.write(CsvRow.of(approach.toView(), neoView(approach)));
                count++;
            }
        } catch (IOException e) {
            throw new NeoDataException("Failed to write CSV results to " + path, e);
        }
        log.info("Wrote {} close approaches to {}", count, path);
        return count;
    }

    // object fields nested under "neo"
    public int writeJson(Stream<CloseApproach> results, Path path) {
        int count = 0;
        try (SequenceWriter writer = objectMapper.writer().writeValuesAsArray(path.toFile())) {
            for (Iterator<CloseApproach> it = results.iterator(); it.hasNext(); ) {
                CloseApproach approach = it.next();
                writer.write(new JsonRow(approach.toView(), neoView(approach)));
                count++;
            }
        } catch (IOException e) {
            throw new NeoDataException("Failed to write JSON results to " + path, e);
        }
        log.info("Wrote {} close approaches to {}", count, path);
        return count;
    }

    private static NeoView neoView(CloseApproach approach) {
        return approach.getNeo()
                .map(NearEarthObject::toView)
                .orElseGet(() -> NeoView.unknown(approach.getDesignation()));
    }

    @Getter
    @AllArgsConstructor
    @JsonPropertyOrder({"datetime_utc", "distance_au", "velocity_km_s",
            "designation", "name", "diameter_km", "potentially_hazardous"})
    static class CsvRow {

        @JsonProperty("datetime_utc")
        private final String datetimeUtc;

        @JsonProperty("distance_au")
        private final double distanceAu;

        @JsonProperty("velocity_km_s")
        private final double velocityKmS;

        private final String designation;

        private final String name;

        @JsonProperty("diameter_km")
        private final double diameterKm;

        // "True" / "False"
        @JsonProperty("potentially_hazardous")
        private final String potentiallyHazardous;

        static CsvRow of(ApproachView approach, NeoView neo) {
            return new CsvRow(approach.getDatetimeUtc(), approach.getDistanceAu(), approach.getVelocityKmS(),
                    neo.getDesignation(), neo.getName(), neo.getDiameterKm(),
                    neo.isPotentiallyHazardous() ? "True" : "False");
        }
    }

    @Getter
    @AllArgsConstructor
    static class JsonRow {

        @JsonUnwrapped
        private final ApproachView approach;

        @JsonProperty("neo")
        private final NeoView neo;
    }
}
