package com.neoexplorer.backend.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.neoexplorer.backend.model.CloseApproach;
import com.neoexplorer.backend.model.NearEarthObject;
import com.neoexplorer.backend.model.raw.CadPayload;
import com.neoexplorer.backend.model.raw.NeoRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads near-Earth objects from the NEO CSV file and close approaches from the
 * close-approach JSON file.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NeoExtractor {

    private static final String DESIGNATION_FIELD = "des";
    private static final String CALENDAR_DATE_FIELD = "cd";
    private static final String DISTANCE_FIELD = "dist";
    private static final String VELOCITY_FIELD = "v_rel";

    private final CsvMapper csvMapper = new CsvMapper();

    private final ObjectMapper objectMapper;

    public List<NearEarthObject> loadNeos(Path neoCsvPath) {
        log.info("Loading NEOs from {}", neoCsvPath);
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<NearEarthObject> neos = new ArrayList<>();
        try (MappingIterator<NeoRecord> rows = csvMapper.readerFor(NeoRecord.class)
                .with(schema)
                .readValues(neoCsvPath.toFile())) {
            int row = 0;
            while (rows.hasNextValue()) {
                row++;
                neos.add(toNeo(rows.nextValue(), neoCsvPath, row));
            }
        } catch (IOException e) {
            throw new NeoDataException("Failed to read NEO file " + neoCsvPath, e);
        }
        log.info("Loaded {} NEOs", neos.size());
        return neos;
    }

    public List<CloseApproach> loadApproaches(Path cadJsonPath) {
        log.info("Loading close approaches from {}", cadJsonPath);
        CadPayload payload;
        try {
            payload = objectMapper.readValue(cadJsonPath.toFile(), CadPayload.class);
        } catch (IOException e) {
            throw new NeoDataException("Failed to read close approach file " + cadJsonPath, e);
        }

        List<String> fields = payload.getFields();
        int designation = fieldIndex(fields, DESIGNATION_FIELD, cadJsonPath);
        int calendarDate = fieldIndex(fields, CALENDAR_DATE_FIELD, cadJsonPath);
        int distance = fieldIndex(fields, DISTANCE_FIELD, cadJsonPath);
        int velocity = fieldIndex(fields, VELOCITY_FIELD, cadJsonPath);

        List<CloseApproach> approaches = new ArrayList<>(payload.getData().size());
        int row = 0;
        for (List<String> values : payload.getData()) {
            row++;
            if (values.size() != fields.size()) {
                throw new NeoDataException(cadJsonPath + " row " + row + ": expected " + fields.size()
                        + " values but found " + values.size());
            }
            try {
                approaches.add(new CloseApproach(
                        required(values.get(designation), DESIGNATION_FIELD, cadJsonPath, row),
                        required(values.get(calendarDate), CALENDAR_DATE_FIELD, cadJsonPath, row),
                        parseDouble(values.get(distance), DISTANCE_FIELD, cadJsonPath, row),
                        parseDouble(values.get(velocity), VELOCITY_FIELD, cadJsonPath, row)));
            } catch (DateTimeParseException e) {
                throw new NeoDataException(cadJsonPath + " row " + row + ": bad calendar date '"
                        + e.getParsedString() + "'", e);
            }
        }
        log.info("Loaded {} close approaches", approaches.size());
        return approaches;
    }

    private static NearEarthObject toNeo(NeoRecord record, Path path, int row) {
        log.debug("NEO row {}: {}", row, record);
        return new NearEarthObject(
                required(record.getDesignation(), "pdes", path, row),
                record.getName(),
                parseDouble(record.getDiameter(), "diameter", path, row),
                "Y".equalsIgnoreCase(trimToEmpty(record.getHazardous())));
    }

    private static int fieldIndex(List<String> fields, String field, Path path) {
        int index = fields.indexOf(field);
        if (index < 0) {
            throw new NeoDataException(path + ": missing field '" + field + "' in " + fields);
        }
        return index;
    }

    private static String required(String value, String field, Path path, int row) {
        if (trimToEmpty(value).isEmpty()) {
            throw new NeoDataException(path + " row " + row + ": missing " + field);
        }
        return value.trim();
    }

    private static Double parseDouble(String value, String field, Path path, int row) {
        String text = trimToEmpty(value);
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Double.valueOf(text);
        } catch (NumberFormatException e) {
            throw new NeoDataException(path + " row " + row + ": bad " + field + " '" + text + "'", e);
        }
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
