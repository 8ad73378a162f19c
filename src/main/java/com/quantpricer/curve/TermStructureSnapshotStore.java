package com.quantpricer.curve;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.quantpricer.exception.CurveSnapshotException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * Reads and writes the persisted term-structure snapshot.
 *
 * <p>Format: CSV with a header row. The {@code maturity} column holds years, the
 * {@code rate} column holds the zero rate in percent ({@code 3.25} means 3.25%/year).
 * Any other column (row index, tenor key) is ignored. Rows are sorted by maturity on load,
 * so the file itself need not be ordered.
 *
 * <p>The snapshot is rebuilt by an external refresh job; this store only reads what it
 * wrote and writes the same layout back.
 */
@Slf4j
@Component
public class TermStructureSnapshotStore {

    private static final double PERCENT = 100.0;

    private final CsvMapper csvMapper = new CsvMapper();

    /**
     * Loads a snapshot from a Spring resource (classpath:, file:, ...).
     */
    public TermStructure load(Resource resource) {
        if (!resource.exists()) {
            throw new CurveSnapshotException("Term-structure snapshot not found: " + resource.getDescription());
        }
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            TermStructure curve = read(reader);
            log.info("Loaded term structure with {} knots from {}", curve.size(), resource.getDescription());
            return curve;
        } catch (IOException e) {
            throw new CurveSnapshotException(
                    "Failed to read term-structure snapshot", resource.getDescription(), e);
        }
    }

    public TermStructure read(Reader reader) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<SnapshotRow> rows;
        try (MappingIterator<SnapshotRow> it =
                csvMapper.readerFor(SnapshotRow.class).with(schema).readValues(reader)) {
            rows = it.readAll();
        }

        List<CurvePoint> points = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            SnapshotRow row = rows.get(i);
            if (row.getMaturity() == null || row.getRate() == null) {
                throw new CurveSnapshotException("Snapshot row " + (i + 1) + " is missing maturity or rate");
            }
            points.add(new CurvePoint(row.getMaturity(), row.getRate() / PERCENT));
        }
        points.sort(Comparator.comparingDouble(CurvePoint::getMaturity));
        return TermStructure.of(points);
    }

    public String toCsv(TermStructure curve) {
        try {
            return csvMapper.writer(snapshotSchema()).writeValueAsString(toRows(curve));
        } catch (IOException e) {
            throw new CurveSnapshotException("Failed to serialize term structure", e);
        }
    }

    public void save(TermStructure curve, Path target) {
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            writer.write(toCsv(curve));
            log.info("Saved term structure with {} knots to {}", curve.size(), target);
        } catch (IOException e) {
            throw new CurveSnapshotException("Failed to write term-structure snapshot", target.toString(), e);
        }
    }

    private CsvSchema snapshotSchema() {
        return csvMapper.schemaFor(SnapshotRow.class).withHeader();
    }

    private static List<SnapshotRow> toRows(TermStructure curve) {
        List<SnapshotRow> rows = new ArrayList<>(curve.size());
        for (CurvePoint point : curve.points()) {
            rows.add(new SnapshotRow(point.getMaturity(), point.getRate() * PERCENT));
        }
        return rows;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"maturity", "rate"})
    static class SnapshotRow {
        private Double maturity;
        private Double rate;
    }
}
