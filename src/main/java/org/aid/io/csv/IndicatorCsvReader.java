package org.aid.io.csv;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.aid.error.DataShapeException;
import org.aid.model.IndicatorRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads raw indicator rows from a CSV file with a header line.
 *
 * country,child_mort,exports,...
 * Afghanistan,90.2,10.0,...
 *
 * The id column holds the record name; every other column must be numeric.
 * Empty cells are rejected: imputation is the caller's job.
 */
public final class IndicatorCsvReader {

    private static final Logger log = LoggerFactory.getLogger(IndicatorCsvReader.class);

    private final CsvMapper mapper = new CsvMapper();
    private final String idColumn;

    public IndicatorCsvReader(String idColumn) {
        if (idColumn == null || idColumn.isBlank()) {
            throw new IllegalArgumentException("idColumn must be non-empty");
        }
        this.idColumn = idColumn;
    }

    public List<IndicatorRecord> read(Path file) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<IndicatorRecord> records = read(in);
            log.info("Read {} indicator rows from {}", records.size(), file);
            return records;
        }
    }

    public List<IndicatorRecord> read(Reader in) throws IOException {
        Objects.requireNonNull(in, "in must not be null");
        CsvSchema schema = CsvSchema.emptySchema().withHeader();

        List<IndicatorRecord> out = new ArrayList<>();
        try (MappingIterator<Map<String, String>> rows =
                     mapper.readerForMapOf(String.class).with(schema).readValues(in)) {
            while (rows.hasNext()) {
                Map<String, String> row = rows.next();
                out.add(toRecord(row, out.size() + 1));
            }
        }
        if (out.isEmpty()) {
            throw new DataShapeException("CSV input has no data rows");
        }
        return out;
    }

    private IndicatorRecord toRecord(Map<String, String> row, int line) {
        String id = row.get(idColumn);
        if (id == null || id.isBlank()) {
            throw new DataShapeException("Missing '" + idColumn + "' in data row " + line);
        }
        Map<String, Double> values = new LinkedHashMap<>();
        for (Map.Entry<String, String> cell : row.entrySet()) {
            if (cell.getKey().equals(idColumn)) continue;
            String raw = cell.getValue() == null ? "" : cell.getValue().strip();
            if (raw.isEmpty()) {
                throw new DataShapeException("Empty value for '" + cell.getKey() + "' of " + id);
            }
            try {
                values.put(cell.getKey(), Double.parseDouble(raw));
            } catch (NumberFormatException e) {
                throw new DataShapeException("Non-numeric value '" + raw + "' for '" + cell.getKey() + "' of " + id, e);
            }
        }
        return new IndicatorRecord(id.strip(), values);
    }
}
