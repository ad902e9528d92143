package org.aid.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.aid.model.ClusterAssignment;
import org.aid.model.ClusterProfile;
import org.aid.priority.ClusterPriority;
import org.aid.priority.PriorityEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Writes result tables as flat JSON arrays or CSV, picked by file extension
 * ({@code .csv} is CSV, anything else JSON). Rows keep the order they are given in.
 */
public final class ResultWriter {

    private static final Logger log = LoggerFactory.getLogger(ResultWriter.class);

    private final ObjectMapper json = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final CsvMapper csv = new CsvMapper();

    /**
     * One row per record: its id and one label column per assignment, named
     * after the algorithm. All assignments must cover the same ids in the same order.
     */
    public void writeAssignments(List<ClusterAssignment> assignments, Path file) throws IOException {
        Objects.requireNonNull(assignments, "assignments must not be null");
        if (assignments.isEmpty()) {
            throw new IllegalArgumentException("at least one assignment is required");
        }
        List<String> ids = assignments.get(0).ids();
        List<String> columns = new ArrayList<>();
        columns.add("id");
        for (ClusterAssignment a : assignments) {
            if (!a.ids().equals(ids)) {
                throw new IllegalArgumentException("assignment " + a.algorithm() + " covers different records");
            }
            columns.add(a.algorithm());
        }

        List<Map<String, Object>> rows = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", ids.get(i));
            for (ClusterAssignment a : assignments) {
                row.put(a.algorithm(), a.label(i));
            }
            rows.add(row);
        }
        writeTable(columns, rows, file);
    }

    /**
     * One row per cluster (noise included as -1): size and the mean of every feature.
     */
    public void writeProfiles(Map<Integer, ClusterProfile> profiles, Path file) throws IOException {
        Objects.requireNonNull(profiles, "profiles must not be null");
        List<String> columns = new ArrayList<>(List.of("cluster", "size"));
        List<Map<String, Object>> rows = new ArrayList<>();
        for (ClusterProfile p : profiles.values()) {
            if (columns.size() == 2) {
                for (String f : p.featureNames()) columns.add("mean_" + f);
                for (String f : p.featureNames()) columns.add("spread_" + f);
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("cluster", p.clusterId());
            row.put("size", p.size());
            p.meansByFeature().forEach((f, v) -> row.put("mean_" + f, v));
            p.spreadsByFeature().forEach((f, v) -> row.put("spread_" + f, v));
            rows.add(row);
        }
        writeTable(columns, rows, file);
    }

    public void writePriority(List<PriorityEntry> entries, Path file) throws IOException {
        Objects.requireNonNull(entries, "entries must not be null");
        List<String> columns = List.of("rank", "id", "cluster", "score", "cluster_score", "tier");
        List<Map<String, Object>> rows = new ArrayList<>(entries.size());
        int rank = 1;
        for (PriorityEntry e : entries) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("rank", rank++);
            row.put("id", e.id());
            row.put("cluster", e.clusterId());
            row.put("score", e.score());
            row.put("cluster_score", Double.isNaN(e.clusterScore()) ? null : e.clusterScore());
            row.put("tier", e.tier().name());
            rows.add(row);
        }
        writeTable(columns, rows, file);
    }

    public void writeClusterRanking(List<ClusterPriority> clusters, Path file) throws IOException {
        Objects.requireNonNull(clusters, "clusters must not be null");
        List<String> columns = List.of("cluster", "size", "score", "tier");
        List<Map<String, Object>> rows = new ArrayList<>(clusters.size());
        for (ClusterPriority c : clusters) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("cluster", c.clusterId());
            row.put("size", c.size());
            row.put("score", c.score());
            row.put("tier", c.tier().name());
            rows.add(row);
        }
        writeTable(columns, rows, file);
    }

    /**
     * Any value Jackson can serialize, as a single JSON document.
     */
    public void writeJson(Object value, Path file) throws IOException {
        Objects.requireNonNull(value, "value must not be null");
        createParent(file);
        json.writeValue(file.toFile(), value);
        log.info("Wrote {}", file);
    }

    private void writeTable(List<String> columns, List<Map<String, Object>> rows, Path file) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        createParent(file);
        if (isCsv(file)) {
            CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
            for (String c : columns) {
                schema.addColumn(c);
            }
            try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                 SequenceWriter seq = csv.writer(schema.build()).writeValues(out)) {
                seq.writeAll(rows);
            }
        } else {
            json.writeValue(file.toFile(), rows);
        }
        log.info("Wrote {} rows to {}", rows.size(), file);
    }

    private static boolean isCsv(Path file) {
        Path name = file.getFileName();
        return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith(".csv");
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
