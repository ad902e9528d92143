package org.aid.io.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.aid.error.DataShapeException;
import org.aid.io.FeatureMatrixSource;
import org.aid.model.FeatureMatrix;
import org.aid.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * JSON implementation of FeatureMatrixSource, read with the Jackson streaming
 * parser.
 *
 * Expected JSON shape: array of objects, one per record, in record order
 * [
 *   { "country": "Chad",  "features": [ ... ] },
 *   { "country": "Japan", "features": [ ... ] }
 * ]
 *
 * Feature names are not part of the file; the caller supplies them and every
 * vector must have exactly that many values.
 */
public final class JsonFeatureSource implements FeatureMatrixSource {

    private static final Logger log = LoggerFactory.getLogger(JsonFeatureSource.class);

    private final String name;
    private final InputStreamSupplier streamSupplier;
    private final JsonFormat format;
    private final List<String> featureNames;

    // Cached after first load
    private volatile FeatureMatrix cached;

    private final Object lock = new Object();

    public JsonFeatureSource(String name,
                             InputStreamSupplier streamSupplier,
                             JsonFormat format,
                             List<String> featureNames) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must be non-empty");
        }
        this.name = name;
        this.streamSupplier = Objects.requireNonNull(streamSupplier, "streamSupplier must not be null");
        this.format = Objects.requireNonNull(format, "format must not be null");
        this.featureNames = List.copyOf(Objects.requireNonNull(featureNames, "featureNames must not be null"));
    }

    public static JsonFeatureSource ofFile(Path file, JsonFormat format, List<String> featureNames) {
        Objects.requireNonNull(file, "file must not be null");
        return new JsonFeatureSource(file.toString(), () -> Files.newInputStream(file), format, featureNames);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public FeatureMatrix load() {
        FeatureMatrix local = cached;
        if (local != null) {
            return local;
        }

        synchronized (lock) {
            if (cached != null) {
                return cached;
            }
            this.cached = loadOnce();
            log.info("Loaded {} from {}", cached, name);
            return this.cached;
        }
    }

    @Override
    public OptionalInt dimension() {
        FeatureMatrix m = cached;
        return (m == null) ? OptionalInt.empty() : OptionalInt.of(m.dim());
    }

    private FeatureMatrix loadOnce() {
        JsonFactory factory = new JsonFactory();

        List<String> ids = new ArrayList<>();
        List<FeatureVector> rows = new ArrayList<>();

        try (InputStream in = streamSupplier.open();
             JsonParser p = factory.createParser(in)) {

            if (p.nextToken() != JsonToken.START_ARRAY) {
                throw new DataShapeException("JSON must start with an array of objects");
            }

            while (p.nextToken() != JsonToken.END_ARRAY) {
                if (p.currentToken() != JsonToken.START_OBJECT) {
                    throw new DataShapeException("Expected an object inside the array");
                }

                String id = null;
                double[] values = null;

                while (p.nextToken() != JsonToken.END_OBJECT) {
                    String field = p.currentName();
                    p.nextToken(); // move to value

                    if (format.idField().equals(field)) {
                        id = p.getValueAsString(null);
                    } else if (format.vectorField().equals(field)) {
                        values = readDoubleArray(p);
                    } else {
                        p.skipChildren();
                    }
                }

                if (id == null || id.isBlank()) {
                    throw new DataShapeException("Missing/blank id field '" + format.idField() + "' at record " + ids.size());
                }
                if (values == null) {
                    throw new DataShapeException("Missing vector field '" + format.vectorField() + "' for id: " + id);
                }
                if (values.length == 0) {
                    throw new DataShapeException("Vector must not be empty for id: " + id);
                }
                ids.add(id);
                rows.add(new FeatureVector(values));
            }

            if (ids.isEmpty()) {
                throw new DataShapeException("JSON array is empty in '" + name + "'");
            }

            // shape rules (dimension, duplicates) are enforced by the matrix itself
            return new FeatureMatrix(ids, rows, featureNames);

        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read JSON features from '" + name + "'", e);
        }
    }

    private static double[] readDoubleArray(JsonParser p) throws IOException {
        if (p.currentToken() != JsonToken.START_ARRAY) {
            throw new DataShapeException("Vector field must be a JSON array of numbers");
        }

        double[] buffer = new double[16];
        int size = 0;

        while (p.nextToken() != JsonToken.END_ARRAY) {
            if (!p.currentToken().isNumeric()) {
                throw new DataShapeException("Vector array must contain numbers only");
            }
            if (size == buffer.length) {
                buffer = Arrays.copyOf(buffer, size * 2);
            }
            buffer[size++] = p.getDoubleValue();
        }

        return Arrays.copyOf(buffer, size);
    }

    /**
     * Lets callers provide a file stream, a classpath resource or an in-memory buffer.
     */
    @FunctionalInterface
    public interface InputStreamSupplier {
        InputStream open() throws IOException;
    }
}
