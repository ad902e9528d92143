package org.aid.io.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.aid.cluster.CentroidModel;
import org.aid.cluster.DensityModel;
import org.aid.cluster.MergeTree;
import org.aid.model.ScalerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Saves fitted models as JSON and reads them back.
 *
 * A reloaded model is equal in every value to the saved one, so
 * {@code predict} and {@code cut} give the same answers as before saving.
 */
public final class ModelStore {

    private static final Logger log = LoggerFactory.getLogger(ModelStore.class);

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public void save(CentroidModel model, Path file) throws IOException {
        write(model, file);
    }

    public void save(MergeTree tree, Path file) throws IOException {
        write(tree, file);
    }

    public void save(DensityModel model, Path file) throws IOException {
        write(model, file);
    }

    public void save(ScalerState scaler, Path file) throws IOException {
        write(scaler, file);
    }

    public CentroidModel loadCentroidModel(Path file) throws IOException {
        return read(file, CentroidModel.class);
    }

    public MergeTree loadMergeTree(Path file) throws IOException {
        return read(file, MergeTree.class);
    }

    public DensityModel loadDensityModel(Path file) throws IOException {
        return read(file, DensityModel.class);
    }

    public ScalerState loadScaler(Path file) throws IOException {
        return read(file, ScalerState.class);
    }

    private void write(Object value, Path file) throws IOException {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(file, "file must not be null");
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(file.toFile(), value);
        log.info("Saved {} to {}", value.getClass().getSimpleName(), file);
    }

    private <T> T read(Path file, Class<T> type) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        if (!Files.exists(file)) {
            throw new IOException("Model file does not exist: " + file);
        }
        T value = mapper.readValue(file.toFile(), type);
        log.debug("Loaded {} from {}", type.getSimpleName(), file);
        return value;
    }
}
