package org.aid.app;

import org.aid.app.api.dto.AnalysisReport;
import org.aid.app.api.dto.PreparedData;
import org.aid.app.service.AidClusteringService;
import org.aid.config.ClusteringConfig;
import org.aid.config.ConfigLoader;
import org.aid.io.ResultWriter;
import org.aid.io.csv.IndicatorCsvReader;
import org.aid.io.json.JsonFeatureSource;
import org.aid.io.json.JsonFormat;
import org.aid.io.json.ModelStore;
import org.aid.model.FeatureMatrix;
import org.aid.model.IndicatorRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command-line entry point: runs the whole analysis on one input file and
 * writes the result tables (and optionally the fitted models) to a directory.
 *
 * Input is either a CSV of raw indicators (standardized here) or a JSON array
 * of already standardized feature vectors.
 */
@CommandLine.Command(name = "aid-clustering",
        mixinStandardHelpOptions = true,
        description = "Clusters countries by development indicators and ranks them for aid",
        exitCodeList = {"0: success", "1: invalid input or configuration", "2: usage error"})
public final class AnalysisRunner implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalysisRunner.class);

    @CommandLine.Parameters(index = "0", description = "Input file (.csv raw indicators or .json standardized features)")
    private Path input;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output directory (default: results)")
    private Path outputDir = Path.of("results");

    @CommandLine.Option(names = {"-c", "--config"}, description = "JSON file overriding clustering-defaults.json")
    private Path configFile;

    @CommandLine.Option(names = {"--id-column"}, description = "Record id column or field (default: country)")
    private String idColumn = "country";

    @CommandLine.Option(names = {"--format"}, description = "Table format: csv or json (default: csv)")
    private String format = "csv";

    @CommandLine.Option(names = {"--save-models"}, description = "Also write the fitted models as JSON")
    private boolean saveModels;

    public static void main(String[] args) {
        System.exit(new CommandLine(new AnalysisRunner()).execute(args));
    }

    @Override
    public Integer call() {
        try {
            String ext = switch (format.toLowerCase(Locale.ROOT)) {
                case "csv" -> ".csv";
                case "json" -> ".json";
                default -> throw new IllegalArgumentException("Unsupported table format: " + format);
            };

            ConfigLoader loader = new ConfigLoader();
            ClusteringConfig config = configFile == null ? loader.defaults() : loader.load(configFile);
            AidClusteringService service = new AidClusteringService(config);
            ModelStore store = new ModelStore();

            FeatureMatrix matrix;
            if (isJson(input)) {
                matrix = JsonFeatureSource.ofFile(input, new JsonFormat(idColumn, "features"), service.featureNames()).load();
            } else {
                List<IndicatorRecord> records = new IndicatorCsvReader(idColumn).read(input);
                PreparedData prepared = service.prepare(records);
                matrix = prepared.matrix();
                if (saveModels) {
                    store.save(prepared.scaler(), outputDir.resolve("models").resolve("scaler.json"));
                }
            }

            AnalysisReport report = service.analyze(matrix);

            ResultWriter writer = new ResultWriter();
            writer.writeAssignments(report.assignments(), outputDir.resolve("clustering_results" + ext));
            writer.writeProfiles(report.profiles(), outputDir.resolve("cluster_profiles" + ext));
            writer.writePriority(report.priority(), outputDir.resolve("priority_list" + ext));
            writer.writeClusterRanking(report.clusterRanking(), outputDir.resolve("cluster_ranking" + ext));
            writer.writeJson(report.kSearch(), outputDir.resolve("k_search.json"));
            writer.writeJson(List.of(report.centroidVsHierarchical(), report.centroidVsDensity()),
                    outputDir.resolve("agreement.json"));
            writer.writeJson(report.summaries(), outputDir.resolve("cluster_summaries.json"));
            writer.writeJson(report.focusIds(), outputDir.resolve("focus_countries.json"));

            if (saveModels) {
                Path models = outputDir.resolve("models");
                store.save(service.centroidModel(matrix, report.chosenK()), models.resolve("kmeans_model.json"));
                store.save(service.buildTree(matrix), models.resolve("hierarchical_tree.json"));
                store.save(service.densityModel(matrix), models.resolve("dbscan_model.json"));
            }

            log.info("Results for {} records written to {}", matrix.size(), outputDir.toAbsolutePath());
            return 0;
        } catch (IOException e) {
            log.error("I/O failure: {}", e.getMessage(), e);
            return 1;
        } catch (UncheckedIOException e) {
            log.error("I/O failure: {}", e.getMessage(), e.getCause());
            return 1;
        } catch (IllegalArgumentException e) {
            log.error("Analysis rejected: {}", e.getMessage());
            return 1;
        }
    }

    private static boolean isJson(Path file) {
        Path name = file.getFileName();
        return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith(".json");
    }
}
