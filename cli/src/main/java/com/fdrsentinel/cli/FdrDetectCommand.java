package com.fdrsentinel.cli;

import com.fdrsentinel.core.config.DetectionConfig;
import com.fdrsentinel.core.config.DetectionConfigLoader;
import com.fdrsentinel.core.detection.DetectionStrategy;
import com.fdrsentinel.core.detection.DetectorFactory;
import com.fdrsentinel.core.detection.FlightAnomalyDetector;
import com.fdrsentinel.core.model.DetectionResult;
import com.fdrsentinel.core.model.FlightTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * {@code fdr-detect}: run unsupervised anomaly detection on a CSV flight log.
 *
 * <p>
 * Prints the JSON report to standard output and exits 0, or prints
 * {@code Error: <message>} to standard error and exits 1. Logging goes to
 * standard error only.
 * </p>
 *
 * @since 1.0.0
 */
@CommandLine.Command(name = "fdr-detect",
        mixinStandardHelpOptions = true,
        version = "fdr-detect 1.0.0",
        description = "Run unsupervised FDR anomaly detection on a CSV file with a time column.")
public class FdrDetectCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(FdrDetectCommand.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "<path>",
            description = "Path to a CSV file with a time column.")
    private Path path;

    @CommandLine.Option(names = {"-s", "--strategy"}, defaultValue = "reconstruction",
            description = "Detection strategy: reconstruction or robust (default: ${DEFAULT-VALUE}).")
    private String strategy;

    @CommandLine.Option(names = {"-c", "--config"},
            description = "YAML detection settings; defaults to $FDR_CONFIG_PATH, then the environment.")
    private Path config;

    @CommandLine.Option(names = {"--debug"}, description = "Include debugInfo in the report.")
    private boolean debug;

    private final Map<String, String> environment;

    public FdrDetectCommand() {
        this(System.getenv());
    }

    FdrDetectCommand(Map<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new FdrDetectCommand()).execute(args));
    }

    @Override
    public Integer call() {
        try {
            DetectionConfig detectionConfig = resolveConfig();
            FlightAnomalyDetector detector = DetectorFactory.create(
                    DetectionStrategy.fromName(strategy), detectionConfig);
            FlightTable table = new CsvFlightTableLoader().load(path);
            DetectionResult result = detector.detect(table);
            LOG.info("Detection used backend {}", result.getBackend());
            spec.commandLine().getOut().println(new ResultJsonWriter().write(result));
            spec.commandLine().getOut().flush();
            return 0;
        } catch (Exception e) {
            LOG.debug("Detection failed", e);
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            spec.commandLine().getErr().flush();
            return 1;
        }
    }

    private DetectionConfig resolveConfig() {
        DetectionConfig base = config != null
                ? DetectionConfigLoader.fromFile(config.toString(), DetectionConfig.fromEnvironment(environment))
                : DetectionConfigLoader.load(environment);
        return debug ? base.toBuilder().debug(true).build() : base;
    }
}
