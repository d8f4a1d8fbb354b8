package com.datalab;

import java.io.BufferedOutputStream;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datalab.export.ExportConfigurationException;
import com.datalab.export.ExportCoordinator;
import com.datalab.export.ExportOptions;
import com.datalab.export.ExportReport;
import com.datalab.export.ExportStreamException;
import com.datalab.export.ExportType;
import com.datalab.pairs.ContextMode;
import com.datalab.pairs.RoleStyle;
import com.datalab.runtime.AppConfig;
import com.datalab.store.LocalJsonlRecordSource;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "datalab-export",
        mixinStandardHelpOptions = true,
        version = "datalab-export 0.1.0",
        description = "Streams a derived training dataset as newline-delimited JSON.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_STREAM_FAILED = 1;
    static final int EXIT_BAD_REQUEST = 2;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "application.yml")
    String configPath;

    @Option(names = "--data-dir", description = "Data directory holding datasets.json and the .jsonl record files (overrides config and DATALAB_DATA_DIR)")
    Path dataDir;

    @Option(names = { "-o", "--output" }, description = "Write NDJSON to this file instead of stdout")
    Path output;

    @Option(names = "--type", description = "Export type: pairs, conversations, items, items_with_meta")
    String type;

    @Option(names = "--dataset-id", description = "Dataset to export; 0 exports conversations across all datasets", defaultValue = "0")
    long datasetId;

    @Option(names = "--split", description = "Conversation split: train, valid, test or all")
    String split;

    @Option(names = "--status", description = "Conversation status filter")
    String status;

    @Option(names = "--include-system", arity = "0..1", fallbackValue = "true", description = "Keep system messages in rendered context")
    Boolean includeSystem;

    @Option(names = "--context", description = "Prompt context for pairs: none, window or full")
    String context;

    @Option(names = "--context-turns", description = "User turns kept by --context window")
    Integer contextTurns;

    @Option(names = "--role-style", description = "Role rendering in context: labels or plain")
    String roleStyle;

    @Option(names = "--max-examples", description = "Stop after this many output lines (0 = unlimited)")
    Integer maxExamples;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = AppConfig.load(Path.of(configPath)).withEnvironment(System.getenv());
        Path resolvedDataDir = dataDir != null ? dataDir : Path.of(config.getStore().getDataDir());

        ExportOptions options;
        try {
            options = buildOptions(config.getExport());
        } catch (ExportConfigurationException e) {
            log.error("Export rejected: {}", e.getMessage());
            return EXIT_BAD_REQUEST;
        }
        log.info("Using config file: {}", configPath);
        log.info("Reading records from {}", resolvedDataDir.toAbsolutePath().normalize());

        ExportCoordinator coordinator = new ExportCoordinator(new LocalJsonlRecordSource(resolvedDataDir));
        OutputStream sink = openSink();
        try {
            ExportReport report = coordinator.streamExport(options, sink);
            log.info("Export finished mode={} lines={} records={} stopReason={} output={}",
                    report.mode(),
                    report.linesWritten(),
                    report.recordsRead(),
                    report.stopReason(),
                    output == null ? "stdout" : output);
            return EXIT_OK;
        } catch (ExportConfigurationException e) {
            log.error("Export rejected: {}", e.getMessage());
            return EXIT_BAD_REQUEST;
        } catch (ExportStreamException e) {
            if (e.failure() == ExportStreamException.Failure.SINK) {
                log.warn("Output closed by consumer after {} lines", e.linesWritten());
            } else {
                log.error("Export aborted after {} lines", e.linesWritten(), e);
            }
            return EXIT_STREAM_FAILED;
        } finally {
            closeSink(sink);
        }
    }

    ExportOptions buildOptions(AppConfig.ExportDefaults defaults) {
        return ExportOptions.builder()
                .type(ExportType.fromValue(type != null ? type : defaults.getType()))
                .datasetId(datasetId)
                .split(split != null ? split : defaults.getSplit())
                .status(status != null ? status : defaults.getStatus())
                .includeSystem(includeSystem != null ? includeSystem : defaults.isIncludeSystem())
                .context(ContextMode.fromValue(context != null ? context : defaults.getContext()))
                .contextTurns(contextTurns != null ? contextTurns : defaults.getContextTurns())
                .roleStyle(RoleStyle.fromValue(roleStyle != null ? roleStyle : defaults.getRoleStyle()))
                .maxExamples(maxExamples != null ? maxExamples : defaults.getMaxExamples())
                .build();
    }

    // PrintStream swallows write errors, so stdout is opened raw to notice a closed pipe.
    private OutputStream openSink() throws IOException {
        if (output == null) {
            return new BufferedOutputStream(new FileOutputStream(FileDescriptor.out));
        }
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        return new BufferedOutputStream(Files.newOutputStream(output));
    }

    private void closeSink(OutputStream sink) {
        try {
            if (output == null) {
                sink.flush();
            } else {
                sink.close();
            }
        } catch (IOException e) {
            log.warn("Unable to close export output {}", output == null ? "stdout" : output, e);
        }
    }
}
