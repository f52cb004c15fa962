package com.file.dedup.cli;

import com.file.dedup.api.ConsolidationMode;
import com.file.dedup.api.ConsolidationReport;
import com.file.dedup.api.ConsolidationService;
import com.file.dedup.api.DetectionOptions;
import com.file.dedup.api.DetectionResult;
import com.file.dedup.api.DuplicateDetector;
import com.file.dedup.api.GroupPlan;
import com.file.dedup.audit.InMemoryOperationRepository;
import com.file.dedup.audit.JsonLinesOperationRepository;
import com.file.dedup.audit.OperationLog;
import com.file.dedup.cache.CaffeineSignatureCache;
import com.file.dedup.core.model.DuplicateGroup;
import com.file.dedup.core.model.MoveOperation;
import com.file.dedup.core.model.SimilarityEdge;
import com.file.dedup.discovery.ScanConfig;
import com.file.dedup.metrics.MicrometerMetricsService;
import com.file.dedup.move.MoveConfig;
import com.file.dedup.retention.RetentionConfig;
import com.file.dedup.signature.SignatureConfig;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;

/**
 * Command-line interface for the near-duplicate detector.
 * <p>
 * Usage:
 * java -jar file-dedup.jar [options] &lt;file-or-directory&gt;...
 * <p>
 * Exit codes: 0 success or no duplicates, 1 consolidation aborted, 2 invalid arguments,
 * 3 I/O error while scanning, 130 cancelled.
 */
@Command(name = "file-dedup", mixinStandardHelpOptions = true, version = "file-dedup 1.0.0",
        description = "Finds near-duplicate text files and consolidates them")
@SuppressWarnings("java:S106")
public class DedupCLI implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_ABORTED = 1;
    static final int EXIT_INVALID = 2;
    static final int EXIT_IO_ERROR = 3;
    static final int EXIT_CANCELLED = 130;

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "<path>", description = "Files or directories to scan")
    private List<Path> paths = new ArrayList<>();

    @Option(names = {"-t", "--threshold"}, description = "Similarity threshold in (0, 1] (default: ${DEFAULT-VALUE})",
            paramLabel = "<t>")
    private double threshold = 0.85;

    @Option(names = "--num-perm", description = "Signature size (default: ${DEFAULT-VALUE})", paramLabel = "<n>")
    private int numPermutations = SignatureConfig.DEFAULT_NUM_PERMUTATIONS;

    @Option(names = "--shingle-size", description = "Shingle width in characters (default: ${DEFAULT-VALUE})",
            paramLabel = "<k>")
    private int shingleSize = SignatureConfig.DEFAULT_SHINGLE_SIZE;

    @Option(names = "--min-printable-ratio",
            description = "Minimum share of printable characters (default: ${DEFAULT-VALUE})", paramLabel = "<r>")
    private double minPrintableRatio = ScanConfig.DEFAULT_MIN_PRINTABLE_RATIO;

    @Option(names = "--extensions", split = ",",
            description = "Allowed extensions, comma separated (default: .txt,.md,.log,.csv; '*' for any)",
            paramLabel = "<ext>")
    private List<String> extensions;

    @Option(names = "--holding-dir", description = "Directory receiving moved duplicates (default: ${DEFAULT-VALUE})",
            paramLabel = "<dir>")
    private Path holdingDir = MoveConfig.DEFAULT_HOLDING_DIR;

    @Option(names = "--flat-holding", description = "Do not preserve the directory structure in the holding area")
    private boolean flatHolding;

    @Option(names = "--group-dirs", description = "Place each group in its own group_<id> directory")
    private boolean groupDirectories;

    @Option(names = "--base-dir", description = "Base directory for relative layouts and symlink containment",
            paramLabel = "<dir>")
    private Path baseDir;

    @Option(names = "--retention",
            description = "Keeper strategy: newest, oldest, largest, smallest, shortest-relative-path (default: ${DEFAULT-VALUE})",
            paramLabel = "<strategy>")
    private String retention = "newest";

    @Option(names = "--priority-paths", split = ",", description = "Glob patterns preferred as keepers, in order",
            paramLabel = "<glob>")
    private List<String> priorityPaths = new ArrayList<>();

    @Option(names = "--priority-first", description = "Apply priority paths before the retention strategy")
    private boolean priorityFirst;

    @Option(names = "--follow-symlinks", description = "Follow symbolic links")
    private boolean followSymlinks;

    @Option(names = "--max-symlink-depth", description = "Maximum symlink chain length (default: ${DEFAULT-VALUE})",
            paramLabel = "<n>")
    private int maxSymlinkDepth = 10;

    @Option(names = "--include-empty", description = "Include empty files")
    private boolean includeEmpty;

    @Option(names = "--max-workers", description = "Worker threads for signing large files", paramLabel = "<n>")
    private Integer maxWorkers;

    @Option(names = "--mode", description = "What to do with duplicates: move, delete, report (default: ${DEFAULT-VALUE})",
            paramLabel = "<mode>")
    private String mode = "report";

    @Option(names = "--dry-run", description = "Show what would happen without changing any file")
    private boolean dryRun;

    @Option(names = "--operation-log", description = "Append a JSON line per file operation to this file",
            paramLabel = "<file>")
    private Path operationLogFile;

    @Option(names = "--stats", description = "Print run statistics")
    private boolean stats;

    @Override
    public Integer call() throws Exception {
        ConsolidationMode consolidationMode = ConsolidationMode.fromName(mode);
        DetectionOptions options = buildOptions();
        PrintWriter out = spec.commandLine().getOut();

        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MicrometerMetricsService metrics = new MicrometerMetricsService(registry);
        CaffeineSignatureCache cache = new CaffeineSignatureCache(options.getCacheConfig());
        OperationLog operationLog = new OperationLog(operationLogFile != null
                ? new JsonLinesOperationRepository(operationLogFile)
                : new InMemoryOperationRepository());

        try (DuplicateDetector detector = DuplicateDetector.builder()
                .options(options)
                .signatureCache(cache)
                .metricsService(metrics)
                .build()) {
            DetectionResult result = detector.detect(paths);
            printGroups(out, result);

            ConsolidationService service = ConsolidationService.builder()
                    .options(options)
                    .operationLog(operationLog)
                    .metricsService(metrics)
                    .listener(cache)
                    .build();
            ConsolidationReport report = service.consolidate(result, consolidationMode);
            printReport(out, report);
            if (stats) {
                printStats(out, registry);
            }
            return report.isSuccessful() ? EXIT_OK : EXIT_ABORTED;
        }
    }

    DetectionOptions buildOptions() {
        ScanConfig.Builder scan = ScanConfig.builder()
                .minPrintableRatio(minPrintableRatio)
                .skipEmpty(!includeEmpty)
                .followSymlinks(followSymlinks)
                .maxSymlinkDepth(maxSymlinkDepth)
                .symlinkBoundary(baseDir);
        if (extensions != null) {
            if (extensions.contains("*")) {
                scan.anyExtension();
            } else {
                scan.allowedExtensions(extensions);
            }
        }

        SignatureConfig.Builder signature = SignatureConfig.builder()
                .numPermutations(numPermutations)
                .shingleSize(shingleSize);
        if (maxWorkers != null) {
            signature.workers(maxWorkers);
        }

        return DetectionOptions.builder()
                .threshold(threshold)
                .scanConfig(scan.build())
                .signatureConfig(signature.build())
                .retentionConfig(RetentionConfig.builder()
                        .strategy(retention)
                        .priorityPatterns(priorityPaths)
                        .priorityFirst(priorityFirst)
                        .baseDir(baseDir)
                        .build())
                .moveConfig(MoveConfig.builder()
                        .holdingDir(holdingDir)
                        .preserveStructure(!flatHolding)
                        .perGroupDirectories(groupDirectories)
                        .baseDir(baseDir)
                        .dryRun(dryRun)
                        .build())
                .build();
    }

    private static void printGroups(PrintWriter out, DetectionResult result) {
        out.printf("Scanned %d files, %d signed, %d duplicate groups%n",
                result.files().size(), result.signedCount(), result.groups().size());
        for (DuplicateGroup group : result.groups()) {
            out.printf("%nGroup %d (%d files, similarity %.2f)%n", group.id(), group.size(), group.similarity());
            for (Path file : group.files()) {
                out.printf("  %s%n", file);
            }
            for (SimilarityEdge edge : result.graph().pairwiseSimilarities(group.files())) {
                out.printf("    %.2f%s  %s <-> %s%n", edge.weight(), edge.inherited() ? "*" : " ",
                        edge.first().getFileName(), edge.second().getFileName());
            }
        }
    }

    private static void printReport(PrintWriter out, ConsolidationReport report) {
        if (report.status() == ConsolidationReport.Status.NO_DUPLICATES) {
            out.println("No duplicates found.");
            return;
        }
        out.println();
        for (GroupPlan plan : report.plans()) {
            out.printf("Group %d: keep %s (%s)%n", plan.group().id(),
                    plan.decision().keeper().path(), plan.decision().reason());
            if (plan.moves().isEmpty()) {
                plan.decision().removalPaths().forEach(p -> out.printf("  remove %s%n", p));
            }
            for (MoveOperation move : plan.moves()) {
                out.printf("  move %s -> %s%n", move.getSource(), move.getDestination());
            }
        }
        out.printf("%nStatus: %s, %d files, %d bytes%n", report.status(), report.filesAffected(), report.bytesAffected());
        for (String failure : report.failures()) {
            out.printf("  failure: %s%n", failure);
        }
    }

    private static void printStats(PrintWriter out, SimpleMeterRegistry registry) {
        out.println();
        for (Meter meter : registry.getMeters()) {
            meter.measure().forEach(m -> out.printf("%s %s=%s%n",
                    meter.getId().getName(), m.getStatistic().getTagValueRepresentation(), m.getValue()));
        }
    }

    /**
     * Creates a command line with the exit-code mapping used by {@link #main(String[])}.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new DedupCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_INVALID;
            } else if (ex instanceof IOException || ex instanceof UncheckedIOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO_ERROR;
            } else if (ex instanceof CancellationException) {
                commandLine.getErr().println("Cancelled: " + ex.getMessage());
                return EXIT_CANCELLED;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return EXIT_ABORTED;
            }
        });

        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return EXIT_INVALID;
        });
        return cmd;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
