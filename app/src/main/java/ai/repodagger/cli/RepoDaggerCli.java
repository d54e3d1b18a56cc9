package ai.repodagger.cli;

import ai.repodagger.DaggerException;
import ai.repodagger.RepoDagger;
import ai.repodagger.config.ConfigLoader;
import ai.repodagger.util.ExecutorServiceUtil;
import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.file.Path;
import java.text.ParseException;
import java.util.List;
import java.util.concurrent.Callable;
import jdk.jfr.Configuration;
import jdk.jfr.Recording;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.VisibleForTesting;
import picocli.CommandLine;

@CommandLine.Command(
        name = "repo-dagger",
        versionProvider = RepoDaggerCli.VersionProvider.class,
        description = "Computes content hashes of input files and everything they transitively depend on.")
public final class RepoDaggerCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(RepoDaggerCli.class);

    public static final String VERSION = "1.4.0";
    static final Path PROFILE_FILE = Path.of("repo_dagger.jfr");

    @CommandLine.Option(names = "-config", required = true, description = "Path to config file")
    private Path config;

    @CommandLine.Option(names = "-verbose", description = "Verbose output")
    private boolean verbose;

    @CommandLine.Option(
            names = "-input-files",
            description = "Comma separated list of input files (overrides config)")
    private String inputFiles = "";

    @CommandLine.Option(names = "-print-dep-stats", description = "Print forward dependency statistics")
    private boolean printDepStats;

    @CommandLine.Option(names = "-print-rev-dep-stats", description = "Print reverse dependency statistics")
    private boolean printRevDepStats;

    @CommandLine.Option(
            names = "-stats-sort",
            defaultValue = "count",
            description = "Sort statistics by 'count' or 'name'")
    private StatsSort statsSort = StatsSort.COUNT;

    @CommandLine.Option(names = "-self-profile", description = "Record a flight recording into 'repo_dagger.jfr'")
    private boolean selfProfile;

    @CommandLine.Option(names = "-out-dep-hashes", description = "Output dependency hashes to the specified file")
    @Nullable
    private Path outDepHashes;

    @CommandLine.Option(names = "-out-relations", description = "Output relations to the specified file")
    @Nullable
    private Path outRelations;

    @CommandLine.Option(
            names = "-out-recursive-deps",
            description = "Output recursive dependencies of the input file specified in '-out-recursive-deps-for' "
                    + "to the specified file")
    @Nullable
    private Path outRecursiveDeps;

    @CommandLine.Option(
            names = "-out-recursive-deps-for",
            description = "Output recursive dependencies for the specified input file to the file specified in "
                    + "'-out-recursive-deps'")
    @Nullable
    private String outRecursiveDepsFor;

    @CommandLine.Option(
            names = "-hash-salt",
            description = "Include this string in the dependency hash calculation. Use for cache busting.")
    private String hashSalt = "";

    @CommandLine.Option(
            names = {"-v", "-version"},
            versionHelp = true,
            description = "Print version and exit")
    private boolean versionRequested;

    @CommandLine.Option(
            names = {"-h", "-help"},
            usageHelp = true,
            description = "Show this help message and exit")
    private boolean helpRequested;

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /** A configured command line; tests execute through this too. */
    @VisibleForTesting
    static CommandLine commandLine() {
        return new CommandLine(new RepoDaggerCli())
                .setPosixClusteredShortOptionsAllowed(false)
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        if ((outRecursiveDeps == null) != (outRecursiveDepsFor == null)) {
            logger.error("Error: both -out-recursive-deps and -out-recursive-deps-for must be specified together");
            return 1;
        }
        if (verbose) {
            Configurator.setRootLevel(Level.DEBUG);
        }

        Recording recording = null;
        try {
            if (selfProfile) {
                recording = startProfile();
            }
            return run();
        } catch (DaggerException e) {
            logger.error("Error: {}", e.getMessage());
            logger.debug("Failure details", e);
            return 1;
        } catch (IOException e) {
            logger.error("Error: {}", e.toString());
            return 1;
        } catch (IllegalStateException e) {
            // a failed hashing worker
            logger.error("Error: {}", e.getMessage());
            logger.debug("Failure details", e);
            return 1;
        } finally {
            if (recording != null) {
                stopProfile(recording);
            }
        }
    }

    private int run() throws DaggerException, IOException {
        logger.info("Loading Config: {}", config);
        var loaded = ConfigLoader.load(config);
        var overrides = Splitter.on(',').trimResults().omitEmptyStrings().splitToList(inputFiles);
        if (!overrides.isEmpty()) {
            loaded = loaded.withConfig(loaded.config().withInputs(overrides));
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Config:\n{}", ConfigLoader.describe(loaded.config()));
        }
        logger.info("Base Directory: {}", loaded.baseDir());

        var dagger = new RepoDagger(loaded);
        List<String> inputs = dagger.collectInputFiles();
        if (inputs.isEmpty()) {
            logger.info("No input files found. Exiting.");
            return 0;
        }

        var graph = dagger.buildGraph(inputs);
        if (outRelations != null) {
            logger.info("Writing relations to: {}", outRelations);
            JsonOutputs.write(outRelations, graph.relations());
        }

        if (!printDepStats && !printRevDepStats && outDepHashes == null && outRecursiveDeps == null) {
            logger.info("Done");
            return 0;
        }

        if (outRecursiveDepsFor != null && !inputs.contains(outRecursiveDepsFor)) {
            logger.warn("'{}' is not an input file; no recursive dependencies will be written", outRecursiveDepsFor);
        }

        var result = dagger.hash(
                graph,
                inputs,
                outDepHashes != null,
                printDepStats,
                printRevDepStats,
                outRecursiveDepsFor,
                hashSalt,
                ExecutorServiceUtil.defaultParallelism());

        if (outRecursiveDeps != null && result.recursiveDeps().isPresent()) {
            logger.info("Writing recursive dependencies of {} to: {}", outRecursiveDepsFor, outRecursiveDeps);
            JsonOutputs.write(outRecursiveDeps, result.recursiveDeps().get());
        }
        if (printDepStats) {
            StatsReport.log(StatsReport.forwardLines(result.depStats(), statsSort));
        }
        if (outDepHashes != null) {
            logger.info("Writing dependency hashes to: {}", outDepHashes);
            JsonOutputs.write(outDepHashes, result.depHashes());
        }
        if (printRevDepStats) {
            StatsReport.log(StatsReport.reverseLines(result.reverseDepCounts(), statsSort));
        }

        logger.info("Done");
        return 0;
    }

    private static Recording startProfile() throws IOException {
        try {
            var recording = new Recording(Configuration.getConfiguration("profile"));
            recording.setName("repo-dagger");
            recording.start();
            logger.info("Profiling into {}", PROFILE_FILE.toAbsolutePath());
            return recording;
        } catch (ParseException e) {
            throw new IOException("cannot load the 'profile' flight recorder configuration", e);
        }
    }

    private static void stopProfile(Recording recording) {
        try (recording) {
            recording.stop();
            recording.dump(PROFILE_FILE);
        } catch (IOException e) {
            logger.warn("Failed to write profile {}: {}", PROFILE_FILE, e.getMessage());
        }
    }

    public static final class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[] {"version\t" + VERSION, "java\t" + Runtime.version()};
        }
    }
}
