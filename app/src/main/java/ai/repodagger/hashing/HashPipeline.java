package ai.repodagger.hashing;

import ai.repodagger.relations.RelationGraph;
import ai.repodagger.util.ExecutorServiceUtil;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Computes, for every input file, its closure and optionally its digest, dependency statistics and reverse
 * dependency counts, on a fixed pool of workers.
 *
 * <p>Workers only read the relation graph and the content hashes, both complete before the pool starts. Each worker
 * reports one outcome into a bounded queue that the calling thread drains while the pool runs; that drain is the join
 * point. The first failed task cancels the others and its failure is rethrown.
 */
public final class HashPipeline {
    private static final Logger logger = LogManager.getLogger(HashPipeline.class);

    /**
     * What to compute.
     *
     * @param digest digest calculator, or null when no dependency hashes are requested
     * @param collectDepStats record the closure size of every input
     * @param collectRevDepStats count, for every file, how many input closures contain it
     * @param recursiveDepsFor input file whose closure should be returned, or null
     * @param parallelism number of workers
     */
    public record Options(
            @Nullable DependencyDigest digest,
            boolean collectDepStats,
            boolean collectRevDepStats,
            @Nullable String recursiveDepsFor,
            int parallelism) {}

    /** Closure size of one input file. */
    public record DepStat(String file, int count) {}

    /**
     * @param depHashes input file to hex digest, sorted by file; empty when no digest was requested
     * @param depStats one entry per input when requested, in no particular order
     * @param reverseDepCounts file to number of input closures containing it, when requested
     * @param recursiveDeps closure of {@link Options#recursiveDepsFor()} if that file was an input
     */
    public record Result(
            SortedMap<String, String> depHashes,
            List<DepStat> depStats,
            Map<String, Integer> reverseDepCounts,
            Optional<List<String>> recursiveDeps) {}

    private record Outcome(String file, int closureSize, @Nullable Throwable failure) {}

    private final RelationGraph graph;
    private final Options options;

    public HashPipeline(RelationGraph graph, Options options) {
        this.graph = graph;
        this.options = options;
    }

    public Result run(List<String> inputFiles) {
        var depHashes = new TreeMap<String, String>();
        var reverseDepCounts = new HashMap<String, Integer>();
        var recursiveDeps = new AtomicReference<List<String>>();
        var depStats = new ArrayList<DepStat>(inputFiles.size());

        int parallelism = Math.max(1, options.parallelism());
        BlockingQueue<Outcome> outcomes = new ArrayBlockingQueue<>(parallelism);
        ExecutorService executor = ExecutorServiceUtil.newFixedThreadExecutor(parallelism, "dep-hash-");
        try {
            for (var file : inputFiles) {
                executor.execute(() -> {
                    var outcome = processInput(file, depHashes, reverseDepCounts, recursiveDeps);
                    try {
                        outcomes.put(outcome);
                    } catch (InterruptedException e) {
                        // cancelled after another task failed
                        Thread.currentThread().interrupt();
                    }
                });
            }

            for (int i = 0; i < inputFiles.size(); i++) {
                var outcome = outcomes.take();
                if (outcome.failure() != null) {
                    throw new IllegalStateException(
                            "error while hashing dependencies of '%s': %s".formatted(outcome.file(), outcome.failure()),
                            outcome.failure());
                }
                if (options.collectDepStats()) {
                    depStats.add(new DepStat(outcome.file(), outcome.closureSize()));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for dependency hashes", e);
        } finally {
            executor.shutdownNow();
        }

        logger.debug("Processed {} input files on {} workers", inputFiles.size(), parallelism);
        // every worker wrote its results before handing its outcome to the queue
        return new Result(
                Collections.unmodifiableSortedMap(depHashes),
                List.copyOf(depStats),
                Map.copyOf(reverseDepCounts),
                Optional.ofNullable(recursiveDeps.get()));
    }

    private Outcome processInput(
            String file,
            Map<String, String> depHashes,
            Map<String, Integer> reverseDepCounts,
            AtomicReference<List<String>> recursiveDeps) {
        try {
            var closure = DependencyClosure.of(graph, file);

            if (file.equals(options.recursiveDepsFor())) {
                recursiveDeps.set(closure);
            }
            if (options.collectRevDepStats()) {
                synchronized (reverseDepCounts) {
                    for (var dep : closure) {
                        reverseDepCounts.merge(dep, 1, Integer::sum);
                    }
                }
            }
            var digest = options.digest();
            if (digest != null) {
                var hex = digest.compute(file, closure);
                synchronized (depHashes) {
                    depHashes.put(file, hex);
                }
            }
            return new Outcome(file, closure.size(), null);
        } catch (Throwable t) {
            // every task must report, or the drain in run() never ends
            logger.error("Dependency hashing failed for {}", file, t);
            return new Outcome(file, 0, t);
        }
    }
}
