package ai.repodagger;

import ai.repodagger.config.ConfigLoader.LoadedConfig;
import ai.repodagger.glob.FileGlobber;
import ai.repodagger.hashing.ContentHashes;
import ai.repodagger.hashing.DependencyDigest;
import ai.repodagger.hashing.HashPipeline;
import ai.repodagger.relations.GraphBuilder;
import ai.repodagger.relations.RelationEngine;
import ai.repodagger.relations.RelationGraph;
import java.util.List;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** The two phases of a run, graph construction and closure hashing, over one loaded configuration. */
public final class RepoDagger {
    private static final Logger logger = LogManager.getLogger(RepoDagger.class);

    private final LoadedConfig loaded;

    public RepoDagger(LoadedConfig loaded) {
        this.loaded = loaded;
    }

    /** Files selected by the configured input globs, sorted and de-duplicated. */
    public List<String> collectInputFiles() throws DaggerException {
        var inputFiles = new TreeSet<String>();
        for (var input : loaded.config().inputs()) {
            try {
                inputFiles.addAll(FileGlobber.glob(loaded.baseDir(), input));
            } catch (DaggerException e) {
                throw DaggerException.withContext(
                        "error while collecting input files: glob '%s'".formatted(input), e);
            }
        }
        return List.copyOf(inputFiles);
    }

    /** Phase one: single-threaded fixed-point expansion from the inputs. */
    public RelationGraph buildGraph(List<String> inputFiles) throws DaggerException {
        logger.info("Generating dependency graph");
        var engine = new RelationEngine(loaded.config(), loaded.baseDir());
        return new GraphBuilder(engine).build(inputFiles);
    }

    /**
     * Phase two. Content hashes are only read when {@code withDigests} is set; they are complete before any worker
     * starts.
     */
    public HashPipeline.Result hash(
            RelationGraph graph,
            List<String> inputFiles,
            boolean withDigests,
            boolean collectDepStats,
            boolean collectRevDepStats,
            @Nullable String recursiveDepsFor,
            String hashSalt,
            int parallelism)
            throws DaggerException {
        DependencyDigest digest = null;
        if (withDigests) {
            logger.info("Calculating file hashes");
            var contentHashes = ContentHashes.compute(graph.files(), loaded.baseDir());
            digest = new DependencyDigest(hashSalt, loaded.configHash(), contentHashes);
        }

        logger.info("Calculating dependency hashes");
        var options = new HashPipeline.Options(
                digest, collectDepStats, collectRevDepStats, recursiveDepsFor, parallelism);
        return new HashPipeline(graph, options).run(inputFiles);
    }
}
