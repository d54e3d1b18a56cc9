package ai.repodagger.relations;

import ai.repodagger.DaggerException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds the relation map by applying the {@link RelationEngine} wave by wave, starting at the input files, until a
 * wave discovers no new relations.
 *
 * <p>Runs entirely on the calling thread; see {@link RelationEngine} for why.
 */
public final class GraphBuilder {
    private static final Logger logger = LogManager.getLogger(GraphBuilder.class);

    private final RelationEngine engine;

    public GraphBuilder(RelationEngine engine) {
        this.engine = engine;
    }

    public RelationGraph build(Collection<String> inputFiles) throws DaggerException {
        Set<String> processed = new HashSet<>();
        var relations = new TreeMap<String, List<String>>();
        List<String> frontier = List.copyOf(new TreeSet<>(inputFiles));

        int wave = 0;
        while (true) {
            wave++;
            logger.debug("--- wave {}: {} files", wave, frontier.size());

            var next = new ArrayList<String>();
            for (var file : frontier) {
                if (!processed.add(file)) {
                    continue;
                }
                List<String> fileRelations;
                try {
                    fileRelations = engine.visitFile(file);
                } catch (DaggerException e) {
                    throw DaggerException.withContext("error while visiting file '%s'".formatted(file), e);
                }
                relations.put(file, fileRelations);
                next.addAll(fileRelations);
            }

            if (next.isEmpty()) {
                break;
            }
            frontier = List.copyOf(new TreeSet<>(next));
        }

        var graph = new RelationGraph(relations);
        logger.info(
                "Dependency graph: {} files, {} relations, {} waves, {} python modules resolved",
                graph.files().size(),
                graph.edgeCount(),
                wave,
                engine.pythonResolver().cachedModuleCount());
        return graph;
    }
}
