package ai.repodagger.relations;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The complete forward relation map of a run: every visited file mapped to its sorted, de-duplicated direct
 * relations. Immutable once built.
 */
public record RelationGraph(SortedMap<String, List<String>> relations) {

    public RelationGraph {
        relations = Collections.unmodifiableSortedMap(new TreeMap<>(relations));
    }

    /** Every file the graph builder visited, sorted. */
    public Set<String> files() {
        return relations.keySet();
    }

    public List<String> relationsOf(String file) {
        return relations.getOrDefault(file, List.of());
    }

    public int edgeCount() {
        return relations.values().stream().mapToInt(List::size).sum();
    }
}
