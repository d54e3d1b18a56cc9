package ai.repodagger.hashing;

import ai.repodagger.relations.RelationGraph;
import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.List;
import java.util.TreeSet;

/** Transitive closure of one file over the relation graph. */
public final class DependencyClosure {

    private DependencyClosure() {}

    /**
     * Every file reachable from {@code file}, including {@code file} itself, sorted and duplicate free. Only set
     * membership matters to the digest, so the traversal order is not preserved.
     */
    public static List<String> of(RelationGraph graph, String file) {
        var visited = new HashSet<String>();
        var stack = new ArrayDeque<String>();
        stack.push(file);
        while (!stack.isEmpty()) {
            var current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            for (var related : graph.relationsOf(current)) {
                if (!visited.contains(related)) {
                    stack.push(related);
                }
            }
        }
        return List.copyOf(new TreeSet<>(visited));
    }
}
