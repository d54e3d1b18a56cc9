package ai.repodagger.hashing;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ai.repodagger.relations.RelationGraph;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;

class DependencyClosureTest {

    private static RelationGraph graph(Map<String, List<String>> relations) {
        return new RelationGraph(new TreeMap<>(relations));
    }

    @Test
    void closureIncludesTheFileAndIsSorted() {
        var graph = graph(Map.of(
                "z.py", List.of("m.py", "a.py"),
                "m.py", List.of("lib/x.py"),
                "a.py", List.of(),
                "lib/x.py", List.of()));

        assertEquals(List.of("a.py", "lib/x.py", "m.py", "z.py"), DependencyClosure.of(graph, "z.py"));
        assertEquals(List.of("a.py"), DependencyClosure.of(graph, "a.py"));
    }

    @Test
    void cyclesAndDiamondsAreCountedOnce() {
        var graph = graph(Map.of(
                "a", List.of("b", "c"),
                "b", List.of("d"),
                "c", List.of("d"),
                "d", List.of("a")));

        assertEquals(List.of("a", "b", "c", "d"), DependencyClosure.of(graph, "a"));
        assertEquals(List.of("a", "b", "c", "d"), DependencyClosure.of(graph, "d"));
    }

    @Test
    void fileOutsideTheGraphIsItsOwnClosure() {
        assertEquals(List.of("lonely"), DependencyClosure.of(graph(Map.of()), "lonely"));
    }
}
