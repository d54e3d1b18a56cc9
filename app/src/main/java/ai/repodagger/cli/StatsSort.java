package ai.repodagger.cli;

import java.util.Comparator;
import java.util.Map;

/** Ordering of the statistics reports. */
public enum StatsSort {
    /** Highest count first, ties by name. */
    COUNT,
    /** Ascending name. */
    NAME;

    public Comparator<Map.Entry<String, Integer>> comparator() {
        Comparator<Map.Entry<String, Integer>> byName = Map.Entry.comparingByKey();
        return switch (this) {
            case COUNT -> Map.Entry.<String, Integer>comparingByValue().reversed().thenComparing(byName);
            case NAME -> byName;
        };
    }
}
