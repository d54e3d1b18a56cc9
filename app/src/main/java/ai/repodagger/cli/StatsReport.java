package ai.repodagger.cli;

import ai.repodagger.hashing.HashPipeline.DepStat;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** {@code count<TAB>name} statistics lines, written to the log. */
public final class StatsReport {
    private static final Logger logger = LogManager.getLogger(StatsReport.class);

    private StatsReport() {}

    /** Closure size per input file. */
    public static List<String> forwardLines(Collection<DepStat> stats, StatsSort sort) {
        var entries = new ArrayList<Map.Entry<String, Integer>>(stats.size());
        for (var stat : stats) {
            entries.add(Map.entry(stat.file(), stat.count()));
        }
        return format(entries, sort);
    }

    /** Number of input closures containing each file. */
    public static List<String> reverseLines(Map<String, Integer> counts, StatsSort sort) {
        return format(new ArrayList<>(counts.entrySet()), sort);
    }

    public static void log(List<String> lines) {
        for (var line : lines) {
            logger.info(line);
        }
    }

    private static List<String> format(List<Map.Entry<String, Integer>> entries, StatsSort sort) {
        entries.sort(sort.comparator());
        return entries.stream()
                .map(e -> e.getValue() + "\t" + e.getKey())
                .toList();
    }
}
