package ai.repodagger.relations;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.MatchResult;

/**
 * The capture groups of one regex match, substituted into action templates as {@code $0}, {@code $1}, ... Path-rule
 * level actions run with {@link #NONE}, which leaves templates untouched.
 */
public record CaptureGroups(List<String> groups) {
    public static final CaptureGroups NONE = new CaptureGroups(List.of());

    public CaptureGroups {
        groups = List.copyOf(groups);
    }

    /** Group 0 is the whole match; groups that did not participate become empty text. */
    public static CaptureGroups of(MatchResult match) {
        var groups = new ArrayList<String>(match.groupCount() + 1);
        for (int i = 0; i <= match.groupCount(); i++) {
            var group = match.group(i);
            groups.add(group == null ? "" : group);
        }
        return new CaptureGroups(groups);
    }

    /** Replaces each {@code $i} with group {@code i}, lowest index first. */
    public String apply(String template) {
        var out = template;
        for (int i = 0; i < groups.size(); i++) {
            out = out.replace("$" + i, groups.get(i));
        }
        return out;
    }

    public List<String> apply(List<String> templates) {
        if (groups.isEmpty()) {
            return templates;
        }
        return templates.stream().map(this::apply).toList();
    }
}
