package ai.repodagger.glob;

import ai.repodagger.DaggerException.PatternException;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * An extended glob compiled to a regex for platform-independent matching against {@code /}-separated relative
 * paths.
 *
 * <p>Glob syntax:
 * <ul>
 *   <li>{@code **} as a whole path segment matches zero or more directories; anywhere else it acts as {@code *}
 *   <li>{@code *} matches any characters except the path separator
 *   <li>{@code ?} matches exactly one character except the path separator
 *   <li>{@code [abc]}, {@code [a-z]}, {@code [!abc]} / {@code [^abc]} match one character of (or not of) a class
 *   <li>{@code {a,b}} matches either alternative; alternatives may nest
 *   <li>{@code \} escapes the next character
 * </ul>
 */
public final class GlobPattern {
    private static final String META_CHARS = "*?[{\\";

    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    public static GlobPattern compile(String glob) throws PatternException {
        if (glob.startsWith("/")) {
            throw new PatternException("glob '%s' must be relative".formatted(glob));
        }
        for (var segment : glob.split("/", -1)) {
            if (segment.equals("..")) {
                throw new PatternException("glob '%s' must not leave its root directory".formatted(glob));
            }
        }
        var translator = new Translator(glob);
        var regex = translator.translate();
        try {
            return new GlobPattern(glob, Pattern.compile(regex));
        } catch (PatternSyntaxException e) {
            throw new PatternException("invalid glob '%s': %s".formatted(glob, e.getDescription()), e);
        }
    }

    /** Matches a relative path using {@code /} separators. */
    public boolean matches(String relPath) {
        return regex.matcher(relPath).matches();
    }

    public String glob() {
        return glob;
    }

    /**
     * The leading directory segments that contain no glob syntax, joined by {@code /}; empty if the first segment is
     * already a pattern. Walking can start there instead of at the root.
     */
    public String literalDirectoryPrefix() {
        var segments = glob.split("/", -1);
        var prefix = new StringBuilder();
        for (int i = 0; i < segments.length - 1; i++) {
            if (!isLiteral(segments[i])) {
                break;
            }
            if (prefix.length() > 0) {
                prefix.append('/');
            }
            prefix.append(segments[i]);
        }
        return prefix.toString();
    }

    /**
     * How many directory levels below {@link #literalDirectoryPrefix()} a match can sit, or {@link Integer#MAX_VALUE}
     * if the pattern may descend arbitrarily.
     */
    public int maxDepthBelowPrefix() {
        if (glob.contains("**") || glob.contains("{")) {
            return Integer.MAX_VALUE;
        }
        var prefix = literalDirectoryPrefix();
        var remainder = prefix.isEmpty() ? glob : glob.substring(prefix.length() + 1);
        int depth = 1;
        for (int i = 0; i < remainder.length(); i++) {
            if (remainder.charAt(i) == '/') depth++;
        }
        return depth;
    }

    /** True if the pattern contains no glob syntax at all, i.e. it names exactly one path. */
    public boolean isLiteral() {
        return isLiteral(glob);
    }

    private static boolean isLiteral(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (META_CHARS.indexOf(text.charAt(i)) >= 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return glob;
    }

    private static final class Translator {
        private final String glob;
        private final StringBuilder out = new StringBuilder();
        private int pos;
        private int braceDepth;

        Translator(String glob) {
            this.glob = glob;
        }

        String translate() throws PatternException {
            while (pos < glob.length()) {
                char c = glob.charAt(pos);
                switch (c) {
                    case '*' -> star();
                    case '?' -> {
                        out.append("[^/]");
                        pos++;
                    }
                    case '[' -> characterClass();
                    case '{' -> {
                        out.append("(?:");
                        braceDepth++;
                        pos++;
                    }
                    case '}' -> {
                        if (braceDepth == 0) {
                            throw new PatternException("unbalanced '}' in glob '%s'".formatted(glob));
                        }
                        out.append(')');
                        braceDepth--;
                        pos++;
                    }
                    case ',' -> {
                        out.append(braceDepth > 0 ? "|" : ",");
                        pos++;
                    }
                    case '\\' -> {
                        if (pos + 1 >= glob.length()) {
                            throw new PatternException("dangling escape in glob '%s'".formatted(glob));
                        }
                        literal(glob.charAt(pos + 1));
                        pos += 2;
                    }
                    default -> {
                        literal(c);
                        pos++;
                    }
                }
            }
            if (braceDepth != 0) {
                throw new PatternException("unclosed '{' in glob '%s'".formatted(glob));
            }
            return out.toString();
        }

        private void star() {
            boolean doubleStar = pos + 1 < glob.length() && glob.charAt(pos + 1) == '*';
            if (!doubleStar) {
                out.append("[^/]*");
                pos++;
                return;
            }
            int end = pos + 2;
            while (end < glob.length() && glob.charAt(end) == '*') {
                end++;
            }
            boolean segmentStart = pos == 0 || glob.charAt(pos - 1) == '/';
            boolean segmentEnd = end == glob.length() || glob.charAt(end) == '/';
            if (!segmentStart || !segmentEnd) {
                // "a**b" is an ordinary star
                out.append("[^/]*");
            } else if (end == glob.length()) {
                if (pos == 0) {
                    out.append(".*");
                } else {
                    // "dir/**" also matches "dir" itself: drop the separator we already emitted
                    out.setLength(out.length() - 1);
                    out.append("(?:/.*)?");
                }
            } else {
                // "**/" matches zero or more leading directories
                out.append("(?:.*/)?");
                end++;
            }
            pos = end;
        }

        private void characterClass() throws PatternException {
            int close = pos + 1;
            if (close < glob.length() && (glob.charAt(close) == '!' || glob.charAt(close) == '^')) {
                close++;
            }
            if (close < glob.length() && glob.charAt(close) == ']') {
                close++;
            }
            while (close < glob.length() && glob.charAt(close) != ']') {
                close++;
            }
            if (close >= glob.length()) {
                throw new PatternException("unclosed '[' in glob '%s'".formatted(glob));
            }

            var body = glob.substring(pos + 1, close);
            boolean negated = body.startsWith("!") || body.startsWith("^");
            if (negated) {
                body = body.substring(1);
            }
            out.append(negated ? "[^/" : "[");
            for (int i = 0; i < body.length(); i++) {
                char c = body.charAt(i);
                if (c == '\\' || c == '[' || c == ']' || c == '&' || (c == '^' && i == 0)) {
                    out.append('\\');
                }
                out.append(c);
            }
            out.append(']');
            pos = close + 1;
        }

        private void literal(char c) {
            if (".^$+()|[]{}\\".indexOf(c) >= 0) {
                out.append('\\');
            }
            out.append(c);
        }
    }
}
