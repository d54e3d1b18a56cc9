package ai.repodagger.python;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Regex-based view of the import statements of one python source file. Dynamic imports, imports inside strings and
 * line continuations are not understood; this may under- or over-approximate.
 *
 * @param modules every fully-qualified dotted name seen, in source order, duplicates kept
 * @param boundNames locally bound identifier to the fully-qualified name it denotes; later bindings win
 */
public record PythonImports(List<String> modules, Map<String, String> boundNames) {
    private static final Pattern SIMPLE_IMPORT = Pattern.compile("(?m)^ *import ([^ \\r\\n]+)");
    private static final Pattern FROM_IMPORT = Pattern.compile("(?m)^ *from ([^ \\r\\n]+) import (\\([^)]+\\)|[^\\r\\n]+)");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public PythonImports {
        modules = List.copyOf(modules);
        boundNames = Collections.unmodifiableMap(new HashMap<>(boundNames));
    }

    public static PythonImports parse(String source) {
        var modules = new ArrayList<String>();
        var boundNames = new HashMap<String, String>();

        var simple = SIMPLE_IMPORT.matcher(source);
        while (simple.find()) {
            var module = simple.group(1);
            modules.add(module);
            boundNames.put(module, module);
        }

        var from = FROM_IMPORT.matcher(source);
        while (from.find()) {
            var module = from.group(1);
            modules.add(module);
            var names = IDENTIFIER.matcher(from.group(2));
            while (names.find()) {
                var fullName = module + "." + names.group();
                modules.add(fullName);
                boundNames.put(names.group(), fullName);
            }
        }

        return new PythonImports(modules, boundNames);
    }
}
