package ai.repodagger.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.repodagger.testutil.TestTree;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RepoDaggerCliTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path dir;

    private Path config;
    private Path out;

    @BeforeEach
    void setUp() throws Exception {
        var repo = dir.resolve("repo");
        TestTree.at(repo)
                .file("poetry.lock", "lock v1\n")
                .file("conftest.py")
                .file("pkg/__init__.py")
                .file("pkg/db.py")
                .file("pkg/util.py")
                .file("tests/test_foo.py", "import pkg.db\n")
                .file("tests/test_bar.py", "import pkg.util\n");
        TestTree.at(dir).file("config/repo_dagger.yaml", """
                base_dir: ../repo
                inputs: ["tests/**/test_*.py"]
                root_python_packages: [pkg]
                global_deps: [poetry.lock]
                path_rules:
                  "tests/**/test_*.py":
                    visit_grand_siblings: [conftest.py, __init__.py]
                  "**/*.py":
                    visit_imported_python_modules: true
                """);
        config = dir.resolve("config/repo_dagger.yaml");
        out = Files.createDirectory(dir.resolve("out"));
    }

    private static int run(String... args) {
        return RepoDaggerCli.commandLine().execute(args);
    }

    private static <T> T read(Path path, TypeReference<T> type) throws Exception {
        return MAPPER.readValue(path.toFile(), type);
    }

    @Test
    void writesRelationsHashesAndRecursiveDeps() throws Exception {
        int exit = run(
                "-config", config.toString(),
                "-out-relations", out.resolve("relations.json").toString(),
                "-out-dep-hashes", out.resolve("hashes.json").toString(),
                "-out-recursive-deps", out.resolve("deps.json").toString(),
                "-out-recursive-deps-for", "tests/test_foo.py",
                "-print-dep-stats",
                "-print-rev-dep-stats",
                "-stats-sort", "name");

        assertEquals(0, exit);
        var relations = read(out.resolve("relations.json"), new TypeReference<Map<String, List<String>>>() {});
        assertEquals(
                List.of("conftest.py", "pkg/__init__.py", "pkg/db.py", "poetry.lock"),
                relations.get("tests/test_foo.py"));

        var hashes = read(out.resolve("hashes.json"), new TypeReference<Map<String, String>>() {});
        assertEquals(List.of("tests/test_bar.py", "tests/test_foo.py"), List.copyOf(hashes.keySet()));
        assertNotEquals(hashes.get("tests/test_bar.py"), hashes.get("tests/test_foo.py"));

        assertEquals(
                List.of("conftest.py", "pkg/__init__.py", "pkg/db.py", "poetry.lock", "tests/test_foo.py"),
                read(out.resolve("deps.json"), new TypeReference<List<String>>() {}));
        assertTrue(Files.readString(out.resolve("hashes.json")).endsWith("}\n"));
    }

    @Test
    void hashesFollowContentSaltAndConfig() throws Exception {
        var hashesFile = out.resolve("hashes.json");
        var type = new TypeReference<Map<String, String>>() {};
        assertEquals(0, run("-config", config.toString(), "-out-dep-hashes", hashesFile.toString()));
        var before = read(hashesFile, type);

        assertEquals(0, run("-config", config.toString(), "-out-dep-hashes", hashesFile.toString()));
        assertEquals(before, read(hashesFile, type));

        Files.writeString(dir.resolve("repo/pkg/util.py"), "CHANGED = True\n");
        assertEquals(0, run("-config", config.toString(), "-out-dep-hashes", hashesFile.toString()));
        var afterEdit = read(hashesFile, type);
        assertEquals(before.get("tests/test_foo.py"), afterEdit.get("tests/test_foo.py"));
        assertNotEquals(before.get("tests/test_bar.py"), afterEdit.get("tests/test_bar.py"));

        assertEquals(0, run(
                "-config", config.toString(), "-out-dep-hashes", hashesFile.toString(), "-hash-salt", "v2"));
        assertNotEquals(afterEdit.get("tests/test_foo.py"), read(hashesFile, type).get("tests/test_foo.py"));

        Files.writeString(config, Files.readString(config) + "# comment\n");
        assertEquals(0, run("-config", config.toString(), "-out-dep-hashes", hashesFile.toString()));
        assertNotEquals(afterEdit.get("tests/test_foo.py"), read(hashesFile, type).get("tests/test_foo.py"));
    }

    @Test
    void inputFilesOverrideReplacesConfiguredInputs() throws Exception {
        var hashesFile = out.resolve("hashes.json");
        int exit = run(
                "-config", config.toString(),
                "-input-files", " tests/test_bar.py, ,",
                "-out-dep-hashes", hashesFile.toString());

        assertEquals(0, exit);
        assertEquals(
                List.of("tests/test_bar.py"),
                List.copyOf(read(hashesFile, new TypeReference<Map<String, String>>() {}).keySet()));
    }

    @Test
    void recursiveDepsOptionsMustBeGivenTogether() {
        assertEquals(1, run("-config", config.toString(), "-out-recursive-deps", out.resolve("d.json").toString()));
        assertEquals(1, run("-config", config.toString(), "-out-recursive-deps-for", "tests/test_foo.py"));
        assertFalse(Files.exists(out.resolve("d.json")));
    }

    @Test
    void recursiveDepsForNonInputWritesNothing() {
        var deps = out.resolve("deps.json");
        int exit = run(
                "-config", config.toString(),
                "-out-recursive-deps", deps.toString(),
                "-out-recursive-deps-for", "pkg/db.py");

        assertEquals(0, exit);
        assertFalse(Files.exists(deps));
    }

    @Test
    void noInputsIsNotAnError() {
        var hashesFile = out.resolve("hashes.json");
        int exit = run(
                "-config", config.toString(),
                "-input-files", "does/not/exist.py",
                "-out-dep-hashes", hashesFile.toString());

        assertEquals(0, exit);
        assertFalse(Files.exists(hashesFile));
    }

    @Test
    void configErrorsExitWithOne() throws Exception {
        assertEquals(1, run("-config", dir.resolve("missing.yaml").toString()));

        Files.writeString(config, "inputs: [a]\nunknown_key: 1\n");
        assertEquals(1, run("-config", config.toString()));
    }

    @Test
    void missingConfigOptionIsAUsageError() {
        assertEquals(2, run("-print-dep-stats"));
    }

    @Test
    void verboseRunSucceeds() throws Exception {
        var previous = LogManager.getRootLogger().getLevel();
        try {
            assertEquals(0, run("-config", config.toString(), "-verbose", "-print-dep-stats"));
            assertEquals(Level.DEBUG, LogManager.getRootLogger().getLevel());
        } finally {
            Configurator.setRootLevel(previous);
        }
    }

    @Test
    void selfProfileWritesFlightRecording() throws Exception {
        var profile = RepoDaggerCli.PROFILE_FILE;
        Files.deleteIfExists(profile);
        try {
            assertEquals(0, run("-config", config.toString(), "-self-profile"));
            assertTrue(Files.size(profile) > 0);
        } finally {
            Files.deleteIfExists(profile);
        }
    }

    @Test
    void versionIsReported() {
        assertEquals(0, run("-version"));
        assertEquals("version\t1.4.0", new RepoDaggerCli.VersionProvider().getVersion()[0]);
    }
}
