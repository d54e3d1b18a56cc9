package ai.repodagger.python;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.repodagger.DaggerException.UnsupportedImportException;
import ai.repodagger.config.DaggerConfig;
import ai.repodagger.testutil.TestTree;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PythonModuleResolverTest {

    private static DaggerConfig configWithRoots(String... roots) {
        return new DaggerConfig(".", List.of(), List.of(), List.of(), List.of(roots), Map.of());
    }

    @Test
    void resolvesModuleAndAncestorPackages(@TempDir Path root) throws Exception {
        TestTree.at(root).file("pkg/__init__.py").file("pkg/sub/__init__.py").file("pkg/sub/mod.py");
        var resolver = new PythonModuleResolver(configWithRoots("pkg"), root);

        var paths = resolver.resolve("pkg.sub.mod");

        assertEquals(Set.of("pkg/sub/mod.py", "pkg/sub/__init__.py", "pkg/__init__.py"), Set.copyOf(paths));
        assertEquals(3, paths.size());
    }

    @Test
    void candidateFormsAccumulate(@TempDir Path root) throws Exception {
        TestTree.at(root)
                .file("pkg/__init__.py")
                .file("pkg/fast/__init__.py")
                .file("pkg/fast.pyi")
                .file("pkg/fast.pyx")
                .file("pkg/fast.c");
        var resolver = new PythonModuleResolver(configWithRoots("pkg"), root);

        assertEquals(
                List.of("pkg/fast/__init__.py", "pkg/fast.pyx", "pkg/fast.pyi", "pkg/fast.c", "pkg/__init__.py"),
                resolver.resolve("pkg.fast"));
    }

    @Test
    void namespacePackageContributesNoFileButRecurses(@TempDir Path root) throws Exception {
        TestTree.at(root).file("pkg/__init__.py").file("pkg/ns/leaf.py");
        var resolver = new PythonModuleResolver(configWithRoots("pkg"), root);

        assertEquals(List.of("pkg/__init__.py"), resolver.resolve("pkg.ns"));
        assertEquals(List.of("pkg/ns/leaf.py", "pkg/__init__.py"), resolver.resolve("pkg.ns.leaf"));
    }

    @Test
    void unresolvableModuleDoesNotRecurseIntoParent(@TempDir Path root) throws Exception {
        TestTree.at(root).file("pkg/__init__.py");
        var resolver = new PythonModuleResolver(configWithRoots("pkg"), root);

        assertTrue(resolver.resolve("pkg.missing").isEmpty());
        // the parent was never requested
        assertEquals(1, resolver.cachedModuleCount());
    }

    @Test
    void modulesOutsideRootPackagesResolveToNothing(@TempDir Path root) throws Exception {
        TestTree.at(root).file("os/__init__.py").file("os/path.py");
        var resolver = new PythonModuleResolver(configWithRoots("pkg"), root);

        assertTrue(resolver.resolve("os.path").isEmpty());
        assertTrue(resolver.resolve("pkgx").isEmpty());
    }

    @Test
    void outOfScopeModulesNeverTouchTheFilesystem() throws Exception {
        var resolver = new PythonModuleResolver(configWithRoots("pkg"), Path.of("/definitely/not/a/real/dir"));
        assertTrue(resolver.resolve("requests.adapters").isEmpty());
    }

    @Test
    void resultsAreMemoized(@TempDir Path root) throws Exception {
        TestTree.at(root).file("pkg/__init__.py").file("pkg/a.py");
        var resolver = new PythonModuleResolver(configWithRoots("pkg"), root);

        var first = resolver.resolve("pkg.a");
        var second = resolver.resolve("pkg.a");

        assertSame(first, second);
        assertEquals(2, resolver.cachedModuleCount());
    }

    @Test
    void relativeImportsAreRejected(@TempDir Path root) {
        var resolver = new PythonModuleResolver(configWithRoots("pkg"), root);
        var e = assertThrows(UnsupportedImportException.class, () -> resolver.resolve(".sibling"));
        assertTrue(e.getMessage().contains(".sibling"));
    }
}
