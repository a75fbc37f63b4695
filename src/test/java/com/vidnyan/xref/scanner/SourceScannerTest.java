package com.vidnyan.xref.scanner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceScannerTest {

    @TempDir
    Path tempDir;

    private final SourceScanner scanner = new SourceScanner();

    @Test
    void scanSourceFiles_ShouldFindPythonFilesInOrder() throws IOException {
        // Arrange
        Path pkg = tempDir.resolve("pkg/sub");
        Files.createDirectories(pkg);
        Files.writeString(tempDir.resolve("pkg/__init__.py"), "");
        Files.writeString(pkg.resolve("mod.py"), "x = 1\n");
        Files.writeString(pkg.resolve("README.md"), "documentation");
        Files.writeString(tempDir.resolve("setup.py"), "pass\n");
        Files.writeString(tempDir.resolve("module.pyc"), "bytecode");

        // Act
        List<Path> results = scanner.scanSourceFiles(tempDir);

        // Assert
        assertEquals(3, results.size());
        assertTrue(results.stream().allMatch(p -> p.toString().endsWith(".py")));
        assertEquals(results.stream().sorted().toList(), results);
        assertFalse(results.stream().anyMatch(p -> p.endsWith("README.md")));
    }

    @Test
    void scanSourceFiles_ShouldReturnEmptyListForTreeWithoutSources() throws IOException {
        Files.writeString(tempDir.resolve("notes.txt"), "nothing here");

        assertTrue(scanner.scanSourceFiles(tempDir).isEmpty());
    }

    @Test
    void moduleName_ShouldFollowPackageLayout() {
        assertEquals("pkg.sub.mod", scanner.moduleName(tempDir, tempDir.resolve("pkg/sub/mod.py")));
        assertEquals("pkg", scanner.moduleName(tempDir, tempDir.resolve("pkg/__init__.py")));
        assertEquals("setup", scanner.moduleName(tempDir, tempDir.resolve("setup.py")));
    }

    @Test
    void moduleName_ShouldNameRootInitAfterPrefix() {
        assertEquals("pkg", scanner.moduleName(tempDir, tempDir.resolve("__init__.py"), "pkg"));
        assertEquals("pkg.sub", scanner.moduleName(tempDir, tempDir.resolve("sub/__init__.py"), "pkg"));
        assertEquals("pkg.mod", scanner.moduleName(tempDir, tempDir.resolve("mod.py"), "pkg"));
    }

    @Test
    void moduleName_ShouldNameRootInitAfterRootDirectoryWithoutPrefix() {
        // Arrange
        Path root = tempDir.resolve("toplevel");

        // Act
        String name = scanner.moduleName(root, root.resolve("__init__.py"));

        // Assert
        assertEquals("toplevel", name);
    }
}
