package com.vidnyan.xref.scanner;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Scans a source tree for Python files.
 * Discovers all .py files below a root, in a stable order.
 */
@Component
public class SourceScanner {

    private static final String PYTHON_SUFFIX = ".py";
    private static final String PACKAGE_INIT = "__init__";

    /**
     * Scan and return all Python source files below the root.
     */
    public List<Path> scanSourceFiles(Path root) throws IOException {
        List<Path> sourceFiles = new ArrayList<>();
        try (Stream<Path> paths = Files.walk(root)) {
            paths.filter(Files::isRegularFile)
                 .filter(p -> p.getFileName().toString().endsWith(PYTHON_SUFFIX))
                 .sorted()
                 .forEach(sourceFiles::add);
        }
        return sourceFiles;
    }

    /**
     * Module FQN of a file relative to the source root: {@code pkg/sub/mod.py} is
     * {@code pkg.sub.mod} and {@code pkg/__init__.py} is {@code pkg}.
     */
    public String moduleName(Path root, Path file) {
        return moduleName(root, file, "");
    }

    /**
     * Module FQN of a file below {@code prefix}, the package the source root stands for.
     * The root's own {@code __init__.py} is the prefix itself; without a prefix it is named
     * after the root directory.
     */
    public String moduleName(Path root, Path file, String prefix) {
        Path relative = root.relativize(file);
        List<String> parts = new ArrayList<>();
        if (prefix != null && !prefix.isBlank()) {
            parts.add(prefix);
        }
        for (Path part : relative) {
            parts.add(part.toString());
        }
        String last = parts.remove(parts.size() - 1);
        if (last.endsWith(PYTHON_SUFFIX)) {
            last = last.substring(0, last.length() - PYTHON_SUFFIX.length());
        }
        if (!last.equals(PACKAGE_INIT)) {
            parts.add(last);
        } else if (parts.isEmpty()) {
            Path name = root.toAbsolutePath().normalize().getFileName();
            parts.add(name == null ? PACKAGE_INIT : name.toString());
        }
        return String.join(".", parts);
    }
}
