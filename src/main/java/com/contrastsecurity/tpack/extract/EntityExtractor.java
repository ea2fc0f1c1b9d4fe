package com.contrastsecurity.tpack.extract;

import com.contrastsecurity.tpack.model.PackageIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Walks one package tree and hands each source file to the scanner for its dialect.
 */
public class EntityExtractor {
    private static final Logger logger = LoggerFactory.getLogger(EntityExtractor.class);

    /**
     * Directory names never descended into.
     */
    public static final Set<String> DEFAULT_SKIP_DIRECTORIES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "node_modules", ".git", "__pycache__", ".venv", "venv", ".pytest_cache", ".mypy_cache",
            "dist", "build", ".vscode", ".idea", "recordings", "backup", ".subtrees")));

    private final List<SourceScanner> scanners;
    private final Set<String> skipDirectories;

    public EntityExtractor() {
        this(Collections.emptySet());
    }

    /**
     * @param extraSkipDirectories directory names to skip in addition to the defaults
     */
    public EntityExtractor(Collection<String> extraSkipDirectories) {
        this(defaultScanners(), extraSkipDirectories);
    }

    public EntityExtractor(List<SourceScanner> scanners, Collection<String> extraSkipDirectories) {
        this.scanners = new ArrayList<>(scanners);
        this.skipDirectories = new HashSet<>(DEFAULT_SKIP_DIRECTORIES);
        this.skipDirectories.addAll(extraSkipDirectories);
    }

    public static List<SourceScanner> defaultScanners() {
        List<SourceScanner> defaults = new ArrayList<>();
        defaults.add(new PythonSourceScanner());
        defaults.add(new TalonSourceScanner());
        defaults.add(new TalonListSourceScanner());
        return defaults;
    }

    public Set<String> getSkipDirectories() {
        return Collections.unmodifiableSet(skipDirectories);
    }

    /**
     * Scan every supported file under the package root.
     *
     * @param packageRoot package directory
     * @return per-file and aggregated findings
     * @throws PackageIOException if the root or one of its files cannot be read
     */
    public ExtractionResult extract(Path packageRoot) throws PackageIOException {
        if (!Files.isDirectory(packageRoot)) {
            throw new PackageIOException(packageRoot, "Package directory does not exist: " + packageRoot);
        }

        ExtractionResult result = new ExtractionResult(packageRoot);
        List<Path> files = new ArrayList<>();
        collectFiles(packageRoot, packageRoot, files);

        for (Path file : files) {
            SourceScanner scanner = scannerFor(file);
            if (scanner == null) {
                continue;
            }
            Path relative = packageRoot.relativize(file);
            String content;
            try {
                content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new PackageIOException(packageRoot, "Failed to read " + relative + ": " + e.getMessage(), e);
            }
            logger.debug("Scanning {} as {}", relative, scanner.getDialect());
            result.add(scanner.scan(relative, content));
        }

        logger.info("Scanned {}: {} declared, {} referenced, files {}", packageRoot.getFileName(),
                result.getDeclared().size(), result.getReferenced().size(), result.getFileCounts());
        return result;
    }

    private SourceScanner scannerFor(Path file) {
        for (SourceScanner scanner : scanners) {
            if (scanner.supports(file)) {
                return scanner;
            }
        }
        return null;
    }

    private void collectFiles(Path packageRoot, Path dir, List<Path> files) throws PackageIOException {
        List<Path> children;
        try (Stream<Path> listing = Files.list(dir)) {
            children = listing.sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new PackageIOException(packageRoot, "Failed to list " + dir + ": " + e.getMessage(), e);
        }

        for (Path child : children) {
            if (Files.isDirectory(child)) {
                if (!skipDirectories.contains(child.getFileName().toString())) {
                    collectFiles(packageRoot, child, files);
                }
            } else if (Files.isRegularFile(child)) {
                files.add(child);
            }
        }
    }
}
