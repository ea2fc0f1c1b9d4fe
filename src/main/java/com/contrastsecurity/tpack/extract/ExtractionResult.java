package com.contrastsecurity.tpack.extract;

import com.contrastsecurity.tpack.model.EntitySet;
import com.contrastsecurity.tpack.model.Warning;
import com.contrastsecurity.tpack.model.WarningType;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Everything the extractor found in one package tree.
 */
public class ExtractionResult {
    private final Path packageRoot;
    private final List<FileExtraction> files;
    private final EntitySet declared;
    private final EntitySet referenced;
    private final Set<String> requirements;
    private final Map<String, Integer> fileCounts;
    private final List<Warning> warnings;

    public ExtractionResult(Path packageRoot) {
        this.packageRoot = packageRoot;
        this.files = new ArrayList<>();
        this.declared = new EntitySet();
        this.referenced = new EntitySet();
        this.requirements = new TreeSet<>();
        this.fileCounts = new TreeMap<>();
        this.warnings = new ArrayList<>();
    }

    /**
     * Fold one file's findings into the package totals.
     */
    public void add(FileExtraction file) {
        files.add(file);
        declared.addAll(file.getDeclared());
        referenced.addAll(file.getReferenced());
        requirements.addAll(file.getRequirements());
        fileCounts.merge(file.getDialect(), 1, Integer::sum);
        if (file.isDegraded()) {
            String path = file.getPath().toString().replace('\\', '/');
            warnings.add(new Warning(WarningType.PARSE_DEGRADED,
                    "Could not parse " + path + ": " + file.getDegradedReason()
                            + "; only references were recovered",
                    Collections.singletonList(path)));
        }
    }

    public Path getPackageRoot() {
        return packageRoot;
    }

    public List<FileExtraction> getFiles() {
        return Collections.unmodifiableList(files);
    }

    public EntitySet getDeclared() {
        return declared;
    }

    public EntitySet getReferenced() {
        return referenced;
    }

    public Set<String> getRequirements() {
        return Collections.unmodifiableSet(requirements);
    }

    /**
     * Number of scanned files per dialect.
     */
    public Map<String, Integer> getFileCounts() {
        return Collections.unmodifiableMap(fileCounts);
    }

    public int getFileCount(String dialect) {
        return fileCounts.getOrDefault(dialect, 0);
    }

    public List<Warning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}
