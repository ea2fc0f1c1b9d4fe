package com.contrastsecurity.tpack.extract;

import com.contrastsecurity.tpack.model.EntitySet;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Entities declared and referenced by a single source file.
 */
public class FileExtraction {
    private final Path path;
    private final String dialect;
    private final EntitySet declared;
    private final EntitySet referenced;
    private final Set<String> requirements;
    private boolean degraded;
    private String degradedReason;

    public FileExtraction(Path path, String dialect) {
        this.path = path;
        this.dialect = dialect;
        this.declared = new EntitySet();
        this.referenced = new EntitySet();
        this.requirements = new TreeSet<>();
    }

    public Path getPath() {
        return path;
    }

    public String getDialect() {
        return dialect;
    }

    /**
     * Entities this file is the origin of.
     */
    public EntitySet getDeclared() {
        return declared;
    }

    /**
     * Entities this file calls or reads, whatever their origin.
     */
    public EntitySet getReferenced() {
        return referenced;
    }

    public Set<String> getRequirements() {
        return Collections.unmodifiableSet(requirements);
    }

    public void addRequirement(String requirement) {
        requirements.add(requirement);
    }

    public boolean isDegraded() {
        return degraded;
    }

    public String getDegradedReason() {
        return degradedReason;
    }

    /**
     * Mark the file as scanned by the textual fallback only.
     */
    public void markDegraded(String reason) {
        this.degraded = true;
        this.degradedReason = reason;
    }
}
