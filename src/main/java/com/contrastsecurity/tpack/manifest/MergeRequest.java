package com.contrastsecurity.tpack.manifest;

import com.contrastsecurity.tpack.resolve.ResolutionResult;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Inputs of one merge: the existing manifest, fresh resolution facts and detected defaults.
 */
public class MergeRequest {
    private final String directoryName;
    private final Manifest existing;
    private final ResolutionResult resolution;
    private final Set<String> requirements;
    private final String generatorVersion;
    private String detectedLicense;
    private String previewFile;

    /**
     * @param directoryName name of the package directory, the default package name
     * @param existing manifest loaded from disk, or null on first run
     * @param resolution resolver output
     * @param requirements detected hardware and software requirements
     * @param generatorVersion version written to {@code _generatorVersion}
     */
    public MergeRequest(String directoryName, Manifest existing, ResolutionResult resolution,
                        Set<String> requirements, String generatorVersion) {
        this.directoryName = directoryName;
        this.existing = existing;
        this.resolution = resolution;
        this.requirements = requirements != null ? new TreeSet<>(requirements) : new TreeSet<>();
        this.generatorVersion = generatorVersion;
    }

    public MergeRequest withDetectedLicense(String license) {
        this.detectedLicense = license;
        return this;
    }

    /**
     * @param fileName name of a preview image in the package root, e.g. "preview.png"
     */
    public MergeRequest withPreviewFile(String fileName) {
        this.previewFile = fileName;
        return this;
    }

    public String getDirectoryName() {
        return directoryName;
    }

    public Manifest getExisting() {
        return existing;
    }

    public boolean isNewManifest() {
        return existing == null;
    }

    public ResolutionResult getResolution() {
        return resolution;
    }

    public Set<String> getRequirements() {
        return Collections.unmodifiableSet(requirements);
    }

    public String getGeneratorVersion() {
        return generatorVersion;
    }

    public String getDetectedLicense() {
        return detectedLicense;
    }

    public String getPreviewFile() {
        return previewFile;
    }
}
