package com.contrastsecurity.tpack.version;

import java.util.Objects;

/**
 * A three-component, non-negative package version ({@code major.minor.patch}).
 */
public final class SemanticVersion implements Comparable<SemanticVersion> {
    public static final SemanticVersion ZERO = new SemanticVersion(0, 0, 0);

    private final int major;
    private final int minor;
    private final int patch;

    public SemanticVersion(int major, int minor, int patch) {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version components must be non-negative: "
                    + major + "." + minor + "." + patch);
        }
        this.major = major;
        this.minor = minor;
        this.patch = patch;
    }

    public int getMajor() {
        return major;
    }

    public int getMinor() {
        return minor;
    }

    public int getPatch() {
        return patch;
    }

    /**
     * Bump one component and reset the lower ones.
     *
     * @param bumpType "major", "minor" or "patch"
     * @return the bumped version
     */
    public SemanticVersion bump(String bumpType) {
        switch (bumpType) {
            case "major":
                return new SemanticVersion(major + 1, 0, 0);
            case "minor":
                return new SemanticVersion(major, minor + 1, 0);
            case "patch":
                return new SemanticVersion(major, minor, patch + 1);
            default:
                throw new IllegalArgumentException("Unknown bump type: " + bumpType);
        }
    }

    @Override
    public int compareTo(SemanticVersion other) {
        if (major != other.major) {
            return Integer.compare(major, other.major);
        }
        if (minor != other.minor) {
            return Integer.compare(minor, other.minor);
        }
        return Integer.compare(patch, other.patch);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SemanticVersion that = (SemanticVersion) o;
        return major == that.major && minor == that.minor && patch == that.patch;
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
