package com.contrastsecurity.tpack.index;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A package known to the repository index, as described by its manifest.
 */
public class IndexedPackage implements Comparable<IndexedPackage> {
    private final String name;
    private final String namespace;
    private final String version;
    private final String github;
    private final boolean lenient;
    private final Path directory;

    public IndexedPackage(String name, String namespace, String version, String github, boolean lenient, Path directory) {
        this.name = Objects.requireNonNull(name, "name");
        this.namespace = namespace != null ? namespace : "";
        this.version = version != null ? version : "0.0.0";
        this.github = github != null ? github : "";
        this.lenient = lenient;
        this.directory = directory;
    }

    public String getName() {
        return name;
    }

    /**
     * Declared namespace, empty when the manifest has none.
     */
    public String getNamespace() {
        return namespace;
    }

    public String getVersion() {
        return version;
    }

    public String getGithub() {
        return github;
    }

    /**
     * True for packages without a namespace or with strict namespace checking disabled.
     */
    public boolean isLenient() {
        return lenient;
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public int compareTo(IndexedPackage other) {
        return name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IndexedPackage that = (IndexedPackage) o;
        return lenient == that.lenient &&
                name.equals(that.name) &&
                namespace.equals(that.namespace) &&
                version.equals(that.version) &&
                github.equals(that.github);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, namespace, version, github, lenient);
    }

    @Override
    public String toString() {
        return name + "@" + version + (namespace.isEmpty() ? "" : " (" + namespace + ")");
    }
}
