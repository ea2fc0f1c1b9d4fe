package com.contrastsecurity.tpack.model;

import java.util.Objects;

/**
 * An entry of the manifest {@code dependencies} map: the package a set of referenced
 * entities resolved to, and the lowest version known to provide them.
 */
public class ResolvedDependency {
    private final String name;
    private final String namespace;
    private final String github;
    private final String minVersion;

    public ResolvedDependency(String name, String namespace, String github, String minVersion) {
        this.name = Objects.requireNonNull(name, "name");
        this.namespace = namespace;
        this.github = github;
        this.minVersion = minVersion;
    }

    /**
     * Declaring package name, the key of the {@code dependencies} entry.
     */
    public String getName() {
        return name;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getGithub() {
        return github;
    }

    public String getMinVersion() {
        return minVersion;
    }

    public ResolvedDependency withMinVersion(String version) {
        return new ResolvedDependency(name, namespace, github, version);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResolvedDependency that = (ResolvedDependency) o;
        return name.equals(that.name) &&
                Objects.equals(namespace, that.namespace) &&
                Objects.equals(github, that.github) &&
                Objects.equals(minVersion, that.minVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, namespace, github, minVersion);
    }

    @Override
    public String toString() {
        return name + " (" + namespace + ") >= " + minVersion;
    }
}
