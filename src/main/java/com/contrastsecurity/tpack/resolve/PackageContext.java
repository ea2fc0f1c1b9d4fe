package com.contrastsecurity.tpack.resolve;

import com.contrastsecurity.tpack.manifest.Manifest;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * What the resolver needs to know about the package being processed, taken from its
 * existing manifest where there is one.
 */
public class PackageContext {
    private final Path directory;
    private final String name;
    private final String namespace;
    private final boolean strictNamespace;
    private final boolean requiresVersionAction;
    private final Set<String> devDependencies;

    public PackageContext(Path directory, String name, String namespace, boolean strictNamespace,
                          boolean requiresVersionAction, Set<String> devDependencies) {
        this.directory = directory;
        this.name = name;
        this.namespace = namespace;
        this.strictNamespace = strictNamespace;
        this.requiresVersionAction = requiresVersionAction;
        this.devDependencies = devDependencies != null ? new TreeSet<>(devDependencies) : new TreeSet<>();
    }

    /**
     * Build the context of a package from its manifest.
     *
     * @param directory package directory
     * @param existing loaded manifest, or null for a package without one
     */
    public static PackageContext from(Path directory, Manifest existing) {
        String dirName = directory.toAbsolutePath().normalize().getFileName().toString();
        if (existing == null) {
            return new PackageContext(directory, dirName, null, true, true, null);
        }
        String name = existing.isBlank(Manifest.NAME) ? dirName : existing.getName();
        String namespace = existing.isBlank(Manifest.NAMESPACE) ? null : existing.getNamespace().trim();
        return new PackageContext(directory, name, namespace,
                existing.getBoolean(Manifest.GENERATOR_STRICT_NAMESPACE, true),
                existing.getBoolean(Manifest.GENERATOR_REQUIRES_VERSION_ACTION, true),
                existing.getDependencies(Manifest.DEV_DEPENDENCIES).keySet());
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Package name, used to exclude the package's own index entries.
     */
    public String getName() {
        return name;
    }

    /**
     * Namespace declared in the manifest, or null.
     */
    public String getNamespace() {
        return namespace;
    }

    public boolean isStrictNamespace() {
        return strictNamespace;
    }

    public boolean isRequiresVersionAction() {
        return requiresVersionAction;
    }

    public Set<String> getDevDependencies() {
        return Collections.unmodifiableSet(devDependencies);
    }
}
