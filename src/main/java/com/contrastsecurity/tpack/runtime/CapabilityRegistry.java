package com.contrastsecurity.tpack.runtime;

import com.contrastsecurity.tpack.index.IndexedPackage;
import com.contrastsecurity.tpack.index.RepositoryIndex;
import com.contrastsecurity.tpack.manifest.ManifestStore;
import com.contrastsecurity.tpack.model.Entity;
import com.contrastsecurity.tpack.model.EntityKind;
import com.contrastsecurity.tpack.resolve.DependencyResolver;
import com.contrastsecurity.tpack.resolve.NamespacePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Capabilities addressed by dotted paths such as {@code actions.user.mouse_rig_version}.
 *
 * Intermediate segments are nodes with children; leaves hold callables returning a string.
 */
public class CapabilityRegistry {
    private static final Logger logger = LoggerFactory.getLogger(CapabilityRegistry.class);

    public static final String ACTIONS = "actions";

    private final Node root = new Node();

    private static class Node {
        final Map<String, Node> children = new LinkedHashMap<>();
        Supplier<String> capability;
    }

    /**
     * Register every contributed action of the index under {@code actions.<name>}. Version
     * actions report the declaring package's version; other actions return their own name.
     * An action declared by several packages is attributed the same way dependencies are.
     */
    public static CapabilityRegistry fromIndex(RepositoryIndex index, ManifestStore store) {
        CapabilityRegistry registry = new CapabilityRegistry();
        for (Map.Entry<Entity, List<IndexedPackage>> entry : index.getEntries().entrySet()) {
            Entity entity = entry.getKey();
            if (entity.getKind() != EntityKind.ACTION || entry.getValue().isEmpty()) {
                continue;
            }
            IndexedPackage declaring = DependencyResolver.choose(entry.getValue());
            String name = entity.getName();
            String path = ACTIONS + "." + name;
            Supplier<String> capability;
            if (!declaring.getNamespace().isEmpty()
                    && name.equals(NamespacePolicy.expectedVersionAction(declaring.getNamespace()))) {
                capability = declaring.getDirectory() != null
                        ? PackageVersion.forPackage(declaring.getDirectory(), store)
                        : PackageVersion.of(declaring.getVersion());
            } else {
                capability = () -> name;
            }
            try {
                registry.register(path, capability);
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping action {} of {}: {}", name, declaring.getName(), e.getMessage());
            }
        }
        return registry;
    }

    /**
     * Register a callable at a dotted path. An existing entry at the path is kept.
     *
     * @throws IllegalArgumentException if a prefix of the path is already a leaf
     */
    public void register(String path, Supplier<String> capability) {
        String[] segments = path.split("\\.");
        Node current = root;
        for (int i = 0; i < segments.length - 1; i++) {
            current = current.children.computeIfAbsent(segments[i], k -> new Node());
            if (current.capability != null) {
                throw new IllegalArgumentException("Cannot register " + path + ": " + segments[i] + " is a capability");
            }
        }
        Node leaf = current.children.get(segments[segments.length - 1]);
        if (leaf != null) {
            logger.debug("{} already registered, keeping first", path);
            return;
        }
        leaf = new Node();
        leaf.capability = capability;
        current.children.put(segments[segments.length - 1], leaf);
    }

    /**
     * Walk the path segment by segment.
     *
     * @throws ActionNotDeclaredException naming the first missing segment
     */
    public Supplier<String> lookup(String path) throws ActionNotDeclaredException {
        Node current = root;
        for (String segment : path.split("\\.")) {
            Node next = current.capability == null ? current.children.get(segment) : null;
            if (next == null) {
                throw new ActionNotDeclaredException(path, segment);
            }
            current = next;
        }
        if (current.capability == null) {
            throw new ActionNotDeclaredException(path, path.substring(path.lastIndexOf('.') + 1));
        }
        return current.capability;
    }

    /**
     * Look up and invoke a capability.
     */
    public String call(String path) throws ActionNotDeclaredException {
        return lookup(path).get();
    }

    public boolean contains(String path) {
        try {
            lookup(path);
            return true;
        } catch (ActionNotDeclaredException e) {
            return false;
        }
    }
}
