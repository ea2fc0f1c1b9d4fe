package com.contrastsecurity.tpack.index;

import com.contrastsecurity.tpack.extract.EntityExtractor;
import com.contrastsecurity.tpack.manifest.Manifest;
import com.contrastsecurity.tpack.manifest.ManifestStore;
import com.contrastsecurity.tpack.model.TpackException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds a {@link RepositoryIndex} from every generated manifest under a search root.
 */
public class RepositoryIndexer {
    private static final Logger logger = LoggerFactory.getLogger(RepositoryIndexer.class);

    private final ManifestStore store;
    private final Set<String> skipDirectories;

    public RepositoryIndexer() {
        this(new ManifestStore(), Collections.emptySet());
    }

    public RepositoryIndexer(ManifestStore store, Collection<String> extraSkipDirectories) {
        this.store = store;
        this.skipDirectories = new HashSet<>(EntityExtractor.DEFAULT_SKIP_DIRECTORIES);
        this.skipDirectories.addAll(extraSkipDirectories);
    }

    /**
     * Index all packages below the root. Manifests that cannot be read, that were not
     * written by this generator, or that have no name are skipped.
     *
     * @param searchRoot directory to walk
     * @return a fresh snapshot of the on-disk state
     */
    public RepositoryIndex build(Path searchRoot) {
        RepositoryIndex.Builder builder = new RepositoryIndex.Builder();
        if (!Files.isDirectory(searchRoot)) {
            logger.warn("Search root {} is not a directory, index is empty", searchRoot);
            return builder.build();
        }

        int[] manifests = {0};
        walk(searchRoot, builder, manifests);
        RepositoryIndex index = builder.build();
        logger.info("Indexed {} packages ({} entities) from {} manifests under {}",
                index.getPackageCount(), index.getEntityCount(), manifests[0], searchRoot);
        return index;
    }

    private void walk(Path dir, RepositoryIndex.Builder builder, int[] manifests) {
        if (Files.isRegularFile(ManifestStore.manifestPath(dir))) {
            manifests[0]++;
            register(dir, builder);
        }

        List<Path> children;
        try (Stream<Path> listing = Files.list(dir)) {
            children = listing.filter(Files::isDirectory).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            logger.warn("Cannot list {}: {}", dir, e.getMessage());
            return;
        }
        for (Path child : children) {
            if (!skipDirectories.contains(child.getFileName().toString())) {
                walk(child, builder, manifests);
            }
        }
    }

    private void register(Path packageDir, RepositoryIndex.Builder builder) {
        Manifest manifest;
        try {
            manifest = store.load(packageDir);
        } catch (TpackException e) {
            logger.warn("Skipping unreadable manifest in {}: {}", packageDir, e.getMessage());
            return;
        }
        if (manifest == null || !manifest.isGenerated()) {
            logger.debug("Skipping {}: not a generated manifest", packageDir);
            return;
        }
        String name = manifest.getName();
        if (name == null || name.trim().isEmpty()) {
            logger.debug("Skipping {}: manifest has no name", packageDir);
            return;
        }

        String namespace = manifest.getNamespace();
        boolean strict = manifest.getBoolean(Manifest.GENERATOR_STRICT_NAMESPACE, true);
        boolean lenient = namespace == null || namespace.trim().isEmpty() || !strict;
        IndexedPackage pkg = new IndexedPackage(name, namespace, manifest.getVersion(),
                manifest.getGithub(), lenient, packageDir);
        builder.add(pkg, manifest.getContributes().entities());
        logger.debug("Indexed {} from {}", pkg, packageDir);
    }
}
