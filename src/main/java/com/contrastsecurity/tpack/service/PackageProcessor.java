package com.contrastsecurity.tpack.service;

import com.contrastsecurity.tpack.extract.EntityExtractor;
import com.contrastsecurity.tpack.extract.ExtractionResult;
import com.contrastsecurity.tpack.index.RepositoryIndex;
import com.contrastsecurity.tpack.index.RepositoryIndexer;
import com.contrastsecurity.tpack.manifest.Manifest;
import com.contrastsecurity.tpack.manifest.ManifestMerger;
import com.contrastsecurity.tpack.manifest.ManifestStore;
import com.contrastsecurity.tpack.manifest.MergeRequest;
import com.contrastsecurity.tpack.model.PackageIOException;
import com.contrastsecurity.tpack.model.TpackException;
import com.contrastsecurity.tpack.model.Warning;
import com.contrastsecurity.tpack.resolve.DependencyResolver;
import com.contrastsecurity.tpack.resolve.PackageContext;
import com.contrastsecurity.tpack.resolve.ResolutionResult;
import com.contrastsecurity.tpack.util.LicenseDetector;
import com.contrastsecurity.tpack.util.PreviewDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Runs extract, resolve, merge and write for each package of a batch.
 */
public class PackageProcessor {
    private static final Logger logger = LoggerFactory.getLogger(PackageProcessor.class);

    private final EntityExtractor extractor;
    private final RepositoryIndexer indexer;
    private final DependencyResolver resolver;
    private final ManifestMerger merger;
    private final ManifestStore store;
    private final String generatorVersion;

    public PackageProcessor(String generatorVersion, Collection<String> extraSkipDirectories) {
        this(new EntityExtractor(extraSkipDirectories),
                new RepositoryIndexer(new ManifestStore(), extraSkipDirectories),
                new DependencyResolver(), new ManifestMerger(), new ManifestStore(), generatorVersion);
    }

    public PackageProcessor(EntityExtractor extractor, RepositoryIndexer indexer, DependencyResolver resolver,
                            ManifestMerger merger, ManifestStore store, String generatorVersion) {
        this.extractor = extractor;
        this.indexer = indexer;
        this.resolver = resolver;
        this.merger = merger;
        this.store = store;
        this.generatorVersion = generatorVersion;
    }

    /**
     * Process every package against one index snapshot taken before the first package.
     * A failing package is recorded and the batch moves on.
     *
     * @param packageDirs packages to process, in order
     * @param searchRoot root the repository index is built from
     * @param dryRun compute everything but write nothing
     */
    public BatchReport processAll(List<Path> packageDirs, Path searchRoot, boolean dryRun) {
        RepositoryIndex index = indexer.build(searchRoot);
        BatchReport report = new BatchReport();
        for (Path dir : packageDirs) {
            try {
                report.add(process(dir, index, dryRun));
            } catch (TpackException e) {
                logger.error("Skipping {}: {}", dir, e.getMessage());
                report.add(PackageOutcome.failed(dir, e));
            } catch (RuntimeException e) {
                logger.error("Unexpected error processing {}: {}", dir, e.getMessage(), e);
                report.add(PackageOutcome.failed(dir, e));
            }
        }
        return report;
    }

    /**
     * Run the full pipeline for one package.
     *
     * @throws TpackException if the package directory or its manifest cannot be read,
     *         or the new manifest cannot be written
     */
    public PackageOutcome process(Path packageDir, RepositoryIndex index, boolean dryRun) throws TpackException {
        Manifest existing = store.load(packageDir);
        ExtractionResult extraction = extractor.extract(packageDir);
        PackageContext context = PackageContext.from(packageDir, existing);
        ResolutionResult resolution = resolver.resolve(context, extraction, index);

        String dirName = packageDir.toAbsolutePath().normalize().getFileName().toString();
        MergeRequest request = new MergeRequest(dirName, existing, resolution,
                extraction.getRequirements(), generatorVersion)
                .withPreviewFile(PreviewDetector.findPreviewFile(packageDir));
        if (existing == null || existing.isBlank(Manifest.LICENSE)) {
            request.withDetectedLicense(LicenseDetector.detect(packageDir));
        }
        Manifest merged = merger.merge(request);
        String json = store.toJson(merged);

        List<Warning> warnings = new ArrayList<>(extraction.getWarnings());
        warnings.addAll(resolution.getWarnings());
        for (Warning warning : warnings) {
            logger.warn("{}: {} {}", context.getName(), warning.getType(), warning.getMessage());
        }

        PackageOutcome.Status status;
        if (dryRun) {
            status = PackageOutcome.Status.DRY_RUN;
        } else if (json.equals(currentContent(packageDir))) {
            status = PackageOutcome.Status.UNCHANGED;
        } else {
            store.write(packageDir, merged);
            status = PackageOutcome.Status.WRITTEN;
        }
        logger.info("{}: {}", context.getName(), status);
        return PackageOutcome.completed(packageDir, merged.getName(), status, warnings, json);
    }

    private static String currentContent(Path packageDir) throws PackageIOException {
        Path file = ManifestStore.manifestPath(packageDir);
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PackageIOException(packageDir, "Failed to read " + file + ": " + e.getMessage(), e);
        }
    }
}
