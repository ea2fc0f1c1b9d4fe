package com.contrastsecurity.tpack.resolve;

import com.contrastsecurity.tpack.extract.ExtractionResult;
import com.contrastsecurity.tpack.index.IndexedPackage;
import com.contrastsecurity.tpack.index.RepositoryIndex;
import com.contrastsecurity.tpack.model.Entity;
import com.contrastsecurity.tpack.model.EntityKind;
import com.contrastsecurity.tpack.model.EntitySet;
import com.contrastsecurity.tpack.model.ResolvedDependency;
import com.contrastsecurity.tpack.model.Warning;
import com.contrastsecurity.tpack.model.WarningType;
import com.contrastsecurity.tpack.version.VersionParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Turns one package's extracted entities into contributes, depends and dependencies.
 *
 * Problems found along the way are returned as warnings; resolution itself never fails.
 */
public class DependencyResolver {
    private static final Logger logger = LoggerFactory.getLogger(DependencyResolver.class);

    /**
     * Resolve a package against the index.
     *
     * @param context the package being processed
     * @param extraction what the package declares and references
     * @param index snapshot of all indexed packages
     * @return resolution with accumulated warnings
     */
    public ResolutionResult resolve(PackageContext context, ExtractionResult extraction, RepositoryIndex index) {
        ResolutionResult result = new ResolutionResult();
        EntitySet declared = extraction.getDeclared();
        result.getContributes().addAll(declared);

        String namespace = effectiveNamespace(context, declared, result);

        List<String> selfUndeclared = new ArrayList<>();
        for (Entity entity : extraction.getReferenced().entities()) {
            if (declared.contains(entity) || BuiltinEntities.isBuiltin(entity)) {
                continue;
            }
            if (NamespacePolicy.matches(namespace, entity.getName())
                    && !claimedByLongerNamespace(context, namespace, entity, index)) {
                selfUndeclared.add(entity.toString());
                continue;
            }
            resolveReference(context, entity, index, result);
        }

        if (!selfUndeclared.isEmpty()) {
            result.addWarning(new Warning(WarningType.SELF_NAMESPACE_UNDECLARED,
                    "Entities under own namespace " + namespace + " are referenced but no declaration was found: "
                            + String.join(", ", selfUndeclared),
                    selfUndeclared));
        }

        for (String dev : context.getDevDependencies()) {
            if (result.getDependencies().remove(dev) != null) {
                logger.debug("{}: {} is a dev dependency, not listed in dependencies", context.getName(), dev);
            }
        }

        checkNamespaceConsistency(context, namespace, declared, result);
        checkVersionAction(context, namespace, declared, result);

        logger.info("Resolved {}: {} contributed, {} depended on, {} dependencies, {} warnings",
                context.getName(), result.getContributes().size(), result.getDepends().size(),
                result.getDependencies().size(), result.getWarnings().size());
        return result;
    }

    private String effectiveNamespace(PackageContext context, EntitySet declared, ResolutionResult result) {
        if (context.getNamespace() != null) {
            String declaredNamespace = NamespacePolicy.normalize(context.getNamespace());
            result.setNamespace(declaredNamespace, false);
            return declaredNamespace;
        }
        if (!context.isStrictNamespace()) {
            return null;
        }

        String inferred = NamespacePolicy.infer(declared);
        if (inferred != null) {
            logger.info("{}: inferred namespace {}", context.getName(), inferred);
            result.setNamespace(inferred, true);
        } else if (declared.hasNamespacedEntries()) {
            result.addWarning(new Warning(WarningType.NAMESPACE_INCONSISTENCY,
                    "Could not infer a namespace for " + context.getName()
                            + "; set \"namespace\" in manifest.json"));
        }
        return inferred;
    }

    /**
     * True when another indexed package owns a more specific namespace covering the entity,
     * e.g. {@code user.ui_elements} for {@code user.ui_elements_show} referenced from {@code user.ui}.
     */
    private static boolean claimedByLongerNamespace(PackageContext context, String namespace, Entity entity,
                                                    RepositoryIndex index) {
        for (IndexedPackage pkg : index.getPackages()) {
            if (pkg.getName().equals(context.getName())) {
                continue;
            }
            String other = NamespacePolicy.normalize(pkg.getNamespace());
            if (other != null && other.length() > namespace.length()
                    && NamespacePolicy.matches(other, entity.getName())) {
                return true;
            }
        }
        return false;
    }

    private void resolveReference(PackageContext context, Entity entity, RepositoryIndex index, ResolutionResult result) {
        result.getDepends().add(entity);

        List<IndexedPackage> candidates = index.candidates(entity, context.getName());
        if (candidates.isEmpty()) {
            result.getUnresolved().add(entity);
            result.addWarning(new Warning(WarningType.UNRESOLVED_REFERENCE,
                    entity + " is not declared by any indexed package",
                    Collections.singletonList(entity.getName())));
            return;
        }

        IndexedPackage chosen = candidates.get(0);
        if (candidates.size() > 1) {
            chosen = choose(candidates);
            List<String> names = new ArrayList<>();
            List<String> described = new ArrayList<>();
            for (IndexedPackage candidate : candidates) {
                names.add(candidate.getName());
                described.add(candidate.isLenient() ? candidate.getName() + " (no namespace checks)" : candidate.getName());
            }
            result.getAmbiguous().add(entity);
            result.addWarning(new Warning(WarningType.AMBIGUOUS_REFERENCE,
                    entity + " is declared by " + String.join(", ", described) + "; using " + chosen.getName(),
                    names));
        }

        addDependency(result.getDependencies(), chosen);
    }

    /**
     * The candidate with the lexicographically lowest package name.
     *
     * @param candidates at least one package declaring the same entity
     */
    public static IndexedPackage choose(List<IndexedPackage> candidates) {
        IndexedPackage chosen = candidates.get(0);
        for (IndexedPackage candidate : candidates) {
            if (candidate.getName().compareTo(chosen.getName()) < 0) {
                chosen = candidate;
            }
        }
        return chosen;
    }

    private static void addDependency(Map<String, ResolvedDependency> dependencies, IndexedPackage pkg) {
        ResolvedDependency existing = dependencies.get(pkg.getName());
        String minVersion = existing == null
                ? pkg.getVersion()
                : VersionParser.max(existing.getMinVersion(), pkg.getVersion());
        dependencies.put(pkg.getName(),
                new ResolvedDependency(pkg.getName(), pkg.getNamespace(), pkg.getGithub(), minVersion));
    }

    private void checkNamespaceConsistency(PackageContext context, String namespace, EntitySet declared,
                                           ResolutionResult result) {
        if (!context.isStrictNamespace() || namespace == null) {
            return;
        }
        List<String> offenders = NamespacePolicy.inconsistentEntities(namespace, declared);
        if (!offenders.isEmpty()) {
            result.addWarning(new Warning(WarningType.NAMESPACE_INCONSISTENCY,
                    offenders.size() + " contributed entities are outside namespace " + namespace
                            + " (expected '" + namespace + "' or '" + namespace + "_*'): " + String.join(", ", offenders),
                    offenders));
        }
    }

    private void checkVersionAction(PackageContext context, String namespace, EntitySet declared,
                                    ResolutionResult result) {
        if (namespace == null || !context.isRequiresVersionAction() || !declared.hasNamespacedEntries()) {
            return;
        }
        String expected = NamespacePolicy.expectedVersionAction(namespace);
        if (!declared.contains(EntityKind.ACTION, expected)) {
            result.addWarning(new Warning(WarningType.MISSING_VERSION_ACTION,
                    "Missing version action " + expected + "; add it or set \"_generatorRequiresVersionAction\": false",
                    Collections.singletonList(expected)));
        }
    }
}
