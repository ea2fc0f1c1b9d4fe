package com.contrastsecurity.tpack.runtime;

import com.contrastsecurity.tpack.manifest.Manifest;
import com.contrastsecurity.tpack.model.ResolvedDependency;
import com.contrastsecurity.tpack.resolve.NamespacePolicy;
import com.contrastsecurity.tpack.version.VersionParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that every dependency of a package is loaded in a recent enough version, by
 * calling the version action each dependency exposes.
 *
 * Validation must never stop the host from starting: every failure, expected or not,
 * ends up in the returned {@link ValidationResult}.
 */
public class DependencyValidator {
    private static final Logger logger = LoggerFactory.getLogger(DependencyValidator.class);

    public ValidationResult validate(Manifest manifest, CapabilityRegistry registry) {
        String packageName = manifest.getName() != null ? manifest.getName() : "<unnamed>";
        if (!manifest.getBoolean(Manifest.VALIDATE_DEPENDENCIES, true)) {
            logger.debug("{}: dependency validation disabled", packageName);
            return ValidationResult.skipped(packageName);
        }

        ValidationResult result = new ValidationResult(packageName, false);
        try {
            for (ResolvedDependency dep : manifest.getDependencies(Manifest.DEPENDENCIES).values()) {
                check(dep, registry, result);
            }
        } catch (RuntimeException e) {
            logger.debug("{}: dependency validation failed", packageName, e);
            result.setError(e);
        }
        return result;
    }

    private void check(ResolvedDependency dep, CapabilityRegistry registry, ValidationResult result) {
        String namespace = NamespacePolicy.normalize(dep.getNamespace());
        if (namespace == null) {
            result.addProblem(dep.getName() + ": no namespace recorded, cannot check its version");
            return;
        }

        String action = CapabilityRegistry.ACTIONS + "." + NamespacePolicy.expectedVersionAction(namespace);
        String actual;
        try {
            actual = registry.call(action);
        } catch (ActionNotDeclaredException e) {
            result.addProblem(dep.getName() + ": not installed or too old to report its version ("
                    + e.getMessage() + ")");
            return;
        }

        String required = dep.getMinVersion();
        if (required != null && !VersionParser.satisfies(actual, required)) {
            result.addProblem(dep.getName() + ": version " + actual + " installed, " + required + " required");
        } else {
            result.addSatisfied(dep.getName() + " " + actual);
        }
    }
}
