package com.contrastsecurity.tpack.resolve;

import com.contrastsecurity.tpack.model.EntitySet;
import com.contrastsecurity.tpack.model.ResolvedDependency;
import com.contrastsecurity.tpack.model.Warning;
import com.contrastsecurity.tpack.model.WarningType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of resolving one package against the repository index.
 */
public class ResolutionResult {
    private final EntitySet contributes = new EntitySet();
    private final EntitySet depends = new EntitySet();
    private final Map<String, ResolvedDependency> dependencies = new TreeMap<>();
    private final EntitySet unresolved = new EntitySet();
    private final EntitySet ambiguous = new EntitySet();
    private final List<Warning> warnings = new ArrayList<>();
    private String namespace;
    private boolean namespaceInferred;

    public EntitySet getContributes() {
        return contributes;
    }

    public EntitySet getDepends() {
        return depends;
    }

    /**
     * Dependencies keyed and sorted by package name.
     */
    public Map<String, ResolvedDependency> getDependencies() {
        return dependencies;
    }

    public EntitySet getUnresolved() {
        return unresolved;
    }

    public EntitySet getAmbiguous() {
        return ambiguous;
    }

    public List<Warning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public List<Warning> getWarnings(WarningType type) {
        List<Warning> result = new ArrayList<>();
        for (Warning warning : warnings) {
            if (warning.getType() == type) {
                result.add(warning);
            }
        }
        return result;
    }

    void addWarning(Warning warning) {
        warnings.add(warning);
    }

    /**
     * Effective namespace: declared, inferred, or null.
     */
    public String getNamespace() {
        return namespace;
    }

    void setNamespace(String namespace, boolean inferred) {
        this.namespace = namespace;
        this.namespaceInferred = inferred;
    }

    public boolean isNamespaceInferred() {
        return namespaceInferred;
    }
}
