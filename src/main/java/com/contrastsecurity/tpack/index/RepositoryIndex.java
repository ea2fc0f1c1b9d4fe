package com.contrastsecurity.tpack.index;

import com.contrastsecurity.tpack.model.Entity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable snapshot of which packages declare which entities.
 *
 * Several packages may declare the same entity; that is recorded, not rejected.
 */
public class RepositoryIndex {
    private final Map<Entity, List<IndexedPackage>> byEntity;
    private final Map<String, IndexedPackage> packages;

    private RepositoryIndex(Map<Entity, List<IndexedPackage>> byEntity, Map<String, IndexedPackage> packages) {
        this.byEntity = byEntity;
        this.packages = packages;
    }

    public static RepositoryIndex empty() {
        return new Builder().build();
    }

    /**
     * Packages declaring the entity, sorted by name, without the excluded package.
     *
     * @param entity entity to look up
     * @param excludePackage name of the package being resolved (can be null)
     */
    public List<IndexedPackage> candidates(Entity entity, String excludePackage) {
        List<IndexedPackage> all = byEntity.get(entity);
        if (all == null) {
            return Collections.emptyList();
        }
        List<IndexedPackage> result = new ArrayList<>(all.size());
        for (IndexedPackage pkg : all) {
            if (excludePackage == null || !excludePackage.equals(pkg.getName())) {
                result.add(pkg);
            }
        }
        return result;
    }

    public IndexedPackage getPackage(String name) {
        return packages.get(name);
    }

    /**
     * All indexed packages, sorted by name.
     */
    public Collection<IndexedPackage> getPackages() {
        return Collections.unmodifiableCollection(packages.values());
    }

    /**
     * All indexed entities with their declaring packages.
     */
    public Map<Entity, List<IndexedPackage>> getEntries() {
        return Collections.unmodifiableMap(byEntity);
    }

    public int getPackageCount() {
        return packages.size();
    }

    public int getEntityCount() {
        return byEntity.size();
    }

    public static class Builder {
        private final Map<Entity, List<IndexedPackage>> byEntity = new HashMap<>();
        private final Map<String, IndexedPackage> packages = new TreeMap<>();

        /**
         * Register a package under each of its contributed entities. A second package with
         * the same name replaces nothing; both stay visible as candidates.
         */
        public Builder add(IndexedPackage pkg, Collection<Entity> contributed) {
            packages.putIfAbsent(pkg.getName(), pkg);
            for (Entity entity : contributed) {
                List<IndexedPackage> list = byEntity.computeIfAbsent(entity, e -> new ArrayList<>());
                if (!list.contains(pkg)) {
                    list.add(pkg);
                }
            }
            return this;
        }

        public RepositoryIndex build() {
            Map<Entity, List<IndexedPackage>> frozen = new HashMap<>();
            for (Map.Entry<Entity, List<IndexedPackage>> entry : byEntity.entrySet()) {
                List<IndexedPackage> sorted = new ArrayList<>(entry.getValue());
                Collections.sort(sorted);
                frozen.put(entry.getKey(), Collections.unmodifiableList(sorted));
            }
            return new RepositoryIndex(frozen, new TreeMap<>(packages));
        }
    }
}
