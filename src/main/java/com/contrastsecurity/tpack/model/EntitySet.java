package com.contrastsecurity.tpack.model;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Entities grouped by kind. Names are deduplicated and kept in sorted order so that
 * two scans of the same tree always serialize identically.
 */
public class EntitySet {
    private final Map<EntityKind, Set<String>> byKind;

    public EntitySet() {
        this.byKind = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            byKind.put(kind, new TreeSet<>());
        }
    }

    public boolean add(EntityKind kind, String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        return byKind.get(kind).add(name);
    }

    public boolean add(Entity entity) {
        return add(entity.getKind(), entity.getName());
    }

    public void addAll(EntitySet other) {
        for (EntityKind kind : EntityKind.values()) {
            byKind.get(kind).addAll(other.byKind.get(kind));
        }
    }

    public boolean contains(Entity entity) {
        return byKind.get(entity.getKind()).contains(entity.getName());
    }

    public boolean contains(EntityKind kind, String name) {
        return byKind.get(kind).contains(name);
    }

    /**
     * Sorted, duplicate-free names of one kind. Never null.
     */
    public List<String> names(EntityKind kind) {
        return Collections.unmodifiableList(new ArrayList<>(byKind.get(kind)));
    }

    /**
     * All entities, ordered by kind then name.
     */
    public List<Entity> entities() {
        List<Entity> result = new ArrayList<>();
        for (EntityKind kind : EntityKind.values()) {
            for (String name : byKind.get(kind)) {
                result.add(new Entity(kind, name));
            }
        }
        return result;
    }

    public int size() {
        int total = 0;
        for (Set<String> names : byKind.values()) {
            total += names.size();
        }
        return total;
    }

    public int size(EntityKind kind) {
        return byKind.get(kind).size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * True when any kind other than apps has entries. Apps are not namespaced and do not
     * count as contributions for namespace and version-action checks.
     */
    public boolean hasNamespacedEntries() {
        for (EntityKind kind : EntityKind.values()) {
            if (kind != EntityKind.APP && !byKind.get(kind).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Serialize with every kind present, empty kinds as empty arrays.
     */
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        for (EntityKind kind : EntityKind.values()) {
            JsonArray array = new JsonArray();
            for (String name : byKind.get(kind)) {
                array.add(name);
            }
            json.add(kind.getManifestKey(), array);
        }
        return json;
    }

    /**
     * Read a {@code contributes}/{@code depends} style object. Unknown keys and non-string
     * values are ignored.
     */
    public static EntitySet fromJson(JsonObject json) {
        EntitySet set = new EntitySet();
        if (json == null) {
            return set;
        }
        for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
            EntityKind kind = EntityKind.fromManifestKey(entry.getKey());
            if (kind == null || !entry.getValue().isJsonArray()) {
                continue;
            }
            for (JsonElement element : entry.getValue().getAsJsonArray()) {
                if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()) {
                    set.add(kind, element.getAsString());
                }
            }
        }
        return set;
    }

    @Override
    public String toString() {
        return byKind.toString();
    }
}
