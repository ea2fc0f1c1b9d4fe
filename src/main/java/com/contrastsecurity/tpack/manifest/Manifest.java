package com.contrastsecurity.tpack.manifest;

import com.contrastsecurity.tpack.model.EntitySet;
import com.contrastsecurity.tpack.model.ResolvedDependency;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view over the JSON object persisted as {@code manifest.json}.
 *
 * Field names are shared with downstream tooling and must not change.
 */
public class Manifest {

    public static final String FILE_NAME = "manifest.json";
    public static final String GENERATOR_ID = "talon-manifest-generator";

    public static final String NAME = "name";
    public static final String TITLE = "title";
    public static final String DESCRIPTION = "description";
    public static final String VERSION = "version";
    public static final String STATUS = "status";
    public static final String NAMESPACE = "namespace";
    public static final String GITHUB = "github";
    public static final String PREVIEW = "preview";
    public static final String AUTHOR = "author";
    public static final String TAGS = "tags";
    public static final String PLATFORMS = "platforms";
    public static final String LICENSE = "license";
    public static final String REQUIRES = "requires";
    public static final String DEPENDENCIES = "dependencies";
    public static final String DEV_DEPENDENCIES = "devDependencies";
    public static final String CONTRIBUTES = "contributes";
    public static final String DEPENDS = "depends";
    public static final String VALIDATE_DEPENDENCIES = "validateDependencies";
    public static final String GENERATOR = "_generator";
    public static final String GENERATOR_VERSION = "_generatorVersion";
    public static final String GENERATOR_REQUIRES_VERSION_ACTION = "_generatorRequiresVersionAction";
    public static final String GENERATOR_STRICT_NAMESPACE = "_generatorStrictNamespace";
    public static final String GENERATOR_FROZEN_FIELDS = "_generatorFrozenFields";

    /**
     * Modelled fields in the order they are written. Anything else follows them.
     */
    public static final List<String> FIELD_ORDER = Collections.unmodifiableList(Arrays.asList(
            NAME, TITLE, DESCRIPTION, VERSION, STATUS, NAMESPACE, GITHUB, PREVIEW, AUTHOR, TAGS,
            PLATFORMS, LICENSE, REQUIRES, DEPENDENCIES, DEV_DEPENDENCIES, CONTRIBUTES, DEPENDS,
            VALIDATE_DEPENDENCIES, GENERATOR, GENERATOR_VERSION, GENERATOR_REQUIRES_VERSION_ACTION,
            GENERATOR_STRICT_NAMESPACE, GENERATOR_FROZEN_FIELDS));

    public static final String MIN_VERSION = "min_version";
    static final String LEGACY_DEPENDENCY_VERSION = "version";

    private final JsonObject json;

    public Manifest() {
        this(new JsonObject());
    }

    public Manifest(JsonObject json) {
        this.json = json;
    }

    /**
     * The underlying object. Changes are visible through this manifest.
     */
    public JsonObject getJson() {
        return json;
    }

    public Manifest deepCopy() {
        return new Manifest(json.deepCopy());
    }

    public boolean has(String field) {
        return json.has(field) && !json.get(field).isJsonNull();
    }

    /**
     * @return the string value of a top-level field, or null if it is absent or not a string
     */
    public String getString(String field) {
        JsonElement value = json.get(field);
        if (value != null && value.isJsonPrimitive() && value.getAsJsonPrimitive().isString()) {
            return value.getAsString();
        }
        return null;
    }

    /**
     * True when the field is absent, null, an empty or whitespace string, or an empty array.
     */
    public boolean isBlank(String field) {
        JsonElement value = json.get(field);
        if (value == null || value.isJsonNull()) {
            return true;
        }
        if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isString()) {
            return value.getAsString().trim().isEmpty();
        }
        if (value.isJsonArray()) {
            return value.getAsJsonArray().size() == 0;
        }
        return false;
    }

    public boolean getBoolean(String field, boolean defaultValue) {
        JsonElement value = json.get(field);
        if (value != null && value.isJsonPrimitive() && value.getAsJsonPrimitive().isBoolean()) {
            return value.getAsBoolean();
        }
        return defaultValue;
    }

    public Boolean getBooleanOrNull(String field) {
        JsonElement value = json.get(field);
        if (value != null && value.isJsonPrimitive() && value.getAsJsonPrimitive().isBoolean()) {
            return value.getAsBoolean();
        }
        return null;
    }

    /**
     * String elements of an array field. Non-string elements are skipped.
     */
    public List<String> getStringList(String field) {
        JsonElement value = json.get(field);
        List<String> result = new ArrayList<>();
        if (value != null && value.isJsonArray()) {
            for (JsonElement element : value.getAsJsonArray()) {
                if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()) {
                    result.add(element.getAsString());
                }
            }
        }
        return result;
    }

    public EntitySet getEntitySet(String field) {
        JsonElement value = json.get(field);
        return EntitySet.fromJson(value != null && value.isJsonObject() ? value.getAsJsonObject() : null);
    }

    /**
     * Entries of a {@code dependencies}-shaped field in file order. A legacy {@code version}
     * key, or a bare version string, is read as the minimum version.
     */
    public Map<String, ResolvedDependency> getDependencies(String field) {
        Map<String, ResolvedDependency> result = new LinkedHashMap<>();
        JsonElement value = json.get(field);
        if (value == null || !value.isJsonObject()) {
            return result;
        }
        for (Map.Entry<String, JsonElement> entry : value.getAsJsonObject().entrySet()) {
            JsonElement raw = entry.getValue();
            if (raw.isJsonPrimitive()) {
                // Older manifests stored the version string directly
                result.put(entry.getKey(), new ResolvedDependency(entry.getKey(), null, null, raw.getAsString()));
                continue;
            }
            if (!raw.isJsonObject()) {
                continue;
            }
            JsonObject dep = entry.getValue().getAsJsonObject();
            String minVersion = stringMember(dep, MIN_VERSION);
            if (minVersion == null) {
                minVersion = stringMember(dep, LEGACY_DEPENDENCY_VERSION);
            }
            result.put(entry.getKey(), new ResolvedDependency(entry.getKey(),
                    stringMember(dep, NAMESPACE), stringMember(dep, GITHUB), minVersion));
        }
        return result;
    }

    public String getName() {
        return getString(NAME);
    }

    public String getNamespace() {
        return getString(NAMESPACE);
    }

    public String getVersion() {
        return getString(VERSION);
    }

    public String getGithub() {
        return getString(GITHUB);
    }

    public EntitySet getContributes() {
        return getEntitySet(CONTRIBUTES);
    }

    public List<String> getFrozenFields() {
        return getStringList(GENERATOR_FROZEN_FIELDS);
    }

    /**
     * True when this manifest was written by this generator.
     */
    public boolean isGenerated() {
        return GENERATOR_ID.equals(getString(GENERATOR));
    }

    public void set(String field, JsonElement value) {
        json.add(field, value);
    }

    public void set(String field, String value) {
        json.add(field, value == null ? null : new JsonPrimitive(value));
    }

    public void set(String field, boolean value) {
        json.addProperty(field, value);
    }

    public void set(String field, List<String> values) {
        JsonArray array = new JsonArray();
        for (String v : values) {
            array.add(v);
        }
        json.add(field, array);
    }

    private static String stringMember(JsonObject object, String member) {
        JsonElement value = object.get(member);
        if (value != null && value.isJsonPrimitive()) {
            return value.getAsString();
        }
        return null;
    }

    @Override
    public String toString() {
        return json.toString();
    }
}
