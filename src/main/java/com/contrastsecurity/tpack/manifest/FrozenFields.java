package com.contrastsecurity.tpack.manifest;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * Dotted field paths that regeneration must leave as the owner wrote them.
 *
 * A path such as {@code contributes.actions} addresses a member of a nested object.
 * Paths of any depth are supported; array elements are not addressable.
 */
public final class FrozenFields {
    private static final Logger logger = LoggerFactory.getLogger(FrozenFields.class);

    private FrozenFields() {
    }

    /**
     * For every frozen path copy the existing value into the generated object, or remove
     * it from the generated object when the existing manifest had no value there.
     *
     * @param generated freshly computed manifest, modified in place
     * @param existing manifest as loaded from disk
     * @param paths frozen dotted paths
     */
    public static void apply(JsonObject generated, JsonObject existing, Collection<String> paths) {
        for (String path : paths) {
            if (path == null || path.trim().isEmpty()) {
                continue;
            }
            JsonElement value = get(existing, path);
            if (value != null) {
                set(generated, path, value.deepCopy());
            } else {
                remove(generated, path);
            }
            logger.debug("Frozen field {} kept as {}", path, value);
        }
    }

    /**
     * @return the value at the path, or null if any segment is missing or not an object
     */
    public static JsonElement get(JsonObject root, String path) {
        String[] segments = path.split("\\.");
        JsonElement current = root;
        for (String segment : segments) {
            if (current == null || !current.isJsonObject()) {
                return null;
            }
            current = current.getAsJsonObject().get(segment);
        }
        return current;
    }

    /**
     * Set the value at the path, creating or replacing intermediate objects as needed.
     */
    public static void set(JsonObject root, String path, JsonElement value) {
        String[] segments = path.split("\\.");
        JsonObject current = root;
        for (int i = 0; i < segments.length - 1; i++) {
            JsonElement child = current.get(segments[i]);
            if (child == null || !child.isJsonObject()) {
                JsonObject created = new JsonObject();
                current.add(segments[i], created);
                current = created;
            } else {
                current = child.getAsJsonObject();
            }
        }
        current.add(segments[segments.length - 1], value);
    }

    /**
     * Remove the value at the path if it exists. Parents are left in place.
     */
    public static void remove(JsonObject root, String path) {
        int lastDot = path.lastIndexOf('.');
        JsonElement parent = lastDot < 0 ? root : get(root, path.substring(0, lastDot));
        if (parent != null && parent.isJsonObject()) {
            parent.getAsJsonObject().remove(path.substring(lastDot + 1));
        }
    }
}
