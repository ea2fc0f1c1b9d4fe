package com.contrastsecurity.tpack.resolve;

import com.contrastsecurity.tpack.model.Entity;
import com.contrastsecurity.tpack.model.EntityKind;
import com.contrastsecurity.tpack.model.EntitySet;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rules tying entity names to a package namespace.
 *
 * A namespace such as {@code user.mouse_rig} owns {@code user.mouse_rig} itself and every
 * name continuing it with {@code _} or {@code .}, e.g. {@code user.mouse_rig_start}.
 */
public final class NamespacePolicy {

    private static final String USER_PREFIX = "user.";
    private static final String[] QUALIFIED_PREFIXES = {"user.", "edit.", "core.", "app.", "code."};

    private NamespacePolicy() {
    }

    /**
     * @return true if the name belongs to the namespace
     */
    public static boolean matches(String namespace, String name) {
        if (namespace == null || namespace.isEmpty() || name == null) {
            return false;
        }
        return name.equals(namespace)
                || name.startsWith(namespace + "_")
                || name.startsWith(namespace + ".");
    }

    /**
     * Qualify a bare namespace with {@code user.}.
     */
    public static String normalize(String namespace) {
        if (namespace == null || namespace.trim().isEmpty()) {
            return null;
        }
        String trimmed = namespace.trim();
        for (String prefix : QUALIFIED_PREFIXES) {
            if (trimmed.startsWith(prefix)) {
                return trimmed;
            }
        }
        return USER_PREFIX + trimmed;
    }

    /**
     * Namespace without the {@code user.} qualifier.
     */
    public static String base(String namespace) {
        return namespace.startsWith(USER_PREFIX) ? namespace.substring(USER_PREFIX.length()) : namespace;
    }

    /**
     * Name of the action a package with this namespace exposes its version through.
     */
    public static String expectedVersionAction(String namespace) {
        return USER_PREFIX + base(namespace) + "_version";
    }

    /**
     * Infer a namespace from contributed names: the longest underscore-delimited prefix
     * shared by more than half of them. A single name yields everything before its last
     * underscore. Apps and names without a dot are ignored.
     *
     * @return normalised namespace, or null if no prefix qualifies
     */
    public static String infer(EntitySet contributes) {
        List<String> names = new ArrayList<>();
        for (Entity entity : contributes.entities()) {
            if (entity.getKind() != EntityKind.APP && entity.getName().contains(".")) {
                names.add(entity.getName());
            }
        }
        if (names.isEmpty()) {
            return null;
        }
        if (names.size() == 1) {
            String only = names.get(0);
            int underscore = only.lastIndexOf('_');
            return normalize(underscore > 0 ? only.substring(0, underscore) : only);
        }

        Map<String, Integer> counts = new HashMap<>();
        for (String name : names) {
            String[] parts = name.split("_", -1);
            StringBuilder prefix = new StringBuilder();
            for (int i = 0; i < parts.length; i++) {
                if (i > 0) {
                    prefix.append('_');
                }
                prefix.append(parts[i]);
                counts.merge(prefix.toString(), 1, Integer::sum);
            }
        }

        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            String prefix = entry.getKey();
            int count = entry.getValue();
            if (count * 2 <= names.size()) {
                continue;
            }
            if (best == null
                    || prefix.length() > best.length()
                    || (prefix.length() == best.length() && count > bestCount)
                    || (prefix.length() == best.length() && count == bestCount && prefix.compareTo(best) < 0)) {
                best = prefix;
                bestCount = count;
            }
        }
        return normalize(best);
    }

    /**
     * Contributed {@code user.*} names outside the namespace, formatted {@code kind:name}.
     * Apps are not namespaced and never reported.
     */
    public static List<String> inconsistentEntities(String namespace, EntitySet contributes) {
        String base = base(namespace);
        List<String> offenders = new ArrayList<>();
        for (Entity entity : contributes.entities()) {
            if (entity.getKind() == EntityKind.APP || !entity.getName().startsWith(USER_PREFIX)) {
                continue;
            }
            String suffix = entity.getName().substring(USER_PREFIX.length());
            if (suffix.isEmpty()) {
                continue;
            }
            if (!suffix.equals(base) && !suffix.startsWith(base + "_")) {
                offenders.add(entity.toString());
            }
        }
        return offenders;
    }
}
