package com.contrastsecurity.tpack.model;

/**
 * Kinds of named entities a package can contribute or depend on.
 *
 * Declaration order is the order in which kinds are written to the manifest.
 */
public enum EntityKind {
    ACTION("actions"),
    SETTING("settings"),
    TAG("tags"),
    LIST("lists"),
    MODE("modes"),
    SCOPE("scopes"),
    CAPTURE("captures"),
    APP("apps");

    private final String manifestKey;

    EntityKind(String manifestKey) {
        this.manifestKey = manifestKey;
    }

    /**
     * Key used for this kind inside the {@code contributes} and {@code depends} sections.
     */
    public String getManifestKey() {
        return manifestKey;
    }

    /**
     * Get EntityKind from its manifest key.
     *
     * @param manifestKey plural key such as "actions"
     * @return EntityKind enum or null if not found
     */
    public static EntityKind fromManifestKey(String manifestKey) {
        if (manifestKey == null) {
            return null;
        }
        for (EntityKind kind : values()) {
            if (kind.manifestKey.equalsIgnoreCase(manifestKey)) {
                return kind;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return manifestKey;
    }
}
