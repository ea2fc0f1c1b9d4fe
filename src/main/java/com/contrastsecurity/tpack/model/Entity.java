package com.contrastsecurity.tpack.model;

import java.util.Objects;

/**
 * A named, kind-tagged capability such as the action {@code user.my_package_go}.
 *
 * Equality is by kind and exact name.
 */
public final class Entity implements Comparable<Entity> {
    private final EntityKind kind;
    private final String name;

    public Entity(EntityKind kind, String name) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = Objects.requireNonNull(name, "name");
    }

    public static Entity of(EntityKind kind, String name) {
        return new Entity(kind, name);
    }

    public EntityKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    /**
     * Leading dotted segment of the name, e.g. "user" for "user.foo_bar".
     * Names without a dot (apps) have no namespace segment and return an empty string.
     */
    public String getNamespaceSegment() {
        int dot = name.indexOf('.');
        return dot > 0 ? name.substring(0, dot) : "";
    }

    @Override
    public int compareTo(Entity other) {
        int byKind = kind.compareTo(other.kind);
        return byKind != 0 ? byKind : name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return kind == entity.kind && name.equals(entity.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name);
    }

    @Override
    public String toString() {
        return kind.getManifestKey() + ":" + name;
    }
}
