package com.contrastsecurity.tpack.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A non-fatal finding produced while extracting or resolving a package.
 */
public class Warning {
    private final WarningType type;
    private final String message;
    private final List<String> subjects;

    public Warning(WarningType type, String message) {
        this(type, message, null);
    }

    /**
     * @param type warning category
     * @param message human readable description
     * @param subjects entity names, package names or file paths the warning is about (can be null)
     */
    public Warning(WarningType type, String message, List<String> subjects) {
        this.type = Objects.requireNonNull(type, "type");
        this.message = message;
        this.subjects = subjects != null ? new ArrayList<>(subjects) : new ArrayList<>();
    }

    public WarningType getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    public List<String> getSubjects() {
        return Collections.unmodifiableList(subjects);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Warning warning = (Warning) o;
        return type == warning.type &&
                Objects.equals(message, warning.message) &&
                Objects.equals(subjects, warning.subjects);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, message, subjects);
    }

    @Override
    public String toString() {
        return type + ": " + message;
    }
}
