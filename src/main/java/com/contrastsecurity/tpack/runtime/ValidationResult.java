package com.contrastsecurity.tpack.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of checking one package's dependencies at runtime. Never thrown, only inspected.
 */
public class ValidationResult {
    private final String packageName;
    private final boolean skipped;
    private final List<String> satisfied = new ArrayList<>();
    private final List<String> problems = new ArrayList<>();
    private Exception error;

    ValidationResult(String packageName, boolean skipped) {
        this.packageName = packageName;
        this.skipped = skipped;
    }

    public static ValidationResult skipped(String packageName) {
        return new ValidationResult(packageName, true);
    }

    void addSatisfied(String dependency) {
        satisfied.add(dependency);
    }

    void addProblem(String problem) {
        problems.add(problem);
    }

    void setError(Exception error) {
        this.error = error;
    }

    public String getPackageName() {
        return packageName;
    }

    /**
     * True when the manifest opted out with {@code validateDependencies: false}.
     */
    public boolean isSkipped() {
        return skipped;
    }

    public List<String> getSatisfied() {
        return Collections.unmodifiableList(satisfied);
    }

    public List<String> getProblems() {
        return Collections.unmodifiableList(problems);
    }

    /**
     * Unexpected failure of the check itself, or null.
     */
    public Exception getError() {
        return error;
    }

    public boolean isOk() {
        return problems.isEmpty() && error == null;
    }
}
