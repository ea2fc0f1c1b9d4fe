package com.contrastsecurity.tpack.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcomes of every package in a batch, in processing order.
 */
public class BatchReport {
    private final List<PackageOutcome> outcomes = new ArrayList<>();

    public void add(PackageOutcome outcome) {
        outcomes.add(outcome);
    }

    public List<PackageOutcome> getOutcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    public List<PackageOutcome> getFailures() {
        List<PackageOutcome> failures = new ArrayList<>();
        for (PackageOutcome outcome : outcomes) {
            if (outcome.isFailed()) {
                failures.add(outcome);
            }
        }
        return failures;
    }

    public boolean hasFailures() {
        return !getFailures().isEmpty();
    }

    public int count(PackageOutcome.Status status) {
        int count = 0;
        for (PackageOutcome outcome : outcomes) {
            if (outcome.getStatus() == status) {
                count++;
            }
        }
        return count;
    }

    public int getWarningCount() {
        int count = 0;
        for (PackageOutcome outcome : outcomes) {
            count += outcome.getWarnings().size();
        }
        return count;
    }
}
