package io.bptree.collections.bplustree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class ValidationReport {
    private final List<String> violations;

    ValidationReport(List<String> violations) {
        this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    /** Human-readable descriptions of each broken invariant, in the order they were found. */
    public List<String> getViolations() {
        return violations;
    }

    @Override
    public String toString() {
        return isValid() ? "valid" : violations.toString();
    }
}
