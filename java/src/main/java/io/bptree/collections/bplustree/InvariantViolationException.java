package io.bptree.collections.bplustree;

/**
 * Signals a tree whose structure breaks sortedness, separator validity, balance or the fanout bound. Inserts through
 * the public API never produce such a tree, so this always indicates a programming error.
 */
public class InvariantViolationException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    private final transient ValidationReport report;

    public InvariantViolationException(ValidationReport report) {
        super("tree invariants violated: " + String.join("; ", report.getViolations()));
        this.report = report;
    }

    public ValidationReport getReport() {
        return report;
    }
}
