package org.exposql.testkit;

/**
 * One material difference between the outcomes of two plans, addressed by a JSON-path-like path.
 */
public final class DiffEntry {
    private final String path;
    private final Object leftValue;
    private final Object rightValue;
    private final String note;

    public DiffEntry(String path, Object leftValue, Object rightValue, String note) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        this.path = path.trim();
        this.leftValue = leftValue;
        this.rightValue = rightValue;
        this.note = note == null ? "" : note.trim();
    }

    public String path() {
        return path;
    }

    public Object leftValue() {
        return leftValue;
    }

    public Object rightValue() {
        return rightValue;
    }

    public String note() {
        return note;
    }

    @Override
    public String toString() {
        return path + ": " + leftValue + " != " + rightValue + (note.isEmpty() ? "" : " (" + note + ")");
    }
}
