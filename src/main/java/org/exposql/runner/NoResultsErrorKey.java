package org.exposql.runner;

/**
 * Reasons an experiment has no usable results yet. Each is reported as a boolean.
 */
public enum NoResultsErrorKey {
    NO_EXPOSURES("no-exposures"),
    NO_CONTROL_VARIANT("no-control-variant"),
    NO_TEST_VARIANT("no-test-variant");

    private final String jsonKey;

    NoResultsErrorKey(final String jsonKey) {
        this.jsonKey = jsonKey;
    }

    public String jsonKey() {
        return jsonKey;
    }
}
