package org.exposql.expr;

/**
 * Fail-fast signal for plan shapes or functions that are deliberately not supported. The feature
 * key ({@code function.<name>}, {@code plan.<shape>}) lets callers tell which feature was requested.
 */
public final class UnsupportedFeatureException extends IllegalArgumentException {
    private final String featureKey;

    public UnsupportedFeatureException(final String featureKey, final String message) {
        super(message);
        if (featureKey == null || featureKey.isBlank()) {
            throw new IllegalArgumentException("featureKey must not be blank");
        }
        this.featureKey = featureKey.trim();
    }

    public static UnsupportedFeatureException function(final String name) {
        return new UnsupportedFeatureException("function." + name, "unsupported function: " + name);
    }

    public static UnsupportedFeatureException plan(final String shape, final String message) {
        return new UnsupportedFeatureException("plan." + shape, message);
    }

    public String featureKey() {
        return featureKey;
    }
}
