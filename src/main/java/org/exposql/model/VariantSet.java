package org.exposql.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered variant keys of an experiment. The first key is the control variant.
 */
public record VariantSet(List<String> keys) {
    /** Label of entities exposed to more than one variant under {@link MultipleVariantHandling#EXCLUDE}. */
    public static final String MULTIPLE_VARIANT_KEY = "$multiple";
    public static final String CONTROL_VARIANT_KEY = "control";
    private static final String HOLDOUT_PREFIX = "holdout-";

    public VariantSet {
        final Set<String> unique = new LinkedHashSet<>();
        for (final String key : ModelDocuments.copyList(keys, "keys")) {
            final String normalized = ModelDocuments.requireText(key, "variant key");
            if (MULTIPLE_VARIANT_KEY.equals(normalized)) {
                throw new IllegalArgumentException(MULTIPLE_VARIANT_KEY + " is a reserved variant key");
            }
            if (!unique.add(normalized)) {
                throw new IllegalArgumentException("duplicate variant key: " + normalized);
            }
        }
        if (unique.isEmpty()) {
            throw new IllegalArgumentException("an experiment needs at least one variant");
        }
        keys = List.copyOf(unique);
    }

    public static VariantSet of(final String... keys) {
        return new VariantSet(List.of(keys));
    }

    /**
     * Configured keys followed by the synthesized {@code holdout-<id>} key when a holdout exists.
     */
    public static VariantSet of(final List<String> configuredKeys, final Long holdoutId) {
        final List<String> all = new ArrayList<>(configuredKeys);
        if (holdoutId != null) {
            all.add(holdoutKey(holdoutId));
        }
        return new VariantSet(all);
    }

    public static String holdoutKey(final long holdoutId) {
        return HOLDOUT_PREFIX + holdoutId;
    }

    public boolean contains(final String key) {
        return keys.contains(key);
    }

    public int indexOf(final String key) {
        return keys.indexOf(key);
    }

    public String controlKey() {
        return keys.contains(CONTROL_VARIANT_KEY) ? CONTROL_VARIANT_KEY : keys.get(0);
    }

    public List<String> testKeys() {
        final String control = controlKey();
        final List<String> tests = new ArrayList<>();
        for (final String key : keys) {
            if (!key.equals(control) && !key.startsWith(HOLDOUT_PREFIX)) {
                tests.add(key);
            }
        }
        return List.copyOf(tests);
    }
}
