package org.exposql.runner;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.exposql.compiler.PlanColumns;
import org.exposql.engine.ResultRow;
import org.exposql.model.MetricKind;
import org.exposql.model.VariantSet;

/**
 * Turns final-stage rows into variant results in canonical variant order.
 *
 * <p>Rows labelled {@link VariantSet#MULTIPLE_VARIANT_KEY}, or with a variant the experiment does
 * not declare, are dropped.
 */
public final class ExperimentResultAssembler {
    private ExperimentResultAssembler() {}

    public static List<VariantResult> assemble(
            final List<ResultRow> rows, final MetricKind kind, final VariantSet variants) {
        Objects.requireNonNull(rows, "rows");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(variants, "variants");
        final List<VariantResult> results = new ArrayList<>();
        for (final ResultRow row : rows) {
            final String variant = row.getString(PlanColumns.VARIANT);
            if (variant == null || !variants.contains(variant)) {
                continue;
            }
            results.add(switch (kind) {
                case MEAN -> meanResult(variant, row);
                case FUNNEL -> funnelResult(variant, row);
                case RATIO -> ratioResult(variant, row);
            });
        }
        results.sort(Comparator.comparingInt(result -> variants.indexOf(result.key())));
        return List.copyOf(results);
    }

    /**
     * Throws {@link ExperimentNoResultsException} unless there are exposures, a control row and at
     * least one test variant row.
     */
    public static void validate(final List<VariantResult> results, final VariantSet variants) {
        final List<String> present = new ArrayList<>();
        for (final VariantResult result : results) {
            present.add(result.key());
        }
        final Map<NoResultsErrorKey, Boolean> errors = new EnumMap<>(NoResultsErrorKey.class);
        errors.put(NoResultsErrorKey.NO_EXPOSURES, present.isEmpty());
        errors.put(NoResultsErrorKey.NO_CONTROL_VARIANT, !present.contains(variants.controlKey()));
        boolean anyTest = variants.testKeys().isEmpty();
        for (final String key : variants.testKeys()) {
            anyTest |= present.contains(key);
        }
        errors.put(NoResultsErrorKey.NO_TEST_VARIANT, !anyTest);
        if (errors.containsValue(Boolean.TRUE)) {
            throw new ExperimentNoResultsException(errors);
        }
    }

    private static MeanVariantResult meanResult(final String variant, final ResultRow row) {
        return MeanVariantResult.of(
                variant,
                row.getLong(PlanColumns.NUM_USERS),
                row.getDouble(PlanColumns.TOTAL_SUM),
                row.getDouble(PlanColumns.TOTAL_SUM_OF_SQUARES));
    }

    private static RatioVariantResult ratioResult(final String variant, final ResultRow row) {
        return new RatioVariantResult(
                variant,
                row.getLong(PlanColumns.NUM_USERS),
                row.getDouble(PlanColumns.TOTAL_SUM),
                row.getDouble(PlanColumns.TOTAL_SUM_OF_SQUARES),
                row.getDouble(PlanColumns.DENOMINATOR_SUM),
                row.getDouble(PlanColumns.DENOMINATOR_SUM_SQUARES),
                row.getDouble(PlanColumns.NUMERATOR_DENOMINATOR_SUM_PRODUCT));
    }

    private static FunnelVariantResult funnelResult(final String variant, final ResultRow row) {
        final List<Long> stepCounts = new ArrayList<>();
        if (row.columns().contains(PlanColumns.STEP_COUNTS)) {
            for (final Object count : row.getList(PlanColumns.STEP_COUNTS)) {
                stepCounts.add(count == null ? 0L : ((Number) count).longValue());
            }
        }
        return new FunnelVariantResult(
                variant,
                row.getLong(PlanColumns.SUCCESS_COUNT),
                row.getLong(PlanColumns.FAILURE_COUNT),
                stepCounts);
    }
}
