package org.exposql.compiler;

/**
 * Stage and column names shared by both plan shapes and by the result assembler.
 */
public final class PlanColumns {
    public static final String EXPOSURES = "exposures";
    public static final String METRIC_EVENTS = "metric_events";
    public static final String NUMERATOR_EVENTS = "numerator_events";
    public static final String DENOMINATOR_EVENTS = "denominator_events";
    public static final String NUMERATOR_AGGREGATED = "numerator_aggregated";
    public static final String DENOMINATOR_AGGREGATED = "denominator_aggregated";
    public static final String ENTITY_SCAN = "entity_scan";
    public static final String ENTITY_METRICS = "entity_metrics";
    public static final String PERCENTILES = "percentiles";
    public static final String WINSORIZED_ENTITY_METRICS = "winsorized_entity_metrics";
    public static final String EVENTS_TABLE = "events";

    public static final String ENTITY_ID = "entity_id";
    public static final String VARIANT = "variant";
    public static final String TIMESTAMP = "timestamp";
    public static final String VALUE = "value";
    public static final String STEP_LEVEL = "step_level";
    public static final String FIRST_EXPOSURE_TIME = "first_exposure_time";
    public static final String EXPOSURE_EVENT_UUID = "exposure_event_uuid";
    public static final String EXPOSURE_SESSION_ID = "exposure_session_id";
    public static final String EXPOSURE_IDENTIFIER = "exposure_identifier";
    public static final String EXPOSURE_IDENTIFIER_NUM = "exposure_identifier_num";
    public static final String EXPOSURE_IDENTIFIER_DENOM = "exposure_identifier_denom";
    public static final String METRIC_VALUES = "metric_values";
    public static final String NUMERATOR_VALUES = "numerator_values";
    public static final String DENOMINATOR_VALUES = "denominator_values";
    public static final String NUMERATOR_VALUE = "numerator_value";
    public static final String DENOMINATOR_VALUE = "denominator_value";
    public static final String LOWER_BOUND = "lower_bound";
    public static final String UPPER_BOUND = "upper_bound";

    public static final String NUM_USERS = "num_users";
    public static final String TOTAL_SUM = "total_sum";
    public static final String TOTAL_SUM_OF_SQUARES = "total_sum_of_squares";
    public static final String SUCCESS_COUNT = "success_count";
    public static final String FAILURE_COUNT = "failure_count";
    public static final String STEP_COUNTS = "step_counts";
    public static final String DENOMINATOR_SUM = "denominator_sum";
    public static final String DENOMINATOR_SUM_SQUARES = "denominator_sum_squares";
    public static final String NUMERATOR_DENOMINATOR_SUM_PRODUCT = "numerator_denominator_sum_product";

    private PlanColumns() {}
}
