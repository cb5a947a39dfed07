package org.exposql.model;

public enum MetricKind {
    MEAN,
    FUNNEL,
    RATIO
}
