package org.exposql.testkit;

public enum DiffStatus {
    MATCH,
    MISMATCH,
    ERROR
}
