package org.exposql.model;

public enum SourceKind {
    EVENT,
    ACTION,
    WAREHOUSE
}
