package org.ntsa.analyzer.por.tasks;

public enum FailureKind {
    // a state or transition already has its analysis record
    DUPLICATE_RECORD,
    // a state that must be split by origin has no origin annotation
    MISSING_ORIGIN_METADATA
}
