package org.ntsa.analyzer.por.tasks;

import org.ntsa.analyzer.por.common.AnalyzerException;

import java.util.Objects;

public class TaskAnalysisException extends AnalyzerException {
    private final FailureKind kind;

    public TaskAnalysisException(FailureKind kind, Object element, String message) {
        super(element, message);
        this.kind = Objects.requireNonNull(kind);
    }

    public FailureKind getKind() {
        return kind;
    }
}
