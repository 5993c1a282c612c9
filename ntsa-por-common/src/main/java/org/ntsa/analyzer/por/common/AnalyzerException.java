package org.ntsa.analyzer.por.common;

/*
Raised when an analysis step finds its input in a state that an earlier stage should have prevented.
The element is whatever node the step was working on; it is kept for reporting only.
 */
public class AnalyzerException extends RuntimeException {
    private final Object element;

    public AnalyzerException(Object element, String message) {
        super(message);
        this.element = element;
    }

    public Object getElement() {
        return element;
    }
}
