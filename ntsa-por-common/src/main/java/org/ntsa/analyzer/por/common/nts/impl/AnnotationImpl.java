package org.ntsa.analyzer.por.common.nts.impl;

import org.ntsa.analyzer.por.common.nts.Annotation;

public record AnnotationImpl(String name, Type type, String value) implements Annotation {

    public static Annotation string(String name, String value) {
        return new AnnotationImpl(name, Type.STRING, value);
    }

    public static Annotation integer(String name, int value) {
        return new AnnotationImpl(name, Type.INTEGER, Integer.toString(value));
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
