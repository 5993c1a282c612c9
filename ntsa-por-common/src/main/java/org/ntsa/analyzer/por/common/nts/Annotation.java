package org.ntsa.analyzer.por.common.nts;

public interface Annotation {

    enum Type {
        STRING, INTEGER, BOOLEAN
    }

    String name();

    Type type();

    String value();
}
