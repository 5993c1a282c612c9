package org.ntsa.analyzer.por.common.nts;

import java.util.List;

/**
 * A control state of an executable unit.
 * After flattening, each state carries an "origin" annotation that records where it was inlined from.
 */
public interface State {

    String name();

    List<Annotation> annotations();

    boolean isInitial();

    boolean isFinal();

    boolean isError();

    default Annotation annotationOrNull(String name, Annotation.Type type) {
        for (Annotation annotation : annotations()) {
            if (annotation.type() == type && annotation.name().equals(name)) return annotation;
        }
        return null;
    }
}
