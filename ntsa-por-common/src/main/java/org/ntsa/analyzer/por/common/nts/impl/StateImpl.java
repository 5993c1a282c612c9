package org.ntsa.analyzer.por.common.nts.impl;

import org.ntsa.analyzer.por.common.nts.Annotation;
import org.ntsa.analyzer.por.common.nts.State;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class StateImpl implements State {
    private final String name;
    private final List<Annotation> annotations;
    private final boolean initial;
    private final boolean isFinal;
    private final boolean error;

    private StateImpl(String name, List<Annotation> annotations, boolean initial, boolean isFinal, boolean error) {
        this.name = name;
        this.annotations = annotations;
        this.initial = initial;
        this.isFinal = isFinal;
        this.error = error;
    }

    public static class Builder {
        private final String name;
        private final List<Annotation> annotations = new ArrayList<>();
        private boolean initial;
        private boolean isFinal;
        private boolean error;

        public Builder(String name) {
            this.name = Objects.requireNonNull(name);
        }

        public Builder addAnnotation(Annotation annotation) {
            annotations.add(Objects.requireNonNull(annotation));
            return this;
        }

        public Builder setInitial(boolean initial) {
            this.initial = initial;
            return this;
        }

        public Builder setFinal(boolean isFinal) {
            this.isFinal = isFinal;
            return this;
        }

        public Builder setError(boolean error) {
            this.error = error;
            return this;
        }

        public State build() {
            return new StateImpl(name, List.copyOf(annotations), initial, isFinal, error);
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<Annotation> annotations() {
        return annotations;
    }

    @Override
    public boolean isInitial() {
        return initial;
    }

    @Override
    public boolean isFinal() {
        return isFinal;
    }

    @Override
    public boolean isError() {
        return error;
    }

    @Override
    public String toString() {
        return name;
    }
}
