package org.ntsa.analyzer.por.common.nts.impl;

import org.ntsa.analyzer.por.common.nts.State;
import org.ntsa.analyzer.por.common.nts.Transition;
import org.ntsa.analyzer.por.common.nts.TransitionRule;

import java.util.Objects;

public class TransitionImpl implements Transition {
    private final State from;
    private final State to;
    private final TransitionRule rule;

    public TransitionImpl(State from, State to, TransitionRule rule) {
        this.from = Objects.requireNonNull(from);
        this.to = Objects.requireNonNull(to);
        this.rule = Objects.requireNonNull(rule);
    }

    @Override
    public State from() {
        return from;
    }

    @Override
    public State to() {
        return to;
    }

    @Override
    public TransitionRule rule() {
        return rule;
    }

    @Override
    public String toString() {
        return from.name() + " -> " + to.name() + " " + rule;
    }
}
