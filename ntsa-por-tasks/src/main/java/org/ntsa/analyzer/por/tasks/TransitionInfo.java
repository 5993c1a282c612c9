package org.ntsa.analyzer.por.tasks;

import org.ntsa.analyzer.por.common.nts.Transition;
import org.ntsa.analyzer.por.effects.Globals;

/*
A transition belongs to the task of its 'from' state.
 */
public record TransitionInfo(Transition transition, Globals globals) {

    @Override
    public String toString() {
        return transition.from().name() + " -> " + transition.to().name() + ": " + globals;
    }
}
