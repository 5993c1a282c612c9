package org.ntsa.analyzer.por.tasks;

import org.ntsa.analyzer.por.common.nts.BasicNts;
import org.ntsa.analyzer.por.common.nts.State;
import org.ntsa.analyzer.por.common.nts.Transition;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/*
A state is initial for its task when its unit marks it initial, or when a transition enters it from
another task. It is final when its unit marks it final, or when a transition leaves it for another task.
 */
class ComputeBoundaryStates {
    private final NodeRecords records;

    ComputeBoundaryStates(NodeRecords records) {
        this.records = records;
    }

    void go(List<BasicNts> toplevel) {
        for (BasicNts bn : toplevel) {
            Set<State> entered = Collections.newSetFromMap(new IdentityHashMap<>());
            Set<State> left = Collections.newSetFromMap(new IdentityHashMap<>());
            for (Transition transition : bn.transitions()) {
                Task fromTask = records.stateInfo(transition.from()).task();
                Task toTask = records.stateInfo(transition.to()).task();
                if (fromTask != toTask) {
                    left.add(transition.from());
                    entered.add(transition.to());
                }
            }
            for (State state : bn.states()) {
                StateInfo stateInfo = records.stateInfo(state);
                if (state.isInitial() || entered.contains(state)) {
                    stateInfo.task().addInitialState(stateInfo);
                }
                if (state.isFinal() || left.contains(state)) {
                    stateInfo.task().addFinalState(stateInfo);
                }
            }
        }
    }
}
