package org.ntsa.analyzer.por.tasks;

import org.ntsa.analyzer.por.common.nts.State;
import org.ntsa.analyzer.por.common.nts.Transition;
import org.ntsa.analyzer.por.effects.Globals;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Side table holding the analysis records of states and transitions, keyed by node identity.
 * <p>
 * Each node gets at most one record. A table can be handed to {@link ComputeTasks} through its options;
 * running the computation twice with the same table fails on the first node that is processed again.
 * A computation that fails leaves the table unchanged.
 */
public class NodeRecords {
    private final Map<State, StateInfo> stateInfos = new IdentityHashMap<>();
    private final Map<Transition, TransitionInfo> transitionInfos = new IdentityHashMap<>();
    private final NodeRecords committed;

    public NodeRecords() {
        this(null);
    }

    /*
    a working table: records are only visible in 'committed' after commit(), but the nodes already
    recorded there count as duplicates here
     */
    NodeRecords(NodeRecords committed) {
        this.committed = committed;
    }

    NodeRecords commit() {
        if (committed == null) return this;
        committed.stateInfos.putAll(stateInfos);
        committed.transitionInfos.putAll(transitionInfos);
        return committed;
    }

    StateInfo createStateInfo(State state) {
        if (stateInfos.containsKey(state) || committed != null && committed.stateInfos.containsKey(state)) {
            throw new TaskAnalysisException(FailureKind.DUPLICATE_RECORD, state,
                    "State " + state.name() + " already has an analysis record");
        }
        StateInfo stateInfo = new StateInfo(state);
        stateInfos.put(state, stateInfo);
        return stateInfo;
    }

    TransitionInfo createTransitionInfo(Transition transition, Globals globals) {
        if (transitionInfos.containsKey(transition)
            || committed != null && committed.transitionInfos.containsKey(transition)) {
            throw new TaskAnalysisException(FailureKind.DUPLICATE_RECORD, transition,
                    "Transition " + transition + " already has an analysis record");
        }
        TransitionInfo transitionInfo = new TransitionInfo(transition, globals);
        transitionInfos.put(transition, transitionInfo);
        return transitionInfo;
    }

    public StateInfo stateInfoOrNull(State state) {
        return stateInfos.get(state);
    }

    public StateInfo stateInfo(State state) {
        StateInfo stateInfo = stateInfos.get(state);
        if (stateInfo == null) throw new IllegalStateException("No record for state " + state.name());
        return stateInfo;
    }

    public TransitionInfo transitionInfoOrNull(Transition transition) {
        return transitionInfos.get(transition);
    }

    public TransitionInfo transitionInfo(Transition transition) {
        TransitionInfo transitionInfo = transitionInfos.get(transition);
        if (transitionInfo == null) throw new IllegalStateException("No record for transition " + transition);
        return transitionInfo;
    }

    public int stateCount() {
        return stateInfos.size();
    }

    public int transitionCount() {
        return transitionInfos.size();
    }
}
