package org.ntsa.analyzer.por.tasks;

import org.ntsa.analyzer.por.common.nts.State;

/*
The task a state belongs to. The task is only null while the states are being split.
 */
public class StateInfo {
    private final State state;
    private Task task;

    StateInfo(State state) {
        this.state = state;
    }

    public State state() {
        return state;
    }

    public Task task() {
        return task;
    }

    void setTask(Task task) {
        assert this.task == null : "State " + state.name() + " already belongs to " + this.task.name();
        this.task = task;
    }

    @Override
    public String toString() {
        return state.name() + "@" + (task == null ? "?" : task.name());
    }
}
