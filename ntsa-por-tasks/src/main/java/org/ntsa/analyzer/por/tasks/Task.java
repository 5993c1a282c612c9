package org.ntsa.analyzer.por.tasks;

import org.ntsa.analyzer.por.effects.Globals;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A task is the basic organisation unit of partial order reduction: the states and transitions of one
 * thread body. During execution, instances of a task are assigned to threads.
 * <p>
 * A task uses a subset of the global variables, and it may cause other tasks to be run. Both are computed
 * before the reduction starts:
 * <ul>
 *     <li>the direct globals are read or possibly written by the task's own transitions;</li>
 *     <li>the transitive globals are used by the task, or by any task it may activate, directly or
 *     indirectly. If a variable is not in this set, running the task and the tasks it activates does not use
 *     that variable.</li>
 * </ul>
 * Every state whose record points to this task is present exactly once in {@link #states()}.
 */
public class Task {
    private final String name;
    private final List<StateInfo> states = new ArrayList<>();
    private final List<StateInfo> initialStates = new ArrayList<>();
    private final List<StateInfo> finalStates = new ArrayList<>();
    private Globals directGlobals;
    private Globals transitiveGlobals;
    private Integer number;

    Task(String name) {
        this.name = Objects.requireNonNull(name);
    }

    public String name() {
        return name;
    }

    public List<StateInfo> states() {
        return Collections.unmodifiableList(states);
    }

    void addState(StateInfo stateInfo) {
        stateInfo.setTask(this);
        states.add(stateInfo);
    }

    public List<StateInfo> initialStates() {
        return Collections.unmodifiableList(initialStates);
    }

    public List<StateInfo> finalStates() {
        return Collections.unmodifiableList(finalStates);
    }

    void addInitialState(StateInfo stateInfo) {
        initialStates.add(stateInfo);
    }

    void addFinalState(StateInfo stateInfo) {
        finalStates.add(stateInfo);
    }

    public boolean hasNumber() {
        return number != null;
    }

    public int number() {
        if (number == null) throw new IllegalStateException("Task " + name + " has no number");
        return number;
    }

    void setNumber(int number) {
        assert this.number == null;
        this.number = number;
    }

    public Globals directGlobals() {
        if (directGlobals == null) throw new IllegalStateException("Direct globals of " + name + " not computed");
        return directGlobals;
    }

    void setDirectGlobals(Globals directGlobals) {
        assert this.directGlobals == null;
        this.directGlobals = Objects.requireNonNull(directGlobals);
    }

    public Globals transitiveGlobals() {
        if (transitiveGlobals == null) {
            throw new IllegalStateException("Transitive globals of " + name + " not computed");
        }
        return transitiveGlobals;
    }

    void setTransitiveGlobals(Globals transitiveGlobals) {
        assert this.transitiveGlobals == null;
        this.transitiveGlobals = Objects.requireNonNull(transitiveGlobals);
    }

    /**
     * @return true when the transitive effects of both tasks may interfere
     */
    public boolean mayCollideWith(Task other) {
        return transitiveGlobals().mayCollideWith(other.transitiveGlobals());
    }

    @Override
    public String toString() {
        return number == null ? name : name + "#" + number;
    }
}
