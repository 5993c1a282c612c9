package org.ntsa.analyzer.por.common.nts.impl;

import org.ntsa.analyzer.por.common.nts.BasicNts;
import org.ntsa.analyzer.por.common.nts.State;
import org.ntsa.analyzer.por.common.nts.Transition;
import org.ntsa.analyzer.por.common.nts.TransitionRule;
import org.ntsa.analyzer.por.common.nts.Variable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public class BasicNtsImpl implements BasicNts {
    private final String name;
    private final List<State> states;
    private final List<Transition> transitions;
    private final List<Variable> localVariables;

    private BasicNtsImpl(String name, List<State> states, List<Transition> transitions, List<Variable> localVariables) {
        this.name = name;
        this.states = states;
        this.transitions = transitions;
        this.localVariables = localVariables;
    }

    public static class Builder {
        private final String name;
        private final List<State> states = new ArrayList<>();
        private final Set<State> stateSet = Collections.newSetFromMap(new IdentityHashMap<>());
        private final List<Transition> transitions = new ArrayList<>();
        private final List<Variable> localVariables = new ArrayList<>();

        public Builder(String name) {
            this.name = Objects.requireNonNull(name);
        }

        public Builder addState(State state) {
            if (!stateSet.add(state)) {
                throw new IllegalArgumentException("State " + state.name() + " already in " + name);
            }
            states.add(state);
            return this;
        }

        public Builder addStates(State... states) {
            for (State state : states) addState(state);
            return this;
        }

        public Builder addTransition(State from, State to, TransitionRule rule) {
            return addTransition(new TransitionImpl(from, to, rule));
        }

        public Builder addTransition(Transition transition) {
            if (!stateSet.contains(transition.from()) || !stateSet.contains(transition.to())) {
                throw new IllegalArgumentException("Transition " + transition + " connects states outside of " + name);
            }
            transitions.add(transition);
            return this;
        }

        public Builder addLocalVariable(Variable variable) {
            if (variable.isGlobal()) {
                throw new IllegalArgumentException("Variable " + variable.name() + " is global");
            }
            localVariables.add(variable);
            return this;
        }

        public BasicNts build() {
            return new BasicNtsImpl(name, List.copyOf(states), List.copyOf(transitions), List.copyOf(localVariables));
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<State> states() {
        return states;
    }

    @Override
    public List<Transition> transitions() {
        return transitions;
    }

    @Override
    public List<Variable> localVariables() {
        return localVariables;
    }

    @Override
    public String toString() {
        return name;
    }
}
