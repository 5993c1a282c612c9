package org.ntsa.analyzer.por.common.nts;

import java.util.List;

/**
 * An executable unit: a control flow automaton over states and transitions.
 * Flattened units contain no calls.
 */
public interface BasicNts {

    String name();

    List<State> states();

    List<Transition> transitions();

    List<Variable> localVariables();
}
