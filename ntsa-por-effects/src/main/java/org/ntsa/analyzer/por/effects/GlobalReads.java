package org.ntsa.analyzer.por.effects;

import org.ntsa.analyzer.por.common.nts.Variable;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

/*
The global variables read by a piece of code. Always exact.
 */
public record GlobalReads(Set<Variable> variables) {
    public static final GlobalReads NONE = new GlobalReads(Set.of());

    public GlobalReads {
        variables = Set.copyOf(variables);
    }

    public static GlobalReads of(Variable... variables) {
        return new GlobalReads(Set.copyOf(Arrays.asList(variables)));
    }

    public boolean contains(Variable variable) {
        return variables.contains(variable);
    }

    public boolean isEmpty() {
        return variables.isEmpty();
    }

    public GlobalReads union(GlobalReads other) {
        if (other.variables.isEmpty() || variables.containsAll(other.variables)) return this;
        if (variables.isEmpty()) return other;
        Set<Variable> set = new HashSet<>(variables);
        set.addAll(other.variables);
        return new GlobalReads(set);
    }

    @Override
    public String toString() {
        return GlobalWrites.sorted(variables).map(Variable::name).collect(Collectors.joining(", ", "{", "}"));
    }
}
