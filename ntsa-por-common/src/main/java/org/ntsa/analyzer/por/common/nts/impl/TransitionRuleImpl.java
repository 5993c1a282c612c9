package org.ntsa.analyzer.por.common.nts.impl;

import org.ntsa.analyzer.por.common.nts.TransitionRule;
import org.ntsa.analyzer.por.common.nts.Variable;
import org.ntsa.analyzer.por.common.nts.WriteTarget;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class TransitionRuleImpl implements TransitionRule {
    public static final TransitionRule SKIP = new TransitionRuleImpl(Set.of(), List.of());

    private final Set<Variable> readVariables;
    private final List<WriteTarget> writeTargets;

    private TransitionRuleImpl(Set<Variable> readVariables, List<WriteTarget> writeTargets) {
        this.readVariables = readVariables;
        this.writeTargets = writeTargets;
    }

    public static class Builder {
        private final Set<Variable> reads = new LinkedHashSet<>();
        private final List<WriteTarget> writes = new ArrayList<>();

        public Builder addRead(Variable variable) {
            reads.add(variable);
            return this;
        }

        public Builder addWrite(Variable variable) {
            writes.add(new WriteTarget.Direct(variable));
            return this;
        }

        // havoc(x) leaves x unconstrained: for the effect of a rule, that is a write to x
        public Builder addHavoc(Variable... variables) {
            for (Variable v : variables) {
                writes.add(new WriteTarget.Direct(v));
            }
            return this;
        }

        public Builder addUnresolvedWrite(String description) {
            writes.add(new WriteTarget.Unresolved(description));
            return this;
        }

        public TransitionRule build() {
            return new TransitionRuleImpl(Collections.unmodifiableSet(new LinkedHashSet<>(reads)), List.copyOf(writes));
        }
    }

    @Override
    public Set<Variable> readVariables() {
        return readVariables;
    }

    @Override
    public List<WriteTarget> writeTargets() {
        return writeTargets;
    }

    @Override
    public String toString() {
        return Stream.concat(readVariables.stream().map(Variable::name), writeTargets.stream().map(Object::toString))
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
