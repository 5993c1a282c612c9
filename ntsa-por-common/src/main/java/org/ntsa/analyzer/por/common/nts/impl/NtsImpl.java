package org.ntsa.analyzer.por.common.nts.impl;

import org.ntsa.analyzer.por.common.nts.BasicNts;
import org.ntsa.analyzer.por.common.nts.Instance;
import org.ntsa.analyzer.por.common.nts.Nts;
import org.ntsa.analyzer.por.common.nts.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class NtsImpl implements Nts {
    private final String name;
    private final List<Variable> globalVariables;
    private final List<BasicNts> basicNtses;
    private final List<Instance> instances;

    private NtsImpl(String name, List<Variable> globalVariables, List<BasicNts> basicNtses, List<Instance> instances) {
        this.name = name;
        this.globalVariables = globalVariables;
        this.basicNtses = basicNtses;
        this.instances = instances;
    }

    public static class Builder {
        private final String name;
        private final List<Variable> globalVariables = new ArrayList<>();
        private final List<BasicNts> basicNtses = new ArrayList<>();
        private final List<Instance> instances = new ArrayList<>();

        public Builder(String name) {
            this.name = Objects.requireNonNull(name);
        }

        public Builder addGlobalVariable(Variable variable) {
            if (!variable.isGlobal()) {
                throw new IllegalArgumentException("Variable " + variable.name() + " is not global");
            }
            globalVariables.add(variable);
            return this;
        }

        public Builder addGlobalVariables(Variable... variables) {
            for (Variable v : variables) addGlobalVariable(v);
            return this;
        }

        public Builder addBasicNts(BasicNts basicNts) {
            basicNtses.add(basicNts);
            return this;
        }

        // also registers the unit, when not yet present
        public Builder addInstance(BasicNts basicNts, int count) {
            if (basicNtses.stream().noneMatch(bn -> bn == basicNts)) {
                basicNtses.add(basicNts);
            }
            instances.add(new InstanceImpl(basicNts, count));
            return this;
        }

        public Nts build() {
            return new NtsImpl(name, List.copyOf(globalVariables), List.copyOf(basicNtses), List.copyOf(instances));
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<Variable> globalVariables() {
        return globalVariables;
    }

    @Override
    public List<BasicNts> basicNtses() {
        return basicNtses;
    }

    @Override
    public List<Instance> instances() {
        return instances;
    }

    @Override
    public String toString() {
        return name;
    }
}
