package org.ntsa.analyzer.por.effects;

import org.ntsa.analyzer.por.common.nts.Variable;

import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The global variables that a piece of code may write.
 * <p>
 * Either an exact set of variables, or "universal": any global variable may be written, because at least one
 * write goes through a target that could not be resolved. There is no way to combine the two.
 */
public interface GlobalWrites {
    GlobalWrites NONE = new Exact(Set.of());
    GlobalWrites UNIVERSAL = new Universal();

    static GlobalWrites of(Variable... variables) {
        return new Exact(Set.copyOf(Arrays.asList(variables)));
    }

    boolean contains(Variable variable);

    boolean isUniversal();

    boolean isEmpty();

    /**
     * @return the variables written; empty for the universal write, which does not enumerate them
     */
    Set<Variable> variables();

    GlobalWrites union(GlobalWrites other);

    boolean intersects(GlobalReads reads);

    boolean intersects(GlobalWrites writes);

    record Exact(Set<Variable> variables) implements GlobalWrites {

        public Exact {
            variables = Set.copyOf(variables);
        }

        @Override
        public boolean contains(Variable variable) {
            return variables.contains(variable);
        }

        @Override
        public boolean isUniversal() {
            return false;
        }

        @Override
        public boolean isEmpty() {
            return variables.isEmpty();
        }

        @Override
        public GlobalWrites union(GlobalWrites other) {
            if (other instanceof Exact exact) {
                if (exact.variables.isEmpty() || variables.containsAll(exact.variables)) return this;
                if (variables.isEmpty()) return exact;
                Set<Variable> set = new HashSet<>(variables);
                set.addAll(exact.variables);
                return new Exact(set);
            }
            return other;
        }

        @Override
        public boolean intersects(GlobalReads reads) {
            return intersect(variables, reads.variables());
        }

        @Override
        public boolean intersects(GlobalWrites writes) {
            if (writes.isUniversal()) return !variables.isEmpty();
            return intersect(variables, writes.variables());
        }

        @Override
        public String toString() {
            return sorted(variables).map(Variable::name).collect(Collectors.joining(", ", "{", "}"));
        }
    }

    record Universal() implements GlobalWrites {

        @Override
        public boolean contains(Variable variable) {
            return true;
        }

        @Override
        public boolean isUniversal() {
            return true;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public Set<Variable> variables() {
            return Set.of();
        }

        @Override
        public GlobalWrites union(GlobalWrites other) {
            return this;
        }

        @Override
        public boolean intersects(GlobalReads reads) {
            return !reads.isEmpty();
        }

        @Override
        public boolean intersects(GlobalWrites writes) {
            return !writes.isEmpty();
        }

        @Override
        public String toString() {
            return "*";
        }
    }

    private static boolean intersect(Set<Variable> s1, Set<Variable> s2) {
        Set<Variable> small = s1.size() <= s2.size() ? s1 : s2;
        Set<Variable> large = small == s1 ? s2 : s1;
        for (Variable v : small) {
            if (large.contains(v)) return true;
        }
        return false;
    }

    static Stream<Variable> sorted(Collection<Variable> variables) {
        return variables.stream().sorted(Comparator.comparing(Variable::name));
    }
}
