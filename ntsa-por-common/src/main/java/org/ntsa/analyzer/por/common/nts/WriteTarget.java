package org.ntsa.analyzer.por.common.nts;

/*
What an assignment in a transition rule writes to.
A Direct target is a named variable; an Unresolved target is a write through an address
that cannot be mapped to a variable statically.
 */
public interface WriteTarget {

    record Direct(Variable variable) implements WriteTarget {
        @Override
        public String toString() {
            return variable.name() + "'";
        }
    }

    record Unresolved(String description) implements WriteTarget {
        @Override
        public String toString() {
            return "*(" + description + ")'";
        }
    }
}
