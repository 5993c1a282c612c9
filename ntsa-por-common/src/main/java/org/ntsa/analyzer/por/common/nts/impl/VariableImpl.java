package org.ntsa.analyzer.por.common.nts.impl;

import org.ntsa.analyzer.por.common.nts.Variable;

public class VariableImpl implements Variable {
    private final String name;
    private final boolean global;

    private VariableImpl(String name, boolean global) {
        this.name = name;
        this.global = global;
    }

    public static Variable global(String name) {
        return new VariableImpl(name, true);
    }

    public static Variable local(String name) {
        return new VariableImpl(name, false);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isGlobal() {
        return global;
    }

    @Override
    public String toString() {
        return name;
    }
}
