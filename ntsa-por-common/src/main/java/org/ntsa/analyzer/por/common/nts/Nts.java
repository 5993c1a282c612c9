package org.ntsa.analyzer.por.common.nts;

import java.util.List;

/**
 * The program: global variables, executable units, and the instantiation set
 * that says which units run as top-level threads.
 */
public interface Nts {

    String name();

    List<Variable> globalVariables();

    List<BasicNts> basicNtses();

    List<Instance> instances();
}
