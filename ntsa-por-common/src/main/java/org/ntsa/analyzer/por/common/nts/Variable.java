package org.ntsa.analyzer.por.common.nts;

/*
Identity-bearing: two variables with the same name in different scopes are different variables.
 */
public interface Variable {

    String name();

    boolean isGlobal();
}
