package org.ntsa.analyzer.por.effects;

import org.ntsa.analyzer.por.common.nts.Nts;
import org.ntsa.analyzer.por.common.nts.Transition;

/*
Computes the effect of a single transition on the global variables of the program.
 */
@FunctionalInterface
public interface GlobalEffectComputer {

    Globals compute(Nts nts, Transition transition);
}
