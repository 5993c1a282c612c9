package org.ntsa.analyzer.por.common.nts;

import java.util.List;
import java.util.Set;

public interface TransitionRule {

    /**
     * @return the variables occurring unprimed in the rule, in order of first occurrence
     */
    Set<Variable> readVariables();

    /**
     * @return the primed and havoc'ed targets of the rule
     */
    List<WriteTarget> writeTargets();
}
