package org.ntsa.analyzer.por.effects;

import org.ntsa.analyzer.por.common.nts.Nts;
import org.ntsa.analyzer.por.common.nts.Transition;
import org.ntsa.analyzer.por.common.nts.TransitionRule;
import org.ntsa.analyzer.por.common.nts.Variable;
import org.ntsa.analyzer.por.common.nts.WriteTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/*
Default effect computation, based on the read variables and write targets of the transition's rule.
Only the program's global variables are retained; one unresolved write target makes the writes universal.
 */
public class ComputeGlobalEffect implements GlobalEffectComputer {
    private static final Logger LOGGER = LoggerFactory.getLogger(ComputeGlobalEffect.class);

    private final Map<Nts, Set<Variable>> globalsOfNts = new IdentityHashMap<>();

    @Override
    public Globals compute(Nts nts, Transition transition) {
        Set<Variable> globals = globalsOfNts.computeIfAbsent(nts, ComputeGlobalEffect::globalSet);
        TransitionRule rule = transition.rule();

        Set<Variable> reads = new HashSet<>();
        for (Variable v : rule.readVariables()) {
            if (globals.contains(v)) reads.add(v);
        }

        boolean universal = false;
        Set<Variable> writes = new HashSet<>();
        for (WriteTarget target : rule.writeTargets()) {
            if (target instanceof WriteTarget.Unresolved unresolved) {
                LOGGER.debug("Unresolved write target {} in {}", unresolved.description(), transition);
                universal = true;
            } else if (target instanceof WriteTarget.Direct direct) {
                if (globals.contains(direct.variable())) writes.add(direct.variable());
            } else {
                throw new UnsupportedOperationException("Write target " + target.getClass());
            }
        }
        GlobalWrites globalWrites = universal ? GlobalWrites.UNIVERSAL : new GlobalWrites.Exact(writes);
        return new Globals(new GlobalReads(reads), globalWrites);
    }

    private static Set<Variable> globalSet(Nts nts) {
        Set<Variable> set = Collections.newSetFromMap(new IdentityHashMap<>());
        set.addAll(nts.globalVariables());
        return set;
    }
}
