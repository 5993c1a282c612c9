package org.ntsa.analyzer.por.tasks;

import org.ntsa.analyzer.por.common.nts.BasicNts;
import org.ntsa.analyzer.por.common.nts.Nts;
import org.ntsa.analyzer.por.common.nts.Transition;
import org.ntsa.analyzer.por.effects.GlobalEffectComputer;
import org.ntsa.analyzer.por.effects.Globals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

class ComputeTransitionInfo {
    private static final Logger LOGGER = LoggerFactory.getLogger(ComputeTransitionInfo.class);

    private final Nts nts;
    private final NodeRecords records;
    private final GlobalEffectComputer globalEffectComputer;

    ComputeTransitionInfo(Nts nts, NodeRecords records, GlobalEffectComputer globalEffectComputer) {
        this.nts = nts;
        this.records = records;
        this.globalEffectComputer = globalEffectComputer;
    }

    void go(List<BasicNts> toplevel) {
        for (BasicNts bn : toplevel) {
            for (Transition transition : bn.transitions()) {
                Globals globals = globalEffectComputer.compute(nts, transition);
                TransitionInfo ti = records.createTransitionInfo(transition, globals);
                LOGGER.debug("{}: {}", bn.name(), ti);
            }
        }
    }
}
