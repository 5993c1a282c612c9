package org.ntsa.analyzer.por.tasks;

import org.ntsa.analyzer.por.common.nts.BasicNts;
import org.ntsa.analyzer.por.common.nts.Transition;
import org.ntsa.analyzer.por.effects.Globals;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/*
The direct globals of a task are the union of the globals of the transitions leaving its states.
Requires the transition records, and the owner of every state.
 */
class ComputeDirectGlobals {
    private final NodeRecords records;

    ComputeDirectGlobals(NodeRecords records) {
        this.records = records;
    }

    void go(List<BasicNts> toplevel, List<Task> allTasks) {
        Map<Task, Globals> union = new HashMap<>();
        for (BasicNts bn : toplevel) {
            for (Transition transition : bn.transitions()) {
                Task task = records.stateInfo(transition.from()).task();
                Globals globals = records.transitionInfo(transition).globals();
                union.merge(task, globals, Globals::union);
            }
        }
        for (Task task : allTasks) {
            task.setDirectGlobals(union.getOrDefault(task, Globals.EMPTY));
        }
    }
}
