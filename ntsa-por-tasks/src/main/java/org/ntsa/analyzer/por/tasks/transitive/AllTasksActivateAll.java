package org.ntsa.analyzer.por.tasks.transitive;

import org.ntsa.analyzer.por.effects.Globals;
import org.ntsa.analyzer.por.tasks.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/*
No activation graph: every task may activate every task, including itself.
All tasks get the union of all direct globals.

TODO derive which task's transitions may create or signal which other task, and take the closure over that graph.
 */
public class AllTasksActivateAll implements TransitiveGlobals {
    private static final Logger LOGGER = LoggerFactory.getLogger(AllTasksActivateAll.class);

    @Override
    public Map<Task, Globals> compute(List<Task> tasks) {
        Globals all = tasks.stream().map(Task::directGlobals).reduce(Globals.EMPTY, Globals::union);
        LOGGER.debug("Union of direct globals of {} tasks: {}", tasks.size(), all);
        Map<Task, Globals> result = new LinkedHashMap<>();
        for (Task task : tasks) {
            result.put(task, all);
        }
        return result;
    }
}
