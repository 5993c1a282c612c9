package org.ntsa.analyzer.por.tasks.transitive;

import org.ntsa.analyzer.por.effects.Globals;
import org.ntsa.analyzer.por.tasks.Task;

import java.util.List;
import java.util.Map;

/**
 * Given the direct globals of all tasks, compute their transitive globals.
 * <p>
 * This computation determines how effective the partial order reduction is: the smaller the transitive sets,
 * the more often a small ample set can be used. Implementations must never under-approximate: the result for a
 * task covers the direct globals of every task it may activate, itself included.
 */
@FunctionalInterface
public interface TransitiveGlobals {

    /**
     * @param tasks all tasks, with their direct globals computed
     * @return a value for each of the tasks
     */
    Map<Task, Globals> compute(List<Task> tasks);
}
