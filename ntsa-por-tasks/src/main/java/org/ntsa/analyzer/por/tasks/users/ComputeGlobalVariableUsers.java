package org.ntsa.analyzer.por.tasks.users;

import org.ntsa.analyzer.por.common.nts.Variable;
import org.ntsa.analyzer.por.effects.Globals;
import org.ntsa.analyzer.por.tasks.Task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class ComputeGlobalVariableUsers {

    /**
     * @param globalVariables the global variables of the program, in the order of the result
     * @param tasks           tasks with their direct globals computed; the order of the reader and writer sets
     * @return for each global variable, its readers and writers
     */
    public Map<Variable, GlobalVariableUsers> go(List<Variable> globalVariables, List<Task> tasks) {
        Map<Variable, GlobalVariableUsers> result = new LinkedHashMap<>();
        for (Variable variable : globalVariables) {
            Set<Task> readers = new LinkedHashSet<>();
            Set<Task> writers = new LinkedHashSet<>();
            for (Task task : tasks) {
                Globals direct = task.directGlobals();
                if (direct.reads().contains(variable)) readers.add(task);
                if (direct.writes().contains(variable)) writers.add(task);
            }
            result.put(variable, new GlobalVariableUsers(variable, Collections.unmodifiableSet(readers),
                    Collections.unmodifiableSet(writers)));
        }
        return Collections.unmodifiableMap(result);
    }
}
