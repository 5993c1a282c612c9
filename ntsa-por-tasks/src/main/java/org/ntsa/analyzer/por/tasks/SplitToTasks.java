package org.ntsa.analyzer.por.tasks;

import org.ntsa.analyzer.por.common.nts.BasicNts;
import org.ntsa.analyzer.por.common.nts.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/*
Assigns every state of the top-level units to a task.
Tasks are created when their name is first seen, and are kept in that order.
 */
class SplitToTasks {
    private static final Logger LOGGER = LoggerFactory.getLogger(SplitToTasks.class);

    private final NodeRecords records;
    private final Task idleTask;
    private final String mainNtsName;
    private final List<Task> tasks = new ArrayList<>();
    private final Map<String, Task> nameToTask = new LinkedHashMap<>();

    SplitToTasks(NodeRecords records, Task idleTask, String mainNtsName) {
        this.records = records;
        this.idleTask = idleTask;
        this.mainNtsName = mainNtsName;
    }

    void go(List<BasicNts> toplevel) {
        for (BasicNts bn : toplevel) {
            go(bn, !bn.name().equals(mainNtsName));
        }
    }

    /*
    splitByOrigin false: all states go to the task named after the unit.
    splitByOrigin true: the task name is the first part of the state's origin; states without a
    separator in their origin go to the idle task.
     */
    void go(BasicNts bn, boolean splitByOrigin) {
        LOGGER.debug("Split {} {}", bn.name(), splitByOrigin ? "by origin" : "as a whole");
        for (State state : bn.states()) {
            StateInfo stateInfo = records.createStateInfo(state);

            String taskName;
            if (splitByOrigin) {
                String origin = Origin.findOrNull(state);
                if (origin == null) {
                    throw new TaskAnalysisException(FailureKind.MISSING_ORIGIN_METADATA, state,
                            "State " + state.name() + " of " + bn.name() + " has no origin annotation");
                }
                taskName = Origin.taskNameOrNull(origin);
                if (taskName == null) {
                    idleTask.addState(stateInfo);
                    continue;
                }
                if (taskName.equals(mainNtsName)) {
                    LOGGER.warn("State {} of {} originates from the main unit {}", state.name(), bn.name(),
                            mainNtsName);
                }
            } else {
                taskName = bn.name();
            }

            Task task = nameToTask.get(taskName);
            if (task == null) {
                LOGGER.debug("New task with name: '{}'", taskName);
                task = new Task(taskName);
                tasks.add(task);
                nameToTask.put(taskName, task);
            }
            task.addState(stateInfo);
        }
    }

    List<Task> tasks() {
        return tasks;
    }

    Map<String, Task> nameToTask() {
        return nameToTask;
    }
}
