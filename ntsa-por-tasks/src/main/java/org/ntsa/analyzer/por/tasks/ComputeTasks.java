package org.ntsa.analyzer.por.tasks;

import org.ntsa.analyzer.por.common.nts.BasicNts;
import org.ntsa.analyzer.por.common.nts.Instance;
import org.ntsa.analyzer.por.common.nts.Nts;
import org.ntsa.analyzer.por.common.nts.Variable;
import org.ntsa.analyzer.por.effects.ComputeGlobalEffect;
import org.ntsa.analyzer.por.effects.GlobalEffectComputer;
import org.ntsa.analyzer.por.effects.Globals;
import org.ntsa.analyzer.por.tasks.transitive.AllTasksActivateAll;
import org.ntsa.analyzer.por.tasks.transitive.TransitiveGlobals;
import org.ntsa.analyzer.por.tasks.users.ComputeGlobalVariableUsers;
import org.ntsa.analyzer.por.tasks.users.GlobalVariableUsers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/*
Splits a flattened program into tasks, and computes the globals used by each of them.

Preconditions on the program:
- it contains only instantiated units, none of which contains a call;
- every state of a unit other than the main unit carries an origin annotation;
- no state or transition has a record in the side table yet;
- no unit inlines the main unit.

Stages, in order: top-level units, split into tasks, numbering, transition globals, direct globals,
boundary states, transitive globals, global variable users.
 */
public class ComputeTasks {
    private static final Logger LOGGER = LoggerFactory.getLogger(ComputeTasks.class);

    public static final String IDLE_TASK_NAME = "idle_worker_task";

    private final Nts nts;
    private final Options options;

    public record Options(String mainNtsName,
                          GlobalEffectComputer globalEffectComputer,
                          TransitiveGlobals transitiveGlobals,
                          NodeRecords nodeRecords) {
        public static class Builder {
            private final String mainNtsName;
            private GlobalEffectComputer globalEffectComputer;
            private TransitiveGlobals transitiveGlobals;
            private NodeRecords nodeRecords;

            public Builder(String mainNtsName) {
                this.mainNtsName = Objects.requireNonNull(mainNtsName);
            }

            public Builder setGlobalEffectComputer(GlobalEffectComputer globalEffectComputer) {
                this.globalEffectComputer = globalEffectComputer;
                return this;
            }

            public Builder setTransitiveGlobals(TransitiveGlobals transitiveGlobals) {
                this.transitiveGlobals = transitiveGlobals;
                return this;
            }

            // when not set, each call to go() starts with an empty table; the table only changes on success
            public Builder setNodeRecords(NodeRecords nodeRecords) {
                this.nodeRecords = nodeRecords;
                return this;
            }

            public Options build() {
                return new Options(mainNtsName,
                        globalEffectComputer == null ? new ComputeGlobalEffect() : globalEffectComputer,
                        transitiveGlobals == null ? new AllTasksActivateAll() : transitiveGlobals,
                        nodeRecords);
            }
        }
    }

    public ComputeTasks(Nts nts, String mainNtsName) {
        this(nts, new Options.Builder(mainNtsName).build());
    }

    public ComputeTasks(Nts nts, Options options) {
        this.nts = Objects.requireNonNull(nts);
        this.options = Objects.requireNonNull(options);
    }

    public TasksResult go() {
        try {
            return new TasksResult.Success(compute());
        } catch (TaskAnalysisException tae) {
            LOGGER.error("Cannot compute tasks of {}: {} {}", nts.name(), tae.getKind(), tae.getMessage());
            return new TasksResult.Failure(tae);
        }
    }

    private Tasks compute() {
        NodeRecords records = new NodeRecords(options.nodeRecords());
        List<BasicNts> toplevel = toplevelBasicNtses(nts);
        LOGGER.info("Computing tasks of {}: {} top-level units", nts.name(), toplevel.size());

        Task idleTask = new Task(IDLE_TASK_NAME);
        SplitToTasks splitToTasks = new SplitToTasks(records, idleTask, options.mainNtsName());
        splitToTasks.go(toplevel);
        List<Task> tasks = splitToTasks.tasks();
        int n = 0;
        for (Task task : tasks) {
            task.setNumber(n++);
        }
        Task mainTask = splitToTasks.nameToTask().get(options.mainNtsName());
        if (mainTask == null) {
            LOGGER.warn("Main unit {} is not instantiated in {}", options.mainNtsName(), nts.name());
        }
        LOGGER.info("Split into {} tasks, {} states in the idle task", tasks.size(), idleTask.states().size());

        new ComputeTransitionInfo(nts, records, options.globalEffectComputer()).go(toplevel);
        LOGGER.info("Computed globals of {} transitions", records.transitionCount());

        List<Task> allTasks = new ArrayList<>(tasks);
        allTasks.add(idleTask);
        new ComputeDirectGlobals(records).go(toplevel, allTasks);
        new ComputeBoundaryStates(records).go(toplevel);

        Map<Task, Globals> transitive = options.transitiveGlobals().compute(allTasks);
        for (Task task : allTasks) {
            Globals globals = transitive.get(task);
            if (globals == null) {
                throw new IllegalStateException("No transitive globals computed for task " + task.name());
            }
            task.setTransitiveGlobals(globals);
        }

        Map<Variable, GlobalVariableUsers> users = new ComputeGlobalVariableUsers().go(nts.globalVariables(),
                allTasks);
        Tasks result = new Tasks(toplevel, tasks, splitToTasks.nameToTask(), mainTask, idleTask, records.commit(),
                users);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Transitions:\n{}", result.printTransitionInfo());
            LOGGER.debug("Tasks:\n{}", result.print());
        }
        return result;
    }

    /*
    the units that are instantiated in the program, in order of instantiation
     */
    static List<BasicNts> toplevelBasicNtses(Nts nts) {
        Set<BasicNts> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        return nts.instances().stream()
                .map(Instance::basicNts)
                .filter(seen::add)
                .collect(Collectors.toUnmodifiableList());
    }
}
