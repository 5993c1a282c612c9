package org.ntsa.analyzer.por.tasks;

import org.ntsa.analyzer.por.common.nts.BasicNts;
import org.ntsa.analyzer.por.common.nts.State;
import org.ntsa.analyzer.por.common.nts.Transition;
import org.ntsa.analyzer.por.common.nts.Variable;
import org.ntsa.analyzer.por.effects.Globals;
import org.ntsa.analyzer.por.tasks.users.GlobalVariableUsers;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The result of the task computation, read-only for its consumers.
 * <p>
 * Every state of a top-level unit belongs to one of {@link #tasks()} or to the idle task;
 * every transition has its globals; every task has its direct and transitive globals.
 * The idle task is not part of {@link #tasks()} nor of the name lookup.
 */
public class Tasks {
    private final List<BasicNts> toplevelBasicNtses;
    private final List<Task> tasks;
    private final Map<String, Task> nameToTask;
    private final Task mainTask;
    private final Task idleTask;
    private final NodeRecords records;
    private final Map<Variable, GlobalVariableUsers> globalVariableUsers;

    Tasks(List<BasicNts> toplevelBasicNtses,
          List<Task> tasks,
          Map<String, Task> nameToTask,
          Task mainTask,
          Task idleTask,
          NodeRecords records,
          Map<Variable, GlobalVariableUsers> globalVariableUsers) {
        this.toplevelBasicNtses = List.copyOf(toplevelBasicNtses);
        this.tasks = List.copyOf(tasks);
        this.nameToTask = Collections.unmodifiableMap(new LinkedHashMap<>(nameToTask));
        this.mainTask = mainTask;
        this.idleTask = idleTask;
        this.records = records;
        this.globalVariableUsers = globalVariableUsers;
    }

    public List<BasicNts> toplevelBasicNtses() {
        return toplevelBasicNtses;
    }

    // in order of first appearance
    public List<Task> tasks() {
        return tasks;
    }

    public Stream<Task> allTasks() {
        return Stream.concat(tasks.stream(), Stream.of(idleTask));
    }

    // in the same order as tasks()
    public Map<String, Task> nameToTask() {
        return nameToTask;
    }

    public Task taskOrNull(String name) {
        return nameToTask.get(name);
    }

    // null when the main unit is not instantiated
    public Task mainTask() {
        return mainTask;
    }

    public Task idleTask() {
        return idleTask;
    }

    public NodeRecords records() {
        return records;
    }

    public Task taskOf(State state) {
        return records.stateInfo(state).task();
    }

    public Globals globalsOf(Transition transition) {
        return records.transitionInfo(transition).globals();
    }

    public Map<Variable, GlobalVariableUsers> globalVariableUsers() {
        return globalVariableUsers;
    }

    public GlobalVariableUsers globalVariableUsers(Variable variable) {
        GlobalVariableUsers users = globalVariableUsers.get(variable);
        if (users == null) throw new IllegalArgumentException("Not a global variable of the program: " + variable);
        return users;
    }

    public String printTransitionInfo() {
        return toplevelBasicNtses.stream()
                .map(bn -> bn.name() + ":\n" + bn.transitions().stream()
                        .map(t -> "  " + records.transitionInfo(t) + "\n")
                        .collect(Collectors.joining()))
                .collect(Collectors.joining());
    }

    public String print() {
        return allTasks().map(Tasks::print).collect(Collectors.joining("\n"));
    }

    private static String print(Task task) {
        return task + " " + task.states().stream().map(si -> si.state().name())
                .collect(Collectors.joining(", ", "[", "]"))
               + " direct: " + task.directGlobals()
               + "; transitive: " + task.transitiveGlobals();
    }
}
