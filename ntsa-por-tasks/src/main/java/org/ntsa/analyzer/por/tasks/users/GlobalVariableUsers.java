package org.ntsa.analyzer.por.tasks.users;

import org.ntsa.analyzer.por.common.nts.Variable;
import org.ntsa.analyzer.por.tasks.Task;

import java.util.Set;
import java.util.stream.Collectors;

/*
The tasks whose direct globals read, resp. may write, a global variable.
A task with a universal write is a writer of every global variable.
 */
public record GlobalVariableUsers(Variable variable, Set<Task> readers, Set<Task> writers) {

    @Override
    public String toString() {
        return variable.name() + ": read by " + names(readers) + ", written by " + names(writers);
    }

    private static String names(Set<Task> tasks) {
        return tasks.stream().map(Task::name).collect(Collectors.joining(", ", "[", "]"));
    }
}
