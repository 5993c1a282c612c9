package org.ntsa.analyzer.por.tasks;

/**
 * Outcome of {@link ComputeTasks#go()}: either all tasks, or the reason why the input was rejected.
 * A failure never carries a partial result.
 */
public interface TasksResult {

    boolean isSuccess();

    /**
     * @return the tasks
     * @throws TaskAnalysisException when the computation failed
     */
    Tasks orElseThrow();

    record Success(Tasks tasks) implements TasksResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Tasks orElseThrow() {
            return tasks;
        }
    }

    record Failure(TaskAnalysisException exception) implements TasksResult {
        public FailureKind kind() {
            return exception.getKind();
        }

        public String message() {
            return exception.getMessage();
        }

        public Object element() {
            return exception.getElement();
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Tasks orElseThrow() {
            throw exception;
        }
    }
}
