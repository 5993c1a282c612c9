package org.ntsa.analyzer.por.tasks;

import org.ntsa.analyzer.por.common.nts.Annotation;
import org.ntsa.analyzer.por.common.nts.State;

/*
The "origin" annotation is written by the inliner: "thread_func:0:st_0_0" says that the state was
inlined from the body of thread_func. Infrastructure states, such as those of the thread creation glue,
carry their own name only: "s_running_1".
 */
public class Origin {
    public static final String ORIGIN = "origin";
    public static final char SEPARATOR = ':';

    public static String findOrNull(State state) {
        Annotation annotation = state.annotationOrNull(ORIGIN, Annotation.Type.STRING);
        return annotation == null ? null : annotation.value();
    }

    /**
     * @param origin the value of an origin annotation
     * @return the part before the first separator, or null when there is no separator
     */
    public static String taskNameOrNull(String origin) {
        int pos = origin.indexOf(SEPARATOR);
        if (pos < 0) return null;
        return origin.substring(0, pos);
    }
}
