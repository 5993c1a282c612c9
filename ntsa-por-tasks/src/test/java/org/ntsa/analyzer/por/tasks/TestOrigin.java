package org.ntsa.analyzer.por.tasks;

import org.ntsa.analyzer.por.common.nts.State;
import org.ntsa.analyzer.por.common.nts.impl.AnnotationImpl;
import org.ntsa.analyzer.por.common.nts.impl.StateImpl;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TestOrigin {

    @Test
    public void testTaskName() {
        assertEquals("worker", Origin.taskNameOrNull("worker:3:label"));
        assertEquals("thread_func", Origin.taskNameOrNull("thread_func:0:st_0_0"));
        assertNull(Origin.taskNameOrNull("s_running_1"));
        assertEquals("", Origin.taskNameOrNull(":x"));
    }

    @Test
    public void testFind() {
        State s = new StateImpl.Builder("s")
                .addAnnotation(AnnotationImpl.integer(Origin.ORIGIN, 3))
                .addAnnotation(AnnotationImpl.string("comment", "x:y"))
                .addAnnotation(AnnotationImpl.string(Origin.ORIGIN, "worker:3:label"))
                .build();
        assertEquals("worker:3:label", Origin.findOrNull(s));

        State t = new StateImpl.Builder("t").addAnnotation(AnnotationImpl.integer(Origin.ORIGIN, 3)).build();
        assertNull(Origin.findOrNull(t));
    }
}
