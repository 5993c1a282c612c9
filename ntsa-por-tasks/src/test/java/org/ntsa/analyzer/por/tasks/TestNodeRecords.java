package org.ntsa.analyzer.por.tasks;

import org.ntsa.analyzer.por.common.nts.State;
import org.ntsa.analyzer.por.common.nts.Transition;
import org.ntsa.analyzer.por.common.nts.impl.TransitionImpl;
import org.ntsa.analyzer.por.effects.Globals;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TestNodeRecords extends CommonTest {

    @DisplayName("a transition cannot get a second record")
    @Test
    public void testDuplicateTransition() {
        State s0 = state("s0");
        State s1 = state("s1");
        Transition t = new TransitionImpl(s0, s1, skip());
        NodeRecords records = new NodeRecords();
        assertNull(records.transitionInfoOrNull(t));

        TransitionInfo ti = records.createTransitionInfo(t, Globals.EMPTY);
        assertSame(ti, records.transitionInfoOrNull(t));
        assertSame(ti, records.transitionInfo(t));

        TaskAnalysisException tae = assertThrows(TaskAnalysisException.class,
                () -> records.createTransitionInfo(t, Globals.EMPTY));
        assertEquals(FailureKind.DUPLICATE_RECORD, tae.getKind());
        assertSame(t, tae.getElement());
        assertEquals(1, records.transitionCount());
    }

    @DisplayName("a working table sees the committed records as duplicates, and only publishes on commit")
    @Test
    public void testCommit() {
        State s0 = state("s0");
        State s1 = state("s1");
        Transition t = new TransitionImpl(s0, s1, skip());
        NodeRecords committed = new NodeRecords();
        NodeRecords work = new NodeRecords(committed);
        work.createStateInfo(s0);
        work.createTransitionInfo(t, Globals.EMPTY);
        assertEquals(0, committed.stateCount());
        assertNull(committed.stateInfoOrNull(s0));

        assertSame(committed, work.commit());
        assertEquals(1, committed.stateCount());
        assertEquals(1, committed.transitionCount());

        NodeRecords again = new NodeRecords(committed);
        TaskAnalysisException tae = assertThrows(TaskAnalysisException.class,
                () -> again.createTransitionInfo(t, Globals.EMPTY));
        assertSame(t, tae.getElement());
        assertThrows(TaskAnalysisException.class, () -> again.createStateInfo(s0));
        assertNotNull(again.createStateInfo(s1));
    }
}
