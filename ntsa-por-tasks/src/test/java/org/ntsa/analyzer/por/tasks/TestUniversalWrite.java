package org.ntsa.analyzer.por.tasks;

import org.ntsa.analyzer.por.common.nts.BasicNts;
import org.ntsa.analyzer.por.common.nts.Nts;
import org.ntsa.analyzer.por.common.nts.State;
import org.ntsa.analyzer.por.common.nts.Variable;
import org.ntsa.analyzer.por.common.nts.impl.BasicNtsImpl;
import org.ntsa.analyzer.por.common.nts.impl.NtsImpl;
import org.ntsa.analyzer.por.common.nts.impl.VariableImpl;
import org.ntsa.analyzer.por.effects.GlobalWrites;
import org.ntsa.analyzer.por.tasks.users.GlobalVariableUsers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TestUniversalWrite extends CommonTest {

    @DisplayName("one unresolved write makes the task's writes universal")
    @Test
    public void test() {
        Variable g = VariableImpl.global("g");
        Variable k = VariableImpl.global("k");
        State m0 = initial("m0", null);
        BasicNts main = new BasicNtsImpl.Builder("main").addState(m0).build();

        State u0 = state("u0", "U:0:u0");
        State u1 = state("u1", "U:0:u1");
        State u2 = state("u2", "U:0:u2");
        State r0 = state("r0", "R:0:r0");
        State r1 = state("r1", "R:0:r1");
        BasicNts worker = new BasicNtsImpl.Builder("worker")
                .addStates(u0, u1, u2, r0, r1)
                .addTransition(u0, u1, writes(g))
                .addTransition(u1, u2, unresolvedWrite("p"))
                .addTransition(r0, r1, reads(g))
                .build();
        Nts nts = new NtsImpl.Builder("program").addGlobalVariables(g, k).addInstance(main, 1)
                .addInstance(worker, 1).build();

        Tasks tasks = new ComputeTasks(nts, "main").go().orElseThrow();
        Task U = tasks.taskOrNull("U");
        Task R = tasks.taskOrNull("R");
        assertEquals(GlobalWrites.UNIVERSAL, U.directGlobals().writes());
        assertTrue(U.directGlobals().writes().contains(g));
        assertTrue(U.directGlobals().writes().contains(k));
        assertTrue(U.directGlobals().writes().contains(VariableImpl.global("neverMentioned")));
        assertFalse(R.directGlobals().writes().isUniversal());
        assertTrue(U.directGlobals().mayCollideWith(R.directGlobals()));
        assertFalse(U.directGlobals().mayCollideWith(tasks.mainTask().directGlobals()));

        tasks.allTasks().forEach(t -> assertTrue(t.transitiveGlobals().writes().isUniversal()));

        GlobalVariableUsers kUsers = tasks.globalVariableUsers(k);
        assertEquals(Set.of(U), kUsers.writers());
        assertTrue(kUsers.readers().isEmpty());
        assertEquals(List.of(U), List.copyOf(tasks.globalVariableUsers(g).writers()));
        assertEquals(List.of(R), List.copyOf(tasks.globalVariableUsers(g).readers()));
    }
}
