package org.ntsa.analyzer.por.effects;

import org.ntsa.analyzer.por.common.nts.Variable;
import org.ntsa.analyzer.por.common.nts.impl.VariableImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestGlobals {
    private Variable g, g1, g2;
    private List<Globals> samples;

    @BeforeEach
    public void beforeEach() {
        g = VariableImpl.global("g");
        g1 = VariableImpl.global("g1");
        g2 = VariableImpl.global("g2");
        samples = List.of(
                Globals.EMPTY,
                new Globals(GlobalReads.of(g), GlobalWrites.NONE),
                new Globals(GlobalReads.NONE, GlobalWrites.of(g)),
                new Globals(GlobalReads.of(g1), GlobalWrites.of(g2)),
                new Globals(GlobalReads.of(g1, g2), GlobalWrites.NONE),
                new Globals(GlobalReads.NONE, GlobalWrites.UNIVERSAL),
                new Globals(GlobalReads.of(g), GlobalWrites.UNIVERSAL));
    }

    @DisplayName("collision is commutative")
    @Test
    public void testCommutative() {
        for (Globals a : samples) {
            for (Globals b : samples) {
                assertEquals(a.mayCollideWith(b), b.mayCollideWith(a), a + " vs " + b);
            }
        }
    }

    @DisplayName("union is commutative, associative and idempotent")
    @Test
    public void testUnionLaws() {
        for (Globals a : samples) {
            assertEquals(a, a.union(a));
            for (Globals b : samples) {
                assertEquals(a.union(b), b.union(a));
                for (Globals c : samples) {
                    assertEquals(a.union(b).union(c), a.union(b.union(c)));
                }
            }
        }
    }

    @Test
    public void testUnionWithUniversal() {
        Globals universal = new Globals(GlobalReads.NONE, GlobalWrites.UNIVERSAL);
        for (Globals a : samples) {
            Globals u = a.union(universal);
            assertTrue(u.writes().isUniversal());
            assertEquals(a.reads(), u.reads());
        }
    }

    @DisplayName("write vs read of the same variable")
    @Test
    public void testWriteRead() {
        Globals a = new Globals(GlobalReads.NONE, GlobalWrites.of(g));
        Globals b = new Globals(GlobalReads.of(g), GlobalWrites.NONE);
        assertTrue(a.mayCollideWith(b));
        assertTrue(a.mayCollideWith(a));
        assertFalse(b.mayCollideWith(b));
    }

    @DisplayName("reads of different variables do not collide")
    @Test
    public void testReadRead() {
        Globals c = new Globals(GlobalReads.of(g1), GlobalWrites.NONE);
        Globals d = new Globals(GlobalReads.of(g2), GlobalWrites.NONE);
        assertFalse(c.mayCollideWith(d));
    }

    @Test
    public void testUniversal() {
        Globals u = new Globals(GlobalReads.NONE, GlobalWrites.UNIVERSAL);
        assertTrue(u.mayCollideWith(u));
        assertTrue(u.mayCollideWith(new Globals(GlobalReads.of(g1), GlobalWrites.NONE)));
        assertTrue(u.mayCollideWith(new Globals(GlobalReads.NONE, GlobalWrites.of(g2))));
        assertFalse(u.mayCollideWith(Globals.EMPTY));
    }

    @Test
    public void testToString() {
        Globals a = new Globals(GlobalReads.of(g2, g1), GlobalWrites.UNIVERSAL);
        assertEquals("reads: {g1, g2}, writes: *", a.toString());
        assertEquals("reads: {}, writes: {}", Globals.EMPTY.toString());
        assertTrue(Globals.EMPTY.isEmpty());
    }
}
