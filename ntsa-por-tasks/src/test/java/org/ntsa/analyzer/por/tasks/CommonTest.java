package org.ntsa.analyzer.por.tasks;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.ntsa.analyzer.por.common.nts.State;
import org.ntsa.analyzer.por.common.nts.TransitionRule;
import org.ntsa.analyzer.por.common.nts.Variable;
import org.ntsa.analyzer.por.common.nts.impl.AnnotationImpl;
import org.ntsa.analyzer.por.common.nts.impl.StateImpl;
import org.ntsa.analyzer.por.common.nts.impl.TransitionRuleImpl;
import org.junit.jupiter.api.BeforeAll;
import org.slf4j.LoggerFactory;

public class CommonTest {

    @BeforeAll
    public static void beforeAll() {
        ((Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)).setLevel(Level.INFO);
        ((Logger) LoggerFactory.getLogger(ComputeTasks.class)).setLevel(Level.DEBUG);
        ((Logger) LoggerFactory.getLogger(SplitToTasks.class)).setLevel(Level.DEBUG);
    }

    protected static State state(String name) {
        return new StateImpl.Builder(name).build();
    }

    protected static State state(String name, String origin) {
        return new StateImpl.Builder(name).addAnnotation(AnnotationImpl.string(Origin.ORIGIN, origin)).build();
    }

    protected static State initial(String name, String origin) {
        StateImpl.Builder builder = new StateImpl.Builder(name).setInitial(true);
        if (origin != null) builder.addAnnotation(AnnotationImpl.string(Origin.ORIGIN, origin));
        return builder.build();
    }

    protected static State fin(String name, String origin) {
        StateImpl.Builder builder = new StateImpl.Builder(name).setFinal(true);
        if (origin != null) builder.addAnnotation(AnnotationImpl.string(Origin.ORIGIN, origin));
        return builder.build();
    }

    protected static TransitionRule skip() {
        return TransitionRuleImpl.SKIP;
    }

    protected static TransitionRule reads(Variable... variables) {
        TransitionRuleImpl.Builder builder = new TransitionRuleImpl.Builder();
        for (Variable v : variables) builder.addRead(v);
        return builder.build();
    }

    protected static TransitionRule writes(Variable... variables) {
        TransitionRuleImpl.Builder builder = new TransitionRuleImpl.Builder();
        for (Variable v : variables) builder.addWrite(v);
        return builder.build();
    }

    protected static TransitionRule unresolvedWrite(String address) {
        return new TransitionRuleImpl.Builder().addUnresolvedWrite(address).build();
    }
}
