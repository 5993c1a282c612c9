package org.ntsa.analyzer.por.common.nts;

public interface Transition {

    State from();

    State to();

    TransitionRule rule();
}
