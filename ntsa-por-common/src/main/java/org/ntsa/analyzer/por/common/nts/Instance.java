package org.ntsa.analyzer.por.common.nts;

public interface Instance {

    BasicNts basicNts();

    int count();
}
