package org.ntsa.analyzer.por.common.nts.impl;

import org.ntsa.analyzer.por.common.nts.BasicNts;
import org.ntsa.analyzer.por.common.nts.Instance;

public record InstanceImpl(BasicNts basicNts, int count) implements Instance {

    public InstanceImpl {
        if (count < 1) throw new IllegalArgumentException("Instance count must be positive, was " + count);
    }

    @Override
    public String toString() {
        return basicNts.name() + "[" + count + "]";
    }
}
