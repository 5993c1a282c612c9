module org.ntsa.analyzer.por.common {
    exports org.ntsa.analyzer.por.common;
    exports org.ntsa.analyzer.por.common.nts;
    exports org.ntsa.analyzer.por.common.nts.impl;
}
