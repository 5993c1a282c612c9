module org.ntsa.analyzer.por.effects {
    requires org.ntsa.analyzer.por.common;

    requires org.slf4j;

    exports org.ntsa.analyzer.por.effects;
}
