module org.ntsa.analyzer.por.tasks {
    requires org.ntsa.analyzer.por.common;
    requires org.ntsa.analyzer.por.effects;

    requires org.slf4j;

    exports org.ntsa.analyzer.por.tasks;
    exports org.ntsa.analyzer.por.tasks.transitive;
    exports org.ntsa.analyzer.por.tasks.users;
}
