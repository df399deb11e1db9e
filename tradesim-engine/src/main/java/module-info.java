module com.tradesim.engine {
    // Exports
    exports com.tradesim.engine;
    exports com.tradesim.engine.fill;
    exports com.tradesim.engine.order;
    exports com.tradesim.engine.report;

    // Dependencies
    requires transitive com.tradesim.core;
    requires com.fasterxml.jackson.databind;
    requires org.slf4j;

    // Jackson needs reflection access
    opens com.tradesim.engine.order to com.fasterxml.jackson.databind;
    opens com.tradesim.engine.report to com.fasterxml.jackson.databind;
}
