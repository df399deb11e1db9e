module com.tradesim.runner {
    // Internal modules
    requires com.tradesim.engine;
    requires com.tradesim.data;

    // Logging
    requires org.slf4j;

    // Exports
    exports com.tradesim.runner;
}
